package com.gdin.inspection.semanticrouter.index.model;

import lombok.Value;

import java.util.List;

/**
 * 近邻检索结果, 按相似度降序
 */
@Value
public class QueryResult {
    List<ScoredRoute> matches;

    public double[] scores() {
        return matches.stream().mapToDouble(ScoredRoute::getScore).toArray();
    }

    public List<String> routes() {
        return matches.stream().map(ScoredRoute::getRoute).toList();
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }
}

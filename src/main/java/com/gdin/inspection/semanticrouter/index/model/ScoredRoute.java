package com.gdin.inspection.semanticrouter.index.model;

import lombok.Value;

@Value
public class ScoredRoute {
    // 余弦相似度, [-1, 1]
    double score;

    String route;
}

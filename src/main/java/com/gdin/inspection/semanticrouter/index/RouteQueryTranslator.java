package com.gdin.inspection.semanticrouter.index;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.semanticrouter.index.model.QueryResult;
import com.gdin.inspection.semanticrouter.index.model.ScoredRoute;
import com.gdin.inspection.semanticrouter.typesense.model.SearchHit;
import com.gdin.inspection.semanticrouter.typesense.model.SearchResponse;
import org.typesense.model.MultiSearchCollectionParameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.gdin.inspection.semanticrouter.index.RouteDocumentFields.*;

/**
 * 查询向量 -> Typesense 近邻检索请求; 检索结果的余弦距离 -> 余弦相似度
 */
public class RouteQueryTranslator {
    /**
     * Typesense 余弦距离的最大值(完全相反)
     */
    public static final double MAX_DISTANCE = 2.0;

    // Typesense 单页最多返回 250 条
    static final int MAX_PER_PAGE = 250;

    /**
     * 距离 [0, 2] 线性映射到相似度 [1, -1], 单调递减, 近邻顺序即相似度降序
     */
    public static double toSimilarity(Double distance) {
        double d = distance == null ? MAX_DISTANCE : distance;
        return 1.0 - d / 2.0;
    }

    public MultiSearchCollectionParameters toSearch(float[] vector, int topK, List<String> routeFilter) {
        if (vector == null || vector.length == 0) throw new IllegalArgumentException("查询向量不能为空");
        if (topK <= 0) throw new IllegalArgumentException("topK 必须大于 0: " + topK);

        // 配置项文档是全 0 向量, 不参与近邻检索
        String filter = labelNotEquals(CONFIG_ROUTE);
        if (CollectionUtil.isNotEmpty(routeFilter)) {
            filter = anyLabel(routeFilter) + " && " + filter;
        }
        MultiSearchCollectionParameters parameters = new MultiSearchCollectionParameters();
        parameters.setQ("*");
        parameters.setVectorQuery(vectorQuery(vector, topK));
        parameters.setFilterBy(filter);
        parameters.setExcludeFields(VECTOR);
        parameters.setPerPage(Math.min(topK, MAX_PER_PAGE));
        return parameters;
    }

    public QueryResult toResult(SearchResponse response) {
        List<ScoredRoute> matches = new ArrayList<>();
        if (response == null || response.getHits() == null) return new QueryResult(matches);
        for (SearchHit hit : response.getHits()) {
            Map<String, Object> document = hit.getDocument();
            Object route = document == null ? null : document.get(ROUTE);
            if (route == null) continue;
            matches.add(new ScoredRoute(toSimilarity(hit.getVectorDistance()), route.toString()));
        }
        return new QueryResult(matches);
    }

    static String vectorQuery(float[] vector, int topK) {
        StringBuilder sb = new StringBuilder(VECTOR).append(":([");
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) sb.append(',');
            sb.append(vector[i]);
        }
        return sb.append("], k:").append(topK).append(')').toString();
    }

    /**
     * 多个路由之间是 OR 关系; 表达式长度随路由数线性增长
     */
    static String anyLabel(List<String> labels) {
        return labels.stream()
                .map(RouteQueryTranslator::labelEquals)
                .collect(Collectors.joining(" || ", "(", ")"));
    }

    // 反引号包裹, 路由名中的空格、逗号不会被当成运算符
    static String labelEquals(String label) {
        return ROUTE + ":=`" + quotable(label) + "`";
    }

    static String labelNotEquals(String label) {
        return ROUTE + ":!=`" + quotable(label) + "`";
    }

    /**
     * Typesense 的过滤语法没有反引号转义, 含反引号的值无法被精确匹配
     */
    static String quotable(String label) {
        if (label == null || label.indexOf('`') >= 0) {
            throw new IllegalArgumentException("路由名不能为空且不能包含反引号: " + label);
        }
        return label;
    }
}

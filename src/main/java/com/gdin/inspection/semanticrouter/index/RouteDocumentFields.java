package com.gdin.inspection.semanticrouter.index;

/**
 * Typesense 文档字段名, 与 collection schema 保持一致
 */
public final class RouteDocumentFields {
    public static final String ID = "id";
    public static final String SR_ID = "sr_id";
    public static final String ROUTE = "sr_route";
    public static final String UTTERANCE = "sr_utterance";
    public static final String FUNCTION_SCHEMA = "sr_function_schema";
    public static final String METADATA = "sr_metadata";
    public static final String VECTOR = "vec";

    // 配置项文档使用的保留路由名, 不会与真实路由重名
    public static final String CONFIG_ROUTE = "__config__";

    private RouteDocumentFields() {
    }
}

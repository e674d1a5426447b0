package com.gdin.inspection.semanticrouter.index.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 一条 (路由, 话术) 及其向量
 */
@Value
@Builder
public class IndexedRecord {
    // sha256(label + "::" + text) 的前 16 位
    String id;

    String label;

    String text;

    // 例如 function call schema, 可为空
    Map<String, Object> structuredSchema;

    Map<String, Object> metadata;

    float[] vector;
}

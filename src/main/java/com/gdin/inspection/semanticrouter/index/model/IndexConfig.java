package com.gdin.inspection.semanticrouter.index.model;

import lombok.Value;

@Value
public class IndexConfig {
    String type;

    // 0 表示维度未知
    int dimensions;

    // collection 中的文档数, collection 不存在时为 0
    long vectors;

    public static IndexConfig empty(String type) {
        return new IndexConfig(type, 0, 0L);
    }
}

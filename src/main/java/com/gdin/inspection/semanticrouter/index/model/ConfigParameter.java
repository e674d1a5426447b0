package com.gdin.inspection.semanticrouter.index.model;

import lombok.Builder;
import lombok.Value;

/**
 * 存在索引里的一个配置项, 用于比对本地路由与远端索引是否一致(如路由哈希)
 */
@Value
@Builder
public class ConfigParameter {
    String field;

    // 不存在时为空字符串
    @Builder.Default
    String value = "";

    String scope;

    public boolean isEmpty() {
        return value == null || value.isEmpty();
    }
}

package com.gdin.inspection.semanticrouter.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

/**
 * Typesense 连接配置, 默认值与 application.yml 中环境变量的兜底值保持一致
 */
@Data
@ConfigurationProperties(prefix = "gdin.ai.typesense")
@Component
public class TypesenseProperties implements Serializable {
    private String host = "localhost";
    private String port = "8108";
    private String protocol = "http";
    // 允许为空, 未授权会在第一次调用时以传输异常的形式暴露
    private String apiKey = "";
    private String collectionName = "semantic_routes";
    private Long connectionTimeoutSeconds = 10L;
    // 全量遍历时每页文档数, 超过 250 时按 250 处理
    private Integer pageSize = 250;

    public String getBaseUrl() {
        return protocol + "://" + host + ":" + port;
    }
}

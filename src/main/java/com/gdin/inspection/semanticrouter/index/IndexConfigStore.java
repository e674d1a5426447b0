package com.gdin.inspection.semanticrouter.index;

import com.gdin.inspection.semanticrouter.index.model.ConfigParameter;
import com.gdin.inspection.semanticrouter.typesense.TypesenseClient;
import com.gdin.inspection.semanticrouter.typesense.TypesenseObjectNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * 以保留路由名下的普通文档保存配置项, 每个 key 一条文档, id 为 "__config__" + key
 */
@Slf4j
@RequiredArgsConstructor
public class IndexConfigStore {
    private final TypesenseClient typesenseClient;
    private final RouteDocumentMapper documentMapper;

    public static String configId(String field) {
        return RouteDocumentFields.CONFIG_ROUTE + field;
    }

    /**
     * key 不存在(或 collection 不存在)时返回空值而不是报错
     */
    public ConfigParameter read(String collectionName, String field, String scope) {
        try {
            Map<String, Object> doc = typesenseClient.retrieveDocument(collectionName, configId(field));
            Object value = doc == null ? null : doc.get(RouteDocumentFields.UTTERANCE);
            return ConfigParameter.builder()
                    .field(field)
                    .value(value == null ? "" : value.toString())
                    .scope(scope)
                    .build();
        } catch (TypesenseObjectNotFoundException e) {
            return ConfigParameter.builder().field(field).scope(scope).build();
        }
    }

    /**
     * 配置项文档同样要满足向量字段的维度要求, 因此写入与 collection 同维度的全 0 向量
     */
    public ConfigParameter write(String collectionName, ConfigParameter config, int dimensions) {
        typesenseClient.upsertDocument(collectionName,
                documentMapper.toConfigDocument(configId(config.getField()), config.getValue(), dimensions));
        log.debug("已写入配置项 {} = {}", config.getField(), config.getValue());
        return config;
    }
}

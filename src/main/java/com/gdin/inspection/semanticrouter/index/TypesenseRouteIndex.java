package com.gdin.inspection.semanticrouter.index;

import com.gdin.inspection.semanticrouter.config.properties.TypesenseProperties;
import com.gdin.inspection.semanticrouter.index.model.ConfigParameter;
import com.gdin.inspection.semanticrouter.index.model.CorpusSnapshot;
import com.gdin.inspection.semanticrouter.index.model.IndexConfig;
import com.gdin.inspection.semanticrouter.index.model.QueryResult;
import com.gdin.inspection.semanticrouter.typesense.TypesenseClient;
import com.gdin.inspection.semanticrouter.typesense.TypesenseException;
import com.gdin.inspection.semanticrouter.typesense.TypesenseObjectNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.typesense.model.CollectionResponse;
import org.typesense.model.MultiSearchCollectionParameters;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 以 Typesense collection 为存储的路由向量索引。
 * <p>
 * 不在本地缓存任何索引状态, collection 是唯一的数据来源;
 * 唯一的内存状态是已知的向量维度, 仅用于建表和写配置项。
 */
@Slf4j
@Component
public class TypesenseRouteIndex implements RouteIndex {
    public static final String TYPE = "typesense";

    private final TypesenseClient typesenseClient;
    private final String collectionName;

    private final CollectionSchemaManager schemaManager;
    private final RouteBatchWriter batchWriter;
    private final RouteQueryTranslator queryTranslator;
    private final RouteCorpusPaginator paginator;
    private final IndexConfigStore configStore;

    private volatile Integer dimensions;

    public TypesenseRouteIndex(TypesenseClient typesenseClient, TypesenseProperties typesenseProperties) {
        this.typesenseClient = typesenseClient;
        this.collectionName = typesenseProperties.getCollectionName();
        RouteDocumentMapper documentMapper = new RouteDocumentMapper();
        this.schemaManager = new CollectionSchemaManager(typesenseClient);
        this.batchWriter = new RouteBatchWriter(typesenseClient, schemaManager, documentMapper);
        this.queryTranslator = new RouteQueryTranslator();
        this.paginator = new RouteCorpusPaginator(typesenseClient, typesenseProperties.getPageSize());
        this.configStore = new IndexConfigStore(typesenseClient, documentMapper);
    }

    @Override
    public String type() {
        return TYPE;
    }

    public String getCollectionName() {
        return collectionName;
    }

    public Integer getDimensions() {
        return dimensions;
    }

    @Override
    public void add(List<float[]> embeddings,
                    List<String> routes,
                    List<?> utterances,
                    List<Map<String, Object>> structuredSchemas,
                    List<Map<String, Object>> metadataList) {
        batchWriter.add(collectionName, embeddings, routes, utterances, structuredSchemas, metadataList);
        this.dimensions = embeddings.get(0).length;
    }

    @Override
    public void delete(String route) {
        batchWriter.deleteByLabel(collectionName, route);
    }

    @Override
    public void deleteAll() {
        batchWriter.deleteCollection(collectionName);
    }

    @Override
    public void deleteIndex() {
        deleteAll();
    }

    @Override
    public void deleteRecords(Map<String, ? extends Collection<String>> routesToDelete) {
        int deleted = batchWriter.deleteRecords(collectionName, routesToDelete);
        log.info("已从 Typesense 删除 {} 条话术", deleted);
    }

    /**
     * 不抛异常: collection 不存在或服务不可用时返回全 0 的描述
     */
    @Override
    public IndexConfig describe() {
        try {
            CollectionResponse schema = typesenseClient.retrieveCollection(collectionName);
            long vectors = schema == null || schema.getNumDocuments() == null ? 0L : schema.getNumDocuments();
            return new IndexConfig(TYPE, resolveDimensions(schema).orElse(0), vectors);
        } catch (TypesenseObjectNotFoundException e) {
            return IndexConfig.empty(TYPE);
        } catch (TypesenseException e) {
            log.warn("读取 Typesense collection '{}' 失败: {}", collectionName, e.getMessage());
            return IndexConfig.empty(TYPE);
        }
    }

    @Override
    public boolean isReady() {
        try {
            typesenseClient.retrieveCollection(collectionName);
            return true;
        } catch (Exception e) {
            log.debug("Typesense collection '{}' 未就绪: {}", collectionName, e.getMessage());
            return false;
        }
    }

    /**
     * collection 尚未创建时没有任何路由可以命中, 返回空结果
     */
    @Override
    public QueryResult query(float[] vector, int topK, List<String> routeFilter) {
        MultiSearchCollectionParameters parameters = queryTranslator.toSearch(vector, topK, routeFilter);
        try {
            return queryTranslator.toResult(typesenseClient.search(collectionName, parameters));
        } catch (TypesenseObjectNotFoundException e) {
            log.debug("Typesense collection '{}' 不存在, 查询结果为空", collectionName);
            return new QueryResult(List.of());
        }
    }

    @Override
    public CorpusSnapshot enumerateAll(String prefix, boolean includeMetadata) {
        try {
            return paginator.enumerateAll(collectionName, prefix, includeMetadata);
        } catch (TypesenseObjectNotFoundException e) {
            log.debug("Typesense collection '{}' 不存在, 没有可遍历的文档", collectionName);
            return new CorpusSnapshot(List.of(), List.of());
        }
    }

    @Override
    public ConfigParameter readConfig(String field, String scope) {
        return configStore.read(collectionName, field, scope);
    }

    /**
     * collection 不存在时跳过写入(此时没有向量维度可用), 原样返回配置项
     */
    @Override
    public ConfigParameter writeConfig(ConfigParameter config) {
        Optional<CollectionResponse> schema = schemaManager.find(collectionName);
        if (schema.isEmpty()) {
            log.warn("Typesense collection '{}' 不存在, 跳过写入配置项 {}", collectionName, config.getField());
            return config;
        }
        return configStore.write(collectionName, config, resolveDimensions(schema.get()).orElse(1));
    }

    /**
     * 文档数, 任何异常都返回 0
     */
    @Override
    public long size() {
        try {
            CollectionResponse schema = typesenseClient.retrieveCollection(collectionName);
            return schema == null || schema.getNumDocuments() == null ? 0L : schema.getNumDocuments();
        } catch (Exception e) {
            return 0L;
        }
    }

    @Override
    public void initIndex() {
        if (dimensions != null) schemaManager.ensureCollection(collectionName, dimensions);
    }

    private Optional<Integer> resolveDimensions(CollectionResponse schema) {
        if (dimensions != null) return Optional.of(dimensions);
        Optional<Integer> remote = CollectionSchemaManager.vectorDimensions(schema);
        remote.ifPresent(d -> this.dimensions = d);
        return remote;
    }
}

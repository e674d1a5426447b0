package com.gdin.inspection.semanticrouter.index;

import com.gdin.inspection.semanticrouter.index.model.ConfigParameter;
import com.gdin.inspection.semanticrouter.index.model.CorpusSnapshot;
import com.gdin.inspection.semanticrouter.index.model.IndexConfig;
import com.gdin.inspection.semanticrouter.index.model.QueryResult;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 语义路由使用的向量索引。
 * <p>
 * 所有操作都是同步、可重试的; 需要非阻塞调用时使用 *Async 方法并自行提供线程池。
 */
public interface RouteIndex {

    String type();

    /**
     * 写入一批 (向量, 路由, 话术); structuredSchemas 与 metadataList 可为空, 不为空时长度必须与 embeddings 一致
     */
    void add(List<float[]> embeddings,
             List<String> routes,
             List<?> utterances,
             List<Map<String, Object>> structuredSchemas,
             List<Map<String, Object>> metadataList);

    default void add(List<float[]> embeddings, List<String> routes, List<?> utterances) {
        add(embeddings, routes, utterances, null, null);
    }

    /**
     * 删除某个路由下的全部文档
     */
    void delete(String route);

    void deleteAll();

    void deleteIndex();

    /**
     * 删除指定的 (路由, 话术), 已不存在的视为删除成功
     */
    void deleteRecords(Map<String, ? extends Collection<String>> routesToDelete);

    IndexConfig describe();

    boolean isReady();

    QueryResult query(float[] vector, int topK, List<String> routeFilter);

    default QueryResult query(float[] vector, int topK) {
        return query(vector, topK, null);
    }

    CorpusSnapshot enumerateAll(String prefix, boolean includeMetadata);

    ConfigParameter readConfig(String field, String scope);

    ConfigParameter writeConfig(ConfigParameter config);

    long size();

    /**
     * 维度已知时确保 collection 存在
     */
    void initIndex();

    default CompletableFuture<QueryResult> queryAsync(float[] vector, int topK, List<String> routeFilter, Executor executor) {
        return CompletableFuture.supplyAsync(() -> query(vector, topK, routeFilter), executor);
    }

    default CompletableFuture<Void> deleteAsync(String route, Executor executor) {
        return CompletableFuture.runAsync(() -> delete(route), executor);
    }

    default CompletableFuture<Boolean> isReadyAsync(Executor executor) {
        return CompletableFuture.supplyAsync(this::isReady, executor);
    }

    default CompletableFuture<CorpusSnapshot> enumerateAllAsync(String prefix, boolean includeMetadata, Executor executor) {
        return CompletableFuture.supplyAsync(() -> enumerateAll(prefix, includeMetadata), executor);
    }
}

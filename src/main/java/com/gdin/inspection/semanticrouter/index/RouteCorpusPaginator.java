package com.gdin.inspection.semanticrouter.index;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.semanticrouter.index.model.CorpusSnapshot;
import com.gdin.inspection.semanticrouter.index.model.PayloadDecodeException;
import com.gdin.inspection.semanticrouter.index.model.StoredPayload;
import com.gdin.inspection.semanticrouter.typesense.TypesenseClient;
import com.gdin.inspection.semanticrouter.typesense.model.SearchHit;
import com.gdin.inspection.semanticrouter.typesense.model.SearchResponse;
import lombok.extern.slf4j.Slf4j;
import org.typesense.model.MultiSearchCollectionParameters;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.gdin.inspection.semanticrouter.index.RouteDocumentFields.*;

/**
 * 通配检索逐页遍历整个 collection, 用于重建远端的 (路由, 话术) 全集
 */
@Slf4j
public class RouteCorpusPaginator {
    private final TypesenseClient typesenseClient;
    private final int pageSize;

    public RouteCorpusPaginator(TypesenseClient typesenseClient, Integer pageSize) {
        this.typesenseClient = typesenseClient;
        int requested = pageSize == null ? RouteQueryTranslator.MAX_PER_PAGE : pageSize;
        if (requested < 1 || requested > RouteQueryTranslator.MAX_PER_PAGE) {
            log.warn("遍历页大小 {} 超出范围 [1, {}], 已调整", requested, RouteQueryTranslator.MAX_PER_PAGE);
        }
        this.pageSize = Math.max(1, Math.min(requested, RouteQueryTranslator.MAX_PER_PAGE));
    }

    int getPageSize() {
        return pageSize;
    }

    /**
     * 从第 1 页开始直到某页没有命中为止。
     * 配置项文档不会出现在结果中; prefix 不为空时只保留路由名以其开头的文档。
     */
    public CorpusSnapshot enumerateAll(String collectionName, String prefix, boolean includeMetadata) {
        List<String> ids = new ArrayList<>();
        List<Map<String, Object>> metadata = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        int page = 1;
        while (true) {
            MultiSearchCollectionParameters parameters = new MultiSearchCollectionParameters();
            parameters.setQ("*");
            parameters.setExcludeFields(VECTOR);
            parameters.setPage(page);
            parameters.setPerPage(pageSize);
            SearchResponse response = typesenseClient.search(collectionName, parameters);
            List<SearchHit> hits = response.getHits();
            if (CollectionUtil.isEmpty(hits)) break;

            boolean progressed = false;
            for (SearchHit hit : hits) {
                Map<String, Object> doc = hit.getDocument();
                if (doc == null) continue;
                String id = documentId(doc);
                if (!seen.add(id)) continue;
                progressed = true;

                Object routeValue = doc.get(ROUTE);
                String route = routeValue == null ? null : routeValue.toString();
                if (CONFIG_ROUTE.equals(route)) continue;
                if (StrUtil.isNotEmpty(prefix) && (route == null || !route.startsWith(prefix))) continue;

                ids.add(id);
                metadata.add(toMetadata(id, doc, includeMetadata));
            }
            log.debug("遍历 {} 第 {} 页, 命中 {} 条", collectionName, page, hits.size());
            // 整页都是见过的文档, 后端没有在翻页
            if (!progressed) {
                log.warn("遍历 {} 第 {} 页只返回了重复文档, 提前结束", collectionName, page);
                break;
            }
            page++;
        }
        return new CorpusSnapshot(ids, metadata);
    }

    private Map<String, Object> toMetadata(String id, Map<String, Object> doc, boolean includeMetadata) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(ROUTE, String.valueOf(doc.getOrDefault(ROUTE, "")));
        meta.put(UTTERANCE, String.valueOf(doc.getOrDefault(UTTERANCE, "")));
        meta.put(FUNCTION_SCHEMA, String.valueOf(doc.getOrDefault(FUNCTION_SCHEMA, "{}")));
        if (includeMetadata) {
            Object raw = doc.get(METADATA);
            if (raw != null) {
                try {
                    meta.putAll(StoredPayload.json(raw.toString()).decodeObject());
                } catch (PayloadDecodeException e) {
                    log.warn("文档 {} 的 {} 无法解析, 已忽略: {}", id, METADATA, e.getMessage());
                }
            }
        }
        return meta;
    }

    private String documentId(Map<String, Object> doc) {
        Object id = doc.get(SR_ID);
        if (id == null) id = doc.get(ID);
        return id == null ? "" : id.toString();
    }
}

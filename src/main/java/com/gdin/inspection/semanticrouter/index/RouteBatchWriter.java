package com.gdin.inspection.semanticrouter.index;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.semanticrouter.index.model.IndexedRecord;
import com.gdin.inspection.semanticrouter.typesense.TypesenseClient;
import com.gdin.inspection.semanticrouter.typesense.TypesenseException;
import com.gdin.inspection.semanticrouter.typesense.TypesenseObjectNotFoundException;
import com.gdin.inspection.semanticrouter.typesense.model.ImportResult;
import com.google.gson.JsonObject;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 批量写入与删除。写操作失败一律向上抛出, 避免索引被静默破坏。
 */
@Slf4j
@RequiredArgsConstructor
public class RouteBatchWriter {
    private final TypesenseClient typesenseClient;
    private final CollectionSchemaManager schemaManager;
    private final RouteDocumentMapper documentMapper;

    /**
     * 映射 -> 确保 collection 存在 -> 一次 upsert 导入整批文档
     *
     * @return 写入的文档数
     */
    public int add(String collectionName,
                   List<float[]> embeddings,
                   List<String> labels,
                   List<?> texts,
                   List<Map<String, Object>> structuredSchemas,
                   List<Map<String, Object>> metadataList) {
        if (CollectionUtil.isEmpty(embeddings)) throw new IllegalArgumentException("embeddings 不能为空");
        int size = embeddings.size();
        requireSize("labels", labels, size, true);
        requireSize("texts", texts, size, true);
        requireSize("structuredSchemas", structuredSchemas, size, false);
        requireSize("metadataList", metadataList, size, false);

        List<JsonObject> documents = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            IndexedRecord record = documentMapper.toRecord(
                    labels.get(i),
                    texts.get(i),
                    CollectionUtil.isEmpty(structuredSchemas) ? null : structuredSchemas.get(i),
                    CollectionUtil.isEmpty(metadataList) ? null : metadataList.get(i),
                    embeddings.get(i)
            );
            documents.add(documentMapper.toDocument(record));
        }

        schemaManager.ensureCollection(collectionName, embeddings.get(0).length);
        upsert(collectionName, documents);
        log.info("已向 Typesense 写入 {} 条文档", documents.size());
        return documents.size();
    }

    public void upsert(String collectionName, List<JsonObject> documents) {
        List<ImportResult> results = typesenseClient.importDocuments(collectionName, documents);
        List<ImportResult> failed = results.stream().filter(r -> !r.isSuccess()).toList();
        if (!failed.isEmpty()) {
            failed.forEach(r -> log.warn("文档导入失败: {} -> {}", r.getError(), r.getDocument()));
            throw new TypesenseException(200, failed.size() + "/" + documents.size()
                    + " 条文档导入失败, 第一条错误: " + failed.get(0).getError());
        }
    }

    /**
     * 服务端按路由过滤删除, 不需要先在客户端枚举
     */
    public int deleteByLabel(String collectionName, String label) {
        int deleted = typesenseClient.deleteDocuments(collectionName, RouteQueryTranslator.labelEquals(label));
        log.info("已从 Typesense 删除路由 '{}' 的 {} 条文档", label, deleted);
        return deleted;
    }

    public void deleteCollection(String collectionName) {
        try {
            typesenseClient.deleteCollection(collectionName);
            log.info("已删除 Typesense collection '{}'", collectionName);
        } catch (TypesenseObjectNotFoundException e) {
            log.debug("Typesense collection '{}' 不存在, 无需删除", collectionName);
        }
    }

    /**
     * 按 (路由, 话术) 重新计算 id 后逐条删除, 已经不存在的文档视为删除成功
     *
     * @return 实际删除的文档数
     */
    public int deleteRecords(String collectionName, Map<String, ? extends Collection<String>> labelToTexts) {
        int deleted = 0;
        for (Map.Entry<String, ? extends Collection<String>> entry : labelToTexts.entrySet()) {
            for (String text : entry.getValue()) {
                String id = RouteDocumentMapper.makeId(entry.getKey(), text);
                try {
                    typesenseClient.deleteDocument(collectionName, id);
                    deleted++;
                } catch (TypesenseObjectNotFoundException e) {
                    log.debug("文档 {} ({} / {}) 已不存在", id, entry.getKey(), text);
                }
            }
        }
        return deleted;
    }

    private void requireSize(String name, List<?> list, int expected, boolean required) {
        if (list == null || list.isEmpty()) {
            if (required) throw new IllegalArgumentException(name + " 不能为空");
            return;
        }
        if (list.size() != expected) {
            throw new IllegalArgumentException(name + " 长度为 " + list.size() + ", 与 embeddings 长度 " + expected + " 不一致");
        }
    }
}

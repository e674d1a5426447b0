package com.gdin.inspection.semanticrouter.route;

import cn.hutool.crypto.digest.DigestUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.gdin.inspection.semanticrouter.index.RouteDocumentMapper;
import com.gdin.inspection.semanticrouter.index.RouteIndex;
import com.gdin.inspection.semanticrouter.index.model.ConfigParameter;
import com.gdin.inspection.semanticrouter.index.model.CorpusSnapshot;
import com.gdin.inspection.semanticrouter.util.IOUtil;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import static com.gdin.inspection.semanticrouter.index.RouteDocumentFields.*;

/**
 * 本地路由表与远端索引的同步(本地为准)。
 * <p>
 * 远端保存上一次同步时的路由哈希; 哈希一致时不做任何事, 否则按 (路由, 话术) 做差量:
 * 远端多出的删除, 本地新增或 schema / metadata 变化的重新向量化写入, 最后写入新哈希。
 */
@Slf4j
@Service
public class RouteSyncService {
    public static final String HASH_FIELD = "sr_hash";

    private static final Set<String> FIXED_KEYS = Set.of(ROUTE, UTTERANCE, FUNCTION_SCHEMA);

    private final RouteIndex routeIndex;
    private final RouteCatalog routeCatalog;
    private final EmbeddingModel embeddingModel;

    public RouteSyncService(RouteIndex routeIndex, RouteCatalog routeCatalog, @Lazy EmbeddingModel embeddingModel) {
        this.routeIndex = routeIndex;
        this.routeCatalog = routeCatalog;
        this.embeddingModel = embeddingModel;
    }

    /**
     * 本地路由表的 sha256, 与路由及话术的声明顺序无关
     */
    public String localHash() {
        List<Map<String, Object>> canonical = new ArrayList<>();
        routeCatalog.getRoutes().stream()
                .sorted(Comparator.comparing(Route::getName))
                .forEach(route -> {
                    Map<String, Object> item = new LinkedHashMap<>();
                    item.put("name", route.getName());
                    item.put("utterances", route.getUtterances() == null ? List.of() : new TreeSet<>(route.getUtterances()));
                    item.put("function_schema", route.getFunctionSchema());
                    item.put("metadata", route.getMetadata());
                    canonical.add(item);
                });
        try {
            return DigestUtil.sha256Hex(IOUtil.jsonSerializeCanonical(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("无法计算路由哈希", e);
        }
    }

    public boolean isSynced() {
        ConfigParameter remote = routeIndex.readConfig(HASH_FIELD, null);
        return !remote.isEmpty() && remote.getValue().equals(localHash());
    }

    public synchronized SyncReport sync() {
        String hash = localHash();
        ConfigParameter remoteHash = routeIndex.readConfig(HASH_FIELD, null);
        if (hash.equals(remoteHash.getValue())) {
            log.info("远端索引与本地路由一致, 无需同步 (hash={})", hash);
            return SyncReport.unchanged(hash);
        }

        // 远端: 路由 -> 话术 -> 文档元数据
        Map<String, Map<String, Map<String, Object>>> remote = new HashMap<>();
        CorpusSnapshot snapshot = routeIndex.enumerateAll(null, true);
        for (Map<String, Object> meta : snapshot.getMetadata()) {
            remote.computeIfAbsent(String.valueOf(meta.get(ROUTE)), k -> new HashMap<>())
                    .put(String.valueOf(meta.get(UTTERANCE)), meta);
        }
        Map<String, Set<String>> local = routeCatalog.utterancesByRoute();

        int removed = removeStale(remote, local);

        List<String> labels = new ArrayList<>();
        List<String> texts = new ArrayList<>();
        List<Map<String, Object>> schemas = new ArrayList<>();
        List<Map<String, Object>> metadataList = new ArrayList<>();
        for (Route route : routeCatalog.getRoutes()) {
            Map<String, Map<String, Object>> remoteTexts = remote.getOrDefault(route.getName(), Map.of());
            for (String text : local.get(route.getName())) {
                if (isUpToDate(route, remoteTexts.get(text))) continue;
                labels.add(route.getName());
                texts.add(text);
                schemas.add(route.getFunctionSchema());
                metadataList.add(route.getMetadata() == null ? Map.of() : route.getMetadata());
            }
        }
        if (!texts.isEmpty()) {
            List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
            List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
            List<float[]> vectors = embeddings.stream().map(Embedding::vector).toList();
            routeIndex.add(vectors, labels, texts, schemas, metadataList);
        }

        routeIndex.writeConfig(ConfigParameter.builder().field(HASH_FIELD).value(hash).build());
        log.info("路由同步完成: 新增/更新 {} 条, 删除 {} 条 (hash={})", texts.size(), removed, hash);
        return new SyncReport(false, texts.size(), removed, hash);
    }

    /**
     * 本地已不存在的路由整体删除, 仍存在的路由只删除多余的话术
     */
    private int removeStale(Map<String, Map<String, Map<String, Object>>> remote, Map<String, Set<String>> local) {
        int removed = 0;
        Map<String, Set<String>> staleTexts = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Map<String, Object>>> entry : remote.entrySet()) {
            Set<String> localTexts = local.get(entry.getKey());
            if (localTexts == null) {
                routeIndex.delete(entry.getKey());
                removed += entry.getValue().size();
                continue;
            }
            Set<String> stale = new LinkedHashSet<>(entry.getValue().keySet());
            stale.removeAll(localTexts);
            if (!stale.isEmpty()) {
                staleTexts.put(entry.getKey(), stale);
                removed += stale.size();
            }
        }
        if (!staleTexts.isEmpty()) routeIndex.deleteRecords(staleTexts);
        return removed;
    }

    private boolean isUpToDate(Route route, Map<String, Object> remoteMeta) {
        if (remoteMeta == null) return false;
        String schema = RouteDocumentMapper.serializeSchema(route.getFunctionSchema());
        if (!schema.equals(remoteMeta.get(FUNCTION_SCHEMA))) return false;
        Map<String, Object> remoteExtra = new HashMap<>(remoteMeta);
        FIXED_KEYS.forEach(remoteExtra::remove);
        Map<String, Object> localExtra = route.getMetadata() == null ? Map.of() : route.getMetadata();
        return Objects.equals(remoteExtra, localExtra);
    }
}

package com.gdin.inspection.semanticrouter.typesense;

import cn.hutool.core.collection.CollectionUtil;
import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.gdin.inspection.semanticrouter.typesense.model.ImportResult;
import com.gdin.inspection.semanticrouter.typesense.model.SearchResponse;
import com.gdin.inspection.semanticrouter.util.IOUtil;
import com.google.gson.JsonObject;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.typesense.api.Client;
import org.typesense.api.exceptions.ObjectAlreadyExists;
import org.typesense.api.exceptions.ObjectNotFound;
import org.typesense.api.exceptions.TypesenseError;
import org.typesense.model.CollectionResponse;
import org.typesense.model.CollectionSchema;
import org.typesense.model.DeleteDocumentsParameters;
import org.typesense.model.ImportDocumentsParameters;
import org.typesense.model.IndexAction;
import org.typesense.model.MultiSearchCollectionParameters;
import org.typesense.model.MultiSearchSearchesParameter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * 基于官方 typesense-java SDK 的实现
 */
@Slf4j
@Component
public class TypesenseSdkClient implements TypesenseClient {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    @Resource
    private Client typesenseApiClient;

    @Override
    public CollectionResponse retrieveCollection(String collectionName) {
        return execute("retrieve collection " + collectionName,
                () -> typesenseApiClient.collections(collectionName).retrieve());
    }

    @Override
    public CollectionResponse createCollection(CollectionSchema schema) {
        return execute("create collection " + schema.getName(),
                () -> typesenseApiClient.collections().create(schema));
    }

    @Override
    public void deleteCollection(String collectionName) {
        execute("delete collection " + collectionName,
                () -> typesenseApiClient.collections(collectionName).delete());
    }

    @Override
    public List<ImportResult> importDocuments(String collectionName, List<JsonObject> documents) {
        // 请求体与响应体都是 JSON Lines
        String body = documents.stream().map(JsonObject::toString).collect(Collectors.joining("\n"));
        ImportDocumentsParameters parameters = new ImportDocumentsParameters().action(IndexAction.UPSERT);
        String response = execute("import documents into " + collectionName,
                () -> typesenseApiClient.collections(collectionName).documents().import_(body, parameters));

        List<ImportResult> results = new ArrayList<>();
        if (StrUtil.isBlank(response)) return results;
        for (String line : response.split("\n")) {
            if (StrUtil.isBlank(line)) continue;
            try {
                results.add(IOUtil.jsonDeserializeWithNoType(line, ImportResult.class));
            } catch (JsonProcessingException e) {
                throw new TypesenseException(200, "无法解析导入结果: " + line, e);
            }
        }
        return results;
    }

    @Override
    public int deleteDocuments(String collectionName, String filterBy) {
        DeleteDocumentsParameters parameters = new DeleteDocumentsParameters().filterBy(filterBy);
        Object response = execute("delete documents from " + collectionName,
                () -> typesenseApiClient.collections(collectionName).documents().delete(parameters));
        Object numDeleted = toMap(response).get("num_deleted");
        return numDeleted instanceof Number n ? n.intValue() : 0;
    }

    @Override
    public Map<String, Object> retrieveDocument(String collectionName, String id) {
        Object document = execute("retrieve document " + id,
                () -> typesenseApiClient.collections(collectionName).documents(id).retrieve());
        return toMap(document);
    }

    @Override
    public void deleteDocument(String collectionName, String id) {
        execute("delete document " + id,
                () -> typesenseApiClient.collections(collectionName).documents(id).delete());
    }

    @Override
    public void upsertDocument(String collectionName, JsonObject document) {
        execute("upsert document into " + collectionName, () -> {
            Map<String, Object> fields = IOUtil.mapper().readValue(document.toString(), MAP_TYPE);
            return typesenseApiClient.collections(collectionName).documents().upsert(fields);
        });
    }

    /**
     * 统一走 multi_search(POST): 高维向量拼进 GET 查询串会超过 Typesense 的长度限制
     */
    @Override
    public SearchResponse search(String collectionName, MultiSearchCollectionParameters parameters) {
        parameters.setCollection(collectionName);
        MultiSearchSearchesParameter searches = new MultiSearchSearchesParameter();
        searches.addSearchesItem(parameters);
        Object response = execute("search " + collectionName,
                () -> typesenseApiClient.multiSearch.perform(searches, new HashMap<String, String>()));

        Object results = toMap(response).get("results");
        if (!(results instanceof List<?> items) || CollectionUtil.isEmpty(items)) {
            throw new TypesenseException(200, "multi_search 返回了空结果: " + collectionName);
        }
        SearchResponse result = IOUtil.mapper().convertValue(items.get(0), SearchResponse.class);
        // multi_search 整体返回 200, 单个检索的失败放在结果里
        if (result.getCode() != null && result.getCode() >= 400) {
            if (result.getCode() == 404) throw new TypesenseObjectNotFoundException(result.getError());
            throw new TypesenseException(result.getCode(), result.getError());
        }
        if (result.getHits() == null) result.setHits(new ArrayList<>());
        return result;
    }

    private Map<String, Object> toMap(Object value) {
        if (value == null) return Map.of();
        return IOUtil.mapper().convertValue(value, MAP_TYPE);
    }

    private <T> T execute(String action, Callable<T> call) {
        try {
            return call.call();
        } catch (ObjectNotFound e) {
            throw new TypesenseObjectNotFoundException(action + ": " + e.getMessage());
        } catch (ObjectAlreadyExists e) {
            throw new TypesenseObjectAlreadyExistsException(action + ": " + e.getMessage());
        } catch (TypesenseError e) {
            throw new TypesenseException(0, action + " 失败: " + e.getMessage(), e);
        } catch (Exception e) {
            throw new TypesenseException(0, action + " 无法完成: " + e.getMessage(), e);
        }
    }
}

package com.gdin.inspection.semanticrouter.typesense;

import com.gdin.inspection.semanticrouter.typesense.model.ImportResult;
import com.gdin.inspection.semanticrouter.typesense.model.SearchResponse;
import com.google.gson.JsonObject;
import org.typesense.model.CollectionResponse;
import org.typesense.model.CollectionSchema;
import org.typesense.model.MultiSearchCollectionParameters;

import java.util.List;
import java.util.Map;

/**
 * 索引用到的 Typesense 调用面, 把 SDK 的受检异常收敛为运行时异常。
 * <p>
 * 对象不存在时抛 {@link TypesenseObjectNotFoundException}, 重复创建时抛
 * {@link TypesenseObjectAlreadyExistsException}, 其余失败统一抛 {@link TypesenseException}。
 */
public interface TypesenseClient {

    CollectionResponse retrieveCollection(String collectionName);

    CollectionResponse createCollection(CollectionSchema schema);

    void deleteCollection(String collectionName);

    /**
     * 批量导入, action=upsert: id 已存在的文档被整体替换
     *
     * @return 每个文档一行导入结果, 顺序与入参一致
     */
    List<ImportResult> importDocuments(String collectionName, List<JsonObject> documents);

    /**
     * @return 被删除的文档数
     */
    int deleteDocuments(String collectionName, String filterBy);

    Map<String, Object> retrieveDocument(String collectionName, String id);

    void deleteDocument(String collectionName, String id);

    void upsertDocument(String collectionName, JsonObject document);

    /**
     * 单个检索, 经 multi_search 发送
     */
    SearchResponse search(String collectionName, MultiSearchCollectionParameters parameters);
}

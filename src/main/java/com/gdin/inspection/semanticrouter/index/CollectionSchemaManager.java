package com.gdin.inspection.semanticrouter.index;

import com.gdin.inspection.semanticrouter.typesense.TypesenseClient;
import com.gdin.inspection.semanticrouter.typesense.TypesenseObjectAlreadyExistsException;
import com.gdin.inspection.semanticrouter.typesense.TypesenseObjectNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.typesense.model.CollectionResponse;
import org.typesense.model.CollectionSchema;
import org.typesense.model.Field;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.gdin.inspection.semanticrouter.index.RouteDocumentFields.*;

/**
 * 保证写入前 collection 已存在。向量维度只在创建时由第一次写入决定, 之后不再变化。
 */
@Slf4j
@RequiredArgsConstructor
public class CollectionSchemaManager {
    private final TypesenseClient typesenseClient;

    /**
     * 幂等: 已存在时什么都不做; 并发创建时对方先建好也视为成功
     *
     * @return 本次是否真的创建了 collection
     */
    public boolean ensureCollection(String collectionName, int dimensions) {
        if (exists(collectionName)) {
            log.debug("Typesense collection '{}' 已存在", collectionName);
            return false;
        }
        try {
            typesenseClient.createCollection(buildSchema(collectionName, dimensions));
            log.info("已创建 Typesense collection '{}', 向量维度 {}", collectionName, dimensions);
            return true;
        } catch (TypesenseObjectAlreadyExistsException e) {
            log.info("Typesense collection '{}' 已被其他实例创建", collectionName);
            return false;
        }
    }

    public boolean exists(String collectionName) {
        return find(collectionName).isPresent();
    }

    public Optional<CollectionResponse> find(String collectionName) {
        try {
            return Optional.ofNullable(typesenseClient.retrieveCollection(collectionName));
        } catch (TypesenseObjectNotFoundException e) {
            return Optional.empty();
        }
    }

    /**
     * 从已有 collection 的向量字段读取维度
     */
    public static Optional<Integer> vectorDimensions(CollectionResponse collection) {
        if (collection == null || collection.getFields() == null) return Optional.empty();
        return collection.getFields().stream()
                .filter(f -> VECTOR.equals(f.getName()))
                .findFirst()
                .map(Field::getNumDim);
    }

    CollectionSchema buildSchema(String collectionName, int dimensions) {
        return new CollectionSchema()
                .name(collectionName)
                .fields(new ArrayList<>(List.of(
                        new Field().name(SR_ID).type("string"),
                        new Field().name(ROUTE).type("string").facet(true),
                        new Field().name(UTTERANCE).type("string"),
                        new Field().name(FUNCTION_SCHEMA).type("string").optional(true),
                        new Field().name(METADATA).type("string").optional(true),
                        new Field().name(VECTOR).type("float[]").numDim(dimensions)
                )));
    }
}

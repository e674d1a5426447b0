package com.gdin.inspection.semanticrouter.index;

import cn.hutool.core.util.StrUtil;
import cn.hutool.crypto.digest.DigestUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.gdin.inspection.semanticrouter.index.model.IndexedRecord;
import com.gdin.inspection.semanticrouter.util.IOUtil;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.Map;

import static com.gdin.inspection.semanticrouter.index.RouteDocumentFields.*;

/**
 * (路由, 话术, schema, metadata, 向量) -> Typesense 文档, 纯转换不做 IO
 */
public class RouteDocumentMapper {
    static final int ID_LENGTH = 16;

    /**
     * 相同的 (路由, 话术) 总是得到相同的 id, 重复写入即覆盖
     */
    public static String makeId(String label, String text) {
        return DigestUtil.sha256Hex(label + "::" + text).substring(0, ID_LENGTH);
    }

    public IndexedRecord toRecord(String label, Object text, Map<String, Object> structuredSchema,
                                  Map<String, Object> metadata, float[] vector) {
        if (StrUtil.isEmpty(label)) throw new IllegalArgumentException("label 不能为空");
        // 写得进去但删不掉的文档会让同步失效
        RouteQueryTranslator.quotable(label);
        String utterance = String.valueOf(text);
        return IndexedRecord.builder()
                .id(makeId(label, utterance))
                .label(label)
                .text(utterance)
                .structuredSchema(structuredSchema)
                .metadata(metadata)
                .vector(vector)
                .build();
    }

    public JsonObject toDocument(IndexedRecord record) {
        JsonObject obj = new JsonObject();
        obj.addProperty(ID, record.getId());
        obj.addProperty(SR_ID, record.getId());
        obj.addProperty(ROUTE, record.getLabel());
        obj.addProperty(UTTERANCE, record.getText());
        // schema 缺省写 "null", metadata 缺省写 "{}", 字段总是存在
        obj.addProperty(FUNCTION_SCHEMA, serializeSchema(record.getStructuredSchema()));
        obj.addProperty(METADATA, serialize(record.getMetadata(), "{}"));
        obj.add(VECTOR, toJsonArray(record.getVector()));
        return obj;
    }

    /**
     * 配置项文档: 值放在 sr_utterance, 向量全 0
     */
    public JsonObject toConfigDocument(String configId, String value, int dimensions) {
        JsonObject obj = new JsonObject();
        obj.addProperty(ID, configId);
        obj.addProperty(SR_ID, configId);
        obj.addProperty(ROUTE, CONFIG_ROUTE);
        obj.addProperty(UTTERANCE, value);
        obj.addProperty(FUNCTION_SCHEMA, "{}");
        obj.addProperty(METADATA, "{}");
        obj.add(VECTOR, toJsonArray(new float[Math.max(dimensions, 1)]));
        return obj;
    }

    /**
     * function schema 的存储形式, 缺省为 "null"
     */
    public static String serializeSchema(Map<String, Object> structuredSchema) {
        return serialize(structuredSchema, "null");
    }

    private static String serialize(Map<String, Object> value, String emptyValue) {
        if (value == null) return emptyValue;
        try {
            return IOUtil.jsonSerializeWithNoType(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("无法序列化字段: " + value, e);
        }
    }

    private JsonArray toJsonArray(float[] vector) {
        JsonArray array = new JsonArray();
        if (vector != null) {
            for (float v : vector) array.add(v);
        }
        return array;
    }
}

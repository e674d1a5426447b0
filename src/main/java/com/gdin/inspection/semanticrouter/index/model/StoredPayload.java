package com.gdin.inspection.semanticrouter.index.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gdin.inspection.semanticrouter.util.IOUtil;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;

/**
 * 文档里以字符串形式保存的结构化字段(function schema / metadata)。
 * 原始字节和格式标记一起保存, 只有在解析校验通过后才转换成强类型结构。
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StoredPayload {

    public enum Format {
        JSON
    }

    private final Format format;

    private final byte[] raw;

    public static StoredPayload json(String serialized) {
        return new StoredPayload(Format.JSON, serialized == null ? new byte[0] : serialized.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isEmpty() {
        return raw.length == 0;
    }

    public String asString() {
        return new String(raw, StandardCharsets.UTF_8);
    }

    /**
     * 解析为 json 对象; 空内容与 json null 视为空对象, 其他非对象内容视为损坏
     */
    public Map<String, Object> decodeObject() throws PayloadDecodeException {
        if (isEmpty()) return Collections.emptyMap();
        JsonNode node;
        try {
            node = IOUtil.readTree(asString());
        } catch (JsonProcessingException e) {
            throw new PayloadDecodeException("无法解析 " + format + " 内容: " + asString(), e);
        }
        if (node == null || node.isNull() || node.isMissingNode()) return Collections.emptyMap();
        if (!node.isObject()) {
            throw new PayloadDecodeException("期望 json 对象, 实际为 " + node.getNodeType() + ": " + asString());
        }
        return IOUtil.treeToMap(node);
    }
}

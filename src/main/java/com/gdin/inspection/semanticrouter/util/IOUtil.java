package com.gdin.inspection.semanticrouter.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

@Slf4j
public class IOUtil {
    private static final ObjectMapper simpleMapper = new ObjectMapper();
    private static final ObjectMapper canonicalMapper = new ObjectMapper();

    static {
        simpleMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        // 输出稳定的 json, 用于计算哈希
        canonicalMapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        canonicalMapper.enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY);
    }

    private IOUtil() {
    }

    public static ObjectMapper mapper() {
        return simpleMapper;
    }

    /**
     * json序列化(不将类型信息序列化到json字符串中), null 会输出为字面量 "null"
     */
    public static String jsonSerializeWithNoType(Object obj) throws JsonProcessingException {
        return simpleMapper.writeValueAsString(obj);
    }

    /**
     * json反序列化(json字符串中不包含类型信息)
     */
    public static <T> T jsonDeserializeWithNoType(String content, Class<T> clazz) throws JsonProcessingException {
        return simpleMapper.readValue(content, clazz);
    }

    public static JsonNode readTree(String content) throws JsonProcessingException {
        return simpleMapper.readTree(content);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> treeToMap(JsonNode node) {
        return simpleMapper.convertValue(node, Map.class);
    }

    /**
     * 键有序的 json 序列化, 相同内容总是得到相同字符串
     */
    public static String jsonSerializeCanonical(Object obj) throws JsonProcessingException {
        return canonicalMapper.writeValueAsString(obj);
    }
}

package com.gdin.inspection.semanticrouter.index.model;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 全量遍历的结果, ids 与 metadata 一一对应
 */
@Value
public class CorpusSnapshot {
    List<String> ids;

    // 每项至少包含 sr_route / sr_utterance / sr_function_schema
    List<Map<String, Object>> metadata;

    public int size() {
        return ids.size();
    }
}

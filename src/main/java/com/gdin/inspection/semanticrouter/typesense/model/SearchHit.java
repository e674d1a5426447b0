package com.gdin.inspection.semanticrouter.typesense.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchHit {
    private Map<String, Object> document;

    // 余弦距离, 非向量检索时为空
    @JsonProperty("vector_distance")
    private Double vectorDistance;
}

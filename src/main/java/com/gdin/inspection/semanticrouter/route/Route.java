package com.gdin.inspection.semanticrouter.route;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 一个语义路由: 路由名 + 若干示例话术
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Route implements Serializable {
    private String name;

    private List<String> utterances = new ArrayList<>();

    @JsonProperty("function_schema")
    private Map<String, Object> functionSchema;

    private Map<String, Object> metadata;

    public Route(String name, List<String> utterances) {
        this(name, utterances, null, null);
    }
}

package com.gdin.inspection.semanticrouter.typesense.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchResponse {
    private Long found;

    private Integer page;

    private List<SearchHit> hits = new ArrayList<>();

    // multi_search 中单个检索失败时才有值
    private Integer code;

    private String error;

    public SearchResponse(Long found, Integer page, List<SearchHit> hits) {
        this.found = found;
        this.page = page;
        this.hits = hits;
    }
}

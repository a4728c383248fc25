package com.baykanat.insider.warehouse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** Motora gelen sorgu isteği; limit null ise sorgunun varsayılanı, offset null ise 0. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    private String queryName;
    private Map<String, Object> parameters;
    private Integer limit;
    private Integer offset;
    @Builder.Default
    private boolean useReplica = true;

    public static QueryRequest of(String queryName, Map<String, Object> parameters) {
        return QueryRequest.builder().queryName(queryName).parameters(parameters).build();
    }
}

package com.baykanat.insider.warehouse.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** Sorgu çalıştırma isteği; parametre doğrulaması sorgunun şemasıyla motorda yapılır. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Parameters and page of a catalog query execution")
public class QueryExecutionRequest {

    @JsonProperty("parameters")
    @Schema(description = "Query parameters by name", example = "{\"student_id\": 42}")
    private Map<String, Object> parameters;

    @JsonProperty("limit")
    @Schema(description = "Page size; clamped to the query's max limit", example = "50")
    private Integer limit;

    @JsonProperty("offset")
    @Schema(description = "Rows to skip", example = "0")
    private Integer offset;

    @Builder.Default
    @JsonProperty("use_replica")
    @Schema(description = "Prefer the read replica when available", example = "true")
    private Boolean useReplica = Boolean.TRUE;
}

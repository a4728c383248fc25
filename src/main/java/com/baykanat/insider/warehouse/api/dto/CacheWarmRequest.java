package com.baykanat.insider.warehouse.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheWarmRequest {

    @NotEmpty(message = "query_names must not be empty")
    @JsonProperty("query_names")
    @Schema(description = "Queries to execute with default parameters", example = "[\"top_performers\"]")
    private List<String> queryNames;
}

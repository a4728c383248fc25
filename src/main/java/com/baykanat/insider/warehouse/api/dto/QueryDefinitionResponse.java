package com.baykanat.insider.warehouse.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

/** Katalog listesi satırı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryDefinitionResponse {

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("target")
    private String target;

    @JsonProperty("default_limit")
    private int defaultLimit;

    @JsonProperty("max_limit")
    private int maxLimit;

    @JsonProperty("replica_eligible")
    private boolean replicaEligible;

    @JsonProperty("parameters")
    private List<Parameter> parameters;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Parameter {

        @JsonProperty("name")
        private String name;

        @JsonProperty("type")
        private String type;

        @JsonProperty("required")
        private boolean required;

        @JsonProperty("default_value")
        private Object defaultValue;

        @JsonProperty("allowed_values")
        private Set<String> allowedValues;

        @JsonProperty("min")
        private Long min;

        @JsonProperty("max")
        private Long max;
    }
}

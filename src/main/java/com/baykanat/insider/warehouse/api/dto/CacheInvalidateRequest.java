package com.baykanat.insider.warehouse.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheInvalidateRequest {

    @NotBlank(message = "prefix is required")
    @JsonProperty("prefix")
    @Schema(description = "Cache key prefix to delete", example = "warehouse:student_grade_summary:")
    private String prefix;
}

package com.baykanat.insider.warehouse.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Her sorgu çalıştırmasının gözlem kaydı; oluşturulduktan sonra değişmez, retention süresi sonunda silinir. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionRun {

    private Long id;

    @JsonProperty("query_name")
    private String queryName;

    @JsonProperty("target")
    private String target;

    @JsonProperty("source")
    private QuerySource source;

    @JsonProperty("duration_ms")
    private long durationMs;

    @JsonProperty("row_count")
    private int rowCount;

    @JsonProperty("from_cache")
    private boolean fromCache;

    @JsonProperty("uninitialized")
    private boolean uninitialized;

    @JsonProperty("executed_at")
    private Instant executedAt;
}

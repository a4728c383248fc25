package com.baykanat.insider.warehouse.api.dto;

import com.baykanat.insider.warehouse.domain.model.QuerySource;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One page of a catalog query result")
public class QueryResponse {

    @JsonProperty("query_name")
    private String queryName;

    @JsonProperty("rows")
    private List<Map<String, Object>> rows;

    @JsonProperty("row_count")
    private int rowCount;

    @JsonProperty("limit")
    private int limit;

    @JsonProperty("offset")
    private int offset;

    @JsonProperty("has_more")
    private boolean hasMore;

    @JsonProperty("from_cache")
    private boolean fromCache;

    @JsonProperty("source")
    @Schema(description = "Connection that produced the rows; null for uninitialized results")
    private QuerySource source;

    @JsonProperty("uninitialized")
    @Schema(description = "True when the target aggregate view has never been refreshed")
    private boolean uninitialized;

    @JsonProperty("data_as_of")
    @Schema(description = "Last refresh time of the target aggregate view")
    private Instant dataAsOf;
}

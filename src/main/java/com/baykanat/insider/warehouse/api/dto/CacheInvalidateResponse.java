package com.baykanat.insider.warehouse.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheInvalidateResponse {

    @JsonProperty("prefix")
    private String prefix;

    @JsonProperty("deleted_entries")
    private long deletedEntries;
}

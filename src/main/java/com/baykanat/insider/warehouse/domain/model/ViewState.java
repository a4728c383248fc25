package com.baykanat.insider.warehouse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** warehouse_view_state satırı; lastRefreshedAt null ise view hiç yenilenmemiştir. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ViewState {

    private String viewName;
    private int definitionVersion;
    private Instant lastRefreshedAt;
    private Long lastRowsWritten;
    private Long lastDurationMs;
    private String lastError;
    private Instant updatedAt;

    public boolean isInitialized() {
        return lastRefreshedAt != null;
    }
}

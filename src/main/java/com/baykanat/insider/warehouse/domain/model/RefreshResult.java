package com.baykanat.insider.warehouse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Başarılı view yenilemesinin özeti. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefreshResult {

    private String viewName;
    private long rowsWritten;
    private long durationMs;
    private Instant refreshedAt;
}

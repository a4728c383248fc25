package com.baykanat.insider.warehouse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/** generate-statistics job'unun ürettiği anlık görüntü: view boyutları, tablo satırları, son 24 saat çalıştırmaları. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WarehouseStatistics {

    private Instant generatedAt;
    private Map<String, ViewStatistics> views;
    private Map<String, Long> sourceTableRows;
    private ExecutionSummary executions;
    private CacheStatistics cache;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ViewStatistics {
        private long sizeBytes;
        private boolean populated;
        private Instant lastRefreshedAt;
        private Long lastRowsWritten;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExecutionSummary {
        private long total;
        private long cacheHits;
        private long replicaReads;
        private long uninitialized;
        private double avgDurationMs;
        private long maxDurationMs;
        private long slowQueries;
    }
}

package com.baykanat.insider.warehouse.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Süreç açıldığından beri cache hit/miss sayaçları. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    private String backend;
    private long hits;
    private long misses;
    private long storeFailures;
    private long invalidatedEntries;

    public double getHitRatio() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}

package com.baykanat.insider.warehouse.scheduler;

import com.baykanat.insider.warehouse.config.AppProperties;
import com.baykanat.insider.warehouse.domain.model.CacheWarmReport;
import com.baykanat.insider.warehouse.domain.service.CacheWarmingService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Yoğun saat öncesi app.cache.warm-queries sorgularını ısıtır; tekrar denemede yalnızca başarısız sorgular. */
@Component
@RequiredArgsConstructor
public class WarmCacheJob implements WarehouseJob {

    public static final String NAME = "warm-cache";

    private final CacheWarmingService cacheWarmingService;
    private final AppProperties appProperties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public JobRun newRun() {
        List<String> pending = new ArrayList<>(appProperties.getCache().getWarmQueries());
        List<String> warmed = new ArrayList<>();

        return () -> {
            CacheWarmReport report = cacheWarmingService.warm(List.copyOf(pending));
            warmed.addAll(report.getWarmed());
            pending.removeAll(report.getWarmed());
            if (!report.isComplete()) {
                throw new IllegalStateException("Cache warm incomplete: " + report.getFailures());
            }
            return Map.of("warmed", List.copyOf(warmed));
        };
    }
}

package com.baykanat.insider.warehouse.domain.service;

import com.baykanat.insider.warehouse.config.AppProperties;
import com.baykanat.insider.warehouse.domain.catalog.AggregateViewRegistry;
import com.baykanat.insider.warehouse.domain.catalog.AnalyticsCatalog;
import com.baykanat.insider.warehouse.domain.model.ViewState;
import com.baykanat.insider.warehouse.domain.model.WarehouseStatistics;
import com.baykanat.insider.warehouse.infrastructure.cache.ResultCache;
import com.baykanat.insider.warehouse.infrastructure.persistence.AggregateViewJdbcRepository;
import com.baykanat.insider.warehouse.infrastructure.persistence.ExecutionRunJdbcRepository;
import com.baykanat.insider.warehouse.infrastructure.persistence.StatisticsJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Günlük istatistik görüntüsü: view boyutları, kaynak tablo satırları, son 24 saatin çalıştırmaları ve cache sayaçları. */
@Slf4j
@Service
@RequiredArgsConstructor
public class WarehouseStatisticsService {

    private static final Duration WINDOW = Duration.ofHours(24);

    private final AggregateViewRegistry viewRegistry;
    private final AggregateViewJdbcRepository viewRepository;
    private final StatisticsJdbcRepository statisticsRepository;
    private final ExecutionRunJdbcRepository executionRunRepository;
    private final ResultCache resultCache;
    private final AppProperties appProperties;

    private final AtomicReference<WarehouseStatistics> latest = new AtomicReference<>();

    public WarehouseStatistics generate() {
        Instant now = Instant.now();
        Map<String, Long> sizes = statisticsRepository.materializedViewSizes();
        Map<String, ViewState> states = viewRepository.findAllStates().stream()
                .collect(Collectors.toMap(ViewState::getViewName, Function.identity()));

        Map<String, WarehouseStatistics.ViewStatistics> views = new LinkedHashMap<>();
        viewRegistry.all().forEach(definition -> {
            ViewState state = states.get(definition.getName());
            views.put(definition.getName(), WarehouseStatistics.ViewStatistics.builder()
                    .sizeBytes(sizes.getOrDefault(definition.getName(), 0L))
                    .populated(state != null && state.isInitialized())
                    .lastRefreshedAt(state != null ? state.getLastRefreshedAt() : null)
                    .lastRowsWritten(state != null ? state.getLastRowsWritten() : null)
                    .build());
        });

        WarehouseStatistics statistics = WarehouseStatistics.builder()
                .generatedAt(now)
                .views(views)
                .sourceTableRows(statisticsRepository.liveRowCounts(AnalyticsCatalog.SOURCE_TABLES))
                .executions(executionRunRepository.summarizeSince(now.minus(WINDOW),
                        appProperties.getWarehouse().getSlowQueryThresholdMs()))
                .cache(resultCache.statistics())
                .build();
        latest.set(statistics);
        log.info("Warehouse statistics generated: views={}, executions_24h={}",
                views.size(), statistics.getExecutions().getTotal());
        return statistics;
    }

    public Optional<WarehouseStatistics> latest() {
        return Optional.ofNullable(latest.get());
    }
}

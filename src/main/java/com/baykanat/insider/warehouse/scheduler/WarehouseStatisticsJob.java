package com.baykanat.insider.warehouse.scheduler;

import com.baykanat.insider.warehouse.domain.model.WarehouseStatistics;
import com.baykanat.insider.warehouse.domain.service.WarehouseStatisticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class WarehouseStatisticsJob implements WarehouseJob {

    public static final String NAME = "generate-statistics";

    private final WarehouseStatisticsService statisticsService;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public JobRun newRun() {
        return () -> {
            WarehouseStatistics statistics = statisticsService.generate();
            return Map.of(
                    "generated_at", statistics.getGeneratedAt().toString(),
                    "views", statistics.getViews().size(),
                    "executions_24h", statistics.getExecutions().getTotal());
        };
    }
}

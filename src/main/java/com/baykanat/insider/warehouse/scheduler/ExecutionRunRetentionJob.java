package com.baykanat.insider.warehouse.scheduler;

import com.baykanat.insider.warehouse.config.AppProperties;
import com.baykanat.insider.warehouse.infrastructure.persistence.ExecutionRunJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * warehouse_execution_runs tablosunda retention süresini aşan kayıtları siler.
 * Retention 0 veya negatifse kayıtlar süresiz tutulur.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExecutionRunRetentionJob implements WarehouseJob {

    public static final String NAME = "cleanup-execution-runs";

    private final ExecutionRunJdbcRepository executionRunRepository;
    private final AppProperties appProperties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public JobRun newRun() {
        int retentionDays = appProperties.getScheduler().getExecutionRunRetentionDays();
        return () -> {
            if (retentionDays <= 0) {
                log.debug("Execution run retention disabled (retention_days={})", retentionDays);
                return Map.of("skipped", true, "retention_days", retentionDays);
            }
            int deleted = executionRunRepository.deleteOlderThan(retentionDays);
            log.info("Execution run retention: deleted {} runs older than {} days", deleted, retentionDays);
            return Map.of("deleted", deleted, "retention_days", retentionDays);
        };
    }
}

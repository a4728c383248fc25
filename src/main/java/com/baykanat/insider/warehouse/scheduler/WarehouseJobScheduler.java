package com.baykanat.insider.warehouse.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Günlük job takvimi; cron ve zone application.yaml'dan ("-" ile kapatılır). */
@Slf4j
@Component
@RequiredArgsConstructor
public class WarehouseJobScheduler {

    private final JobOrchestrator jobOrchestrator;

    @Scheduled(cron = "${app.scheduler.refresh-views-cron:0 0 2 * * *}", zone = "${app.scheduler.zone:UTC}")
    public void refreshViews() {
        jobOrchestrator.run(RefreshViewsJob.NAME);
    }

    @Scheduled(cron = "${app.scheduler.statistics-cron:0 0 3 * * *}", zone = "${app.scheduler.zone:UTC}")
    public void generateStatistics() {
        jobOrchestrator.run(WarehouseStatisticsJob.NAME);
    }

    @Scheduled(cron = "${app.scheduler.warm-cache-cron:0 0 7 * * *}", zone = "${app.scheduler.zone:UTC}")
    public void warmCache() {
        jobOrchestrator.run(WarmCacheJob.NAME);
    }

    @Scheduled(cron = "${app.scheduler.execution-run-cleanup-cron:0 30 4 * * *}", zone = "${app.scheduler.zone:UTC}")
    public void cleanupExecutionRuns() {
        jobOrchestrator.run(ExecutionRunRetentionJob.NAME);
    }
}

package com.baykanat.insider.warehouse.scheduler;

import com.baykanat.insider.warehouse.domain.catalog.AggregateViewDefinition;
import com.baykanat.insider.warehouse.domain.catalog.AggregateViewRegistry;
import com.baykanat.insider.warehouse.domain.exception.RefreshFailureException;
import com.baykanat.insider.warehouse.domain.model.RefreshResult;
import com.baykanat.insider.warehouse.domain.service.ViewRefreshService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/** Tüm aggregate view'ları paralel yeniler; tekrar denemede yalnızca başarısız olanlar yenilenir. */
@Slf4j
@Component
public class RefreshViewsJob implements WarehouseJob {

    public static final String NAME = "refresh-views";

    private final AggregateViewRegistry viewRegistry;
    private final ViewRefreshService viewRefreshService;
    private final TaskExecutor viewRefreshExecutor;

    public RefreshViewsJob(AggregateViewRegistry viewRegistry, ViewRefreshService viewRefreshService,
                           @Qualifier("viewRefreshExecutor") TaskExecutor viewRefreshExecutor) {
        this.viewRegistry = viewRegistry;
        this.viewRefreshService = viewRefreshService;
        this.viewRefreshExecutor = viewRefreshExecutor;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public JobRun newRun() {
        Set<String> pending = new LinkedHashSet<>();
        viewRegistry.all().stream().map(AggregateViewDefinition::getName).forEach(pending::add);
        Map<String, Object> rowsWritten = new LinkedHashMap<>();

        return () -> {
            Map<String, CompletableFuture<RefreshResult>> futures = new LinkedHashMap<>();
            for (String view : pending) {
                futures.put(view, CompletableFuture.supplyAsync(() -> viewRefreshService.refresh(view),
                        viewRefreshExecutor));
            }

            List<String> failed = new ArrayList<>();
            Throwable firstError = null;
            for (Map.Entry<String, CompletableFuture<RefreshResult>> entry : futures.entrySet()) {
                try {
                    RefreshResult result = entry.getValue().join();
                    rowsWritten.put(entry.getKey(), result.getRowsWritten());
                    pending.remove(entry.getKey());
                } catch (CompletionException e) {
                    failed.add(entry.getKey());
                    if (firstError == null) {
                        firstError = e.getCause();
                    }
                }
            }

            if (!failed.isEmpty()) {
                throw new RefreshFailureException(failed, firstError);
            }
            return Map.of("rows_written", Map.copyOf(rowsWritten));
        };
    }
}

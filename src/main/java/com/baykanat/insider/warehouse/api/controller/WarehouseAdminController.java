package com.baykanat.insider.warehouse.api.controller;

import com.baykanat.insider.warehouse.api.dto.CacheInvalidateRequest;
import com.baykanat.insider.warehouse.api.dto.CacheInvalidateResponse;
import com.baykanat.insider.warehouse.api.dto.CacheWarmRequest;
import com.baykanat.insider.warehouse.domain.catalog.AggregateViewRegistry;
import com.baykanat.insider.warehouse.domain.model.CacheStatistics;
import com.baykanat.insider.warehouse.domain.model.CacheWarmReport;
import com.baykanat.insider.warehouse.domain.model.RefreshResult;
import com.baykanat.insider.warehouse.domain.model.ViewState;
import com.baykanat.insider.warehouse.domain.model.WarehouseStatistics;
import com.baykanat.insider.warehouse.domain.service.CacheKeyFactory;
import com.baykanat.insider.warehouse.domain.service.CacheWarmingService;
import com.baykanat.insider.warehouse.domain.service.ViewRefreshService;
import com.baykanat.insider.warehouse.domain.service.WarehouseStatisticsService;
import com.baykanat.insider.warehouse.infrastructure.cache.ResultCache;
import com.baykanat.insider.warehouse.scheduler.JobOrchestrator;
import com.baykanat.insider.warehouse.scheduler.JobStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** Operasyon uçları: cache yönetimi, view refresh, job tetikleme ve istatistikler. */
@Slf4j
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
@Tag(name = "Warehouse admin", description = "Cache, view refresh, job and statistics operations")
public class WarehouseAdminController {

    private final ResultCache resultCache;
    private final CacheKeyFactory cacheKeyFactory;
    private final CacheWarmingService cacheWarmingService;
    private final AggregateViewRegistry viewRegistry;
    private final ViewRefreshService viewRefreshService;
    private final JobOrchestrator jobOrchestrator;
    private final WarehouseStatisticsService statisticsService;

    @PostMapping("/cache/invalidate")
    @Operation(summary = "Delete cache entries by key prefix")
    public ResponseEntity<CacheInvalidateResponse> invalidate(@Valid @RequestBody CacheInvalidateRequest request) {
        long deleted = resultCache.invalidate(request.getPrefix());
        return ResponseEntity.ok(new CacheInvalidateResponse(request.getPrefix(), deleted));
    }

    @PostMapping("/cache/views/{view}/invalidate")
    @Operation(summary = "Delete cache entries of every query reading an aggregate view")
    public ResponseEntity<CacheInvalidateResponse> invalidateView(@PathVariable("view") String view) {
        viewRegistry.require(view);
        String prefix = cacheKeyFactory.viewPrefix(view);
        return ResponseEntity.ok(new CacheInvalidateResponse(prefix, resultCache.invalidate(prefix)));
    }

    @DeleteMapping("/cache")
    @Operation(summary = "Clear the whole result cache")
    public ResponseEntity<CacheInvalidateResponse> clear() {
        return ResponseEntity.ok(new CacheInvalidateResponse(cacheKeyFactory.rootPrefix(), resultCache.clear()));
    }

    @PostMapping("/cache/warm")
    @Operation(summary = "Execute queries with default parameters so later calls hit the cache")
    public ResponseEntity<CacheWarmReport> warm(@Valid @RequestBody CacheWarmRequest request) {
        return ResponseEntity.ok(cacheWarmingService.warm(request.getQueryNames()));
    }

    @GetMapping("/cache/stats")
    @Operation(summary = "Cache hit/miss counters since process start")
    public ResponseEntity<CacheStatistics> cacheStatistics() {
        return ResponseEntity.ok(resultCache.statistics());
    }

    @GetMapping("/views")
    @Operation(summary = "Refresh state of every aggregate view")
    public ResponseEntity<List<ViewState>> views() {
        return ResponseEntity.ok(viewRefreshService.states());
    }

    @PostMapping("/views/{name}/refresh")
    @Operation(summary = "Refresh one aggregate view now")
    public ResponseEntity<RefreshResult> refreshView(@PathVariable("name") String name) {
        return ResponseEntity.ok(viewRefreshService.refresh(name));
    }

    @GetMapping("/jobs")
    @Operation(summary = "Last status of every scheduled job")
    public ResponseEntity<List<JobStatus>> jobs() {
        return ResponseEntity.ok(jobOrchestrator.statuses());
    }

    /** Job'u arka planda başlatır; 202 ve başlangıç durumu döner. */
    @PostMapping("/jobs/{name}/run")
    @Operation(summary = "Trigger a scheduled job in the background")
    public ResponseEntity<JobStatus> runJob(@PathVariable("name") String name) {
        JobStatus status = jobOrchestrator.start(name);
        log.info("Job {} triggered manually, state={}", name, status.getState());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(status);
    }

    @GetMapping("/statistics")
    @Operation(summary = "Latest warehouse statistics snapshot (generated on demand if none exists)")
    public ResponseEntity<WarehouseStatistics> statistics() {
        return ResponseEntity.ok(statisticsService.latest().orElseGet(statisticsService::generate));
    }
}

package com.baykanat.insider.warehouse.api.controller;

import com.baykanat.insider.warehouse.domain.catalog.AggregateViewRegistry;
import com.baykanat.insider.warehouse.domain.exception.RefreshFailureException;
import com.baykanat.insider.warehouse.domain.exception.UnknownJobException;
import com.baykanat.insider.warehouse.domain.exception.UnknownViewException;
import com.baykanat.insider.warehouse.domain.model.CacheStatistics;
import com.baykanat.insider.warehouse.domain.model.CacheWarmReport;
import com.baykanat.insider.warehouse.domain.model.RefreshResult;
import com.baykanat.insider.warehouse.domain.model.ViewState;
import com.baykanat.insider.warehouse.domain.service.CacheKeyFactory;
import com.baykanat.insider.warehouse.domain.service.CacheWarmingService;
import com.baykanat.insider.warehouse.domain.service.ViewRefreshService;
import com.baykanat.insider.warehouse.domain.service.WarehouseStatisticsService;
import com.baykanat.insider.warehouse.infrastructure.cache.ResultCache;
import com.baykanat.insider.warehouse.scheduler.JobOrchestrator;
import com.baykanat.insider.warehouse.scheduler.JobState;
import com.baykanat.insider.warehouse.scheduler.JobStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web layer tests for WarehouseAdminController.
 */
@WebMvcTest(WarehouseAdminController.class)
class WarehouseAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ResultCache resultCache;

    @MockitoBean
    private CacheKeyFactory cacheKeyFactory;

    @MockitoBean
    private CacheWarmingService cacheWarmingService;

    @MockitoBean
    private AggregateViewRegistry viewRegistry;

    @MockitoBean
    private ViewRefreshService viewRefreshService;

    @MockitoBean
    private JobOrchestrator jobOrchestrator;

    @MockitoBean
    private WarehouseStatisticsService statisticsService;

    @Test
    @DisplayName("POST /admin/cache/invalidate - deletes by prefix and reports the count")
    void invalidatesByPrefix() throws Exception {
        when(resultCache.invalidate("warehouse:student_engagement:")).thenReturn(4L);

        mockMvc.perform(post("/admin/cache/invalidate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prefix\":\"warehouse:student_engagement:\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.prefix").value("warehouse:student_engagement:"))
                .andExpect(jsonPath("$.deleted_entries").value(4));
    }

    @Test
    @DisplayName("POST /admin/cache/invalidate - blank prefix is rejected")
    void blankPrefixRejected() throws Exception {
        mockMvc.perform(post("/admin/cache/invalidate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prefix\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"))
                .andExpect(jsonPath("$.details[0].field").value("prefix"));

        verify(resultCache, never()).invalidate(anyString());
    }

    @Test
    @DisplayName("POST /admin/cache/views/{view}/invalidate - unknown view returns 404")
    void unknownViewInvalidate() throws Exception {
        when(viewRegistry.require("nope")).thenThrow(new UnknownViewException("nope"));

        mockMvc.perform(post("/admin/cache/views/nope/invalidate"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("DELETE /admin/cache - clears every entry under the root prefix")
    void clearsCache() throws Exception {
        when(cacheKeyFactory.rootPrefix()).thenReturn("warehouse:");
        when(resultCache.clear()).thenReturn(12L);

        mockMvc.perform(delete("/admin/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.prefix").value("warehouse:"))
                .andExpect(jsonPath("$.deleted_entries").value(12));
    }

    @Test
    @DisplayName("POST /admin/cache/warm - returns warmed queries and failures")
    void warmsCache() throws Exception {
        when(cacheWarmingService.warm(List.of("top_performers", "missing"))).thenReturn(CacheWarmReport.builder()
                .warmed(List.of("top_performers"))
                .failures(Map.of("missing", "Unknown query: missing"))
                .build());

        mockMvc.perform(post("/admin/cache/warm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query_names\":[\"top_performers\",\"missing\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.warmed[0]").value("top_performers"))
                .andExpect(jsonPath("$.failures.missing").value("Unknown query: missing"));
    }

    @Test
    @DisplayName("GET /admin/cache/stats - exposes counters and hit ratio")
    void cacheStats() throws Exception {
        when(resultCache.statistics()).thenReturn(CacheStatistics.builder()
                .backend("memory").hits(3).misses(1).build());

        mockMvc.perform(get("/admin/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.backend").value("memory"))
                .andExpect(jsonPath("$.hit_ratio").value(0.75));
    }

    @Test
    @DisplayName("GET /admin/views - lists view refresh state")
    void listsViews() throws Exception {
        when(viewRefreshService.states()).thenReturn(List.of(ViewState.builder()
                .viewName("subject_performance")
                .definitionVersion(1)
                .lastRefreshedAt(Instant.parse("2024-05-01T02:00:00Z"))
                .lastRowsWritten(42L)
                .build()));

        mockMvc.perform(get("/admin/views"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].view_name").value("subject_performance"))
                .andExpect(jsonPath("$[0].last_rows_written").value(42));
    }

    @Test
    @DisplayName("POST /admin/views/{name}/refresh - failed refresh returns 503 with Retry-After")
    void failedRefreshReturns503() throws Exception {
        when(viewRefreshService.refresh("subject_performance"))
                .thenThrow(new RefreshFailureException("subject_performance", new IllegalStateException("lock")));

        mockMvc.perform(post("/admin/views/subject_performance/refresh"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "60"))
                .andExpect(jsonPath("$.details.views[0]").value("subject_performance"));
    }

    @Test
    @DisplayName("POST /admin/views/{name}/refresh - returns rows written")
    void refreshesView() throws Exception {
        when(viewRefreshService.refresh("subject_performance")).thenReturn(RefreshResult.builder()
                .viewName("subject_performance").rowsWritten(42).durationMs(150).build());

        mockMvc.perform(post("/admin/views/subject_performance/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rows_written").value(42));
    }

    @Test
    @DisplayName("POST /admin/jobs/{name}/run - starts the job in background and returns 202 with RUNNING")
    void triggersJob() throws Exception {
        JobStatus running = JobStatus.builder().jobName("refresh-views").state(JobState.RUNNING)
                .startedAt(Instant.parse("2024-05-01T02:00:00Z")).details(Map.of()).build();
        when(jobOrchestrator.start("refresh-views")).thenReturn(running);

        mockMvc.perform(post("/admin/jobs/refresh-views/run"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.job_name").value("refresh-views"))
                .andExpect(jsonPath("$.state").value("RUNNING"))
                .andExpect(jsonPath("$.started_at").exists());
        verify(jobOrchestrator, never()).status("refresh-views");
    }

    @Test
    @DisplayName("POST /admin/jobs/{name}/run - unknown job returns 404")
    void unknownJob() throws Exception {
        when(jobOrchestrator.start("nope")).thenThrow(new UnknownJobException("nope"));

        mockMvc.perform(post("/admin/jobs/nope/run"))
                .andExpect(status().isNotFound());
    }
}

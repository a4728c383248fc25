package com.baykanat.insider.warehouse.domain.service;

import com.baykanat.insider.warehouse.config.AppProperties;
import com.baykanat.insider.warehouse.domain.exception.StatementTimeoutException;
import com.baykanat.insider.warehouse.domain.model.CacheWarmReport;
import com.baykanat.insider.warehouse.domain.model.QueryRequest;
import com.baykanat.insider.warehouse.domain.model.QueryResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link CacheWarmingService}.
 */
@ExtendWith(MockitoExtension.class)
class CacheWarmingServiceTest {

    @Mock
    private WarehouseQueryService queryService;

    private AppProperties appProperties;
    private CacheWarmingService service;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        service = new CacheWarmingService(queryService, appProperties);
    }

    @Test
    @DisplayName("Each query is recomputed with default parameters and first page")
    void warmsWithDefaults() {
        when(queryService.recompute(any())).thenReturn(QueryResult.builder().rowCount(5).build());

        CacheWarmReport report = service.warm(List.of("top_performers", "student_engagement"));

        assertThat(report.isComplete()).isTrue();
        assertThat(report.getWarmed()).containsExactly("top_performers", "student_engagement");
        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(queryService, times(2)).recompute(captor.capture());
        assertThat(captor.getAllValues()).allSatisfy(request -> {
            assertThat(request.getParameters()).isEmpty();
            assertThat(request.getLimit()).isNull();
            assertThat(request.getOffset()).isNull();
        });
    }

    @Test
    @DisplayName("One failing query does not stop the others and is reported")
    void partialFailure() {
        when(queryService.recompute(argThat(r -> r != null && r.getQueryName().equals("slow"))))
                .thenThrow(new StatementTimeoutException("slow", Duration.ofSeconds(1), null));
        when(queryService.recompute(argThat(r -> r != null && r.getQueryName().equals("fast"))))
                .thenReturn(QueryResult.builder().rowCount(1).build());

        CacheWarmReport report = service.warm(List.of("slow", "fast"));

        assertThat(report.isComplete()).isFalse();
        assertThat(report.getWarmed()).containsExactly("fast");
        assertThat(report.getFailures()).containsOnlyKeys("slow");
    }

    @Test
    @DisplayName("Query over a never-refreshed view counts as a failure")
    void uninitializedIsFailure() {
        when(queryService.recompute(any())).thenReturn(QueryResult.uninitialized("top_performers", 100, 0));

        CacheWarmReport report = service.warm(List.of("top_performers"));

        assertThat(report.getWarmed()).isEmpty();
        assertThat(report.getFailures()).containsKey("top_performers");
    }

    @Test
    @DisplayName("warmConfigured uses app.cache.warm-queries")
    void warmsConfiguredQueries() {
        appProperties.getCache().setWarmQueries(List.of("bottom_performers"));
        when(queryService.recompute(any())).thenReturn(QueryResult.builder().build());

        CacheWarmReport report = service.warmConfigured();

        assertThat(report.getWarmed()).containsExactly("bottom_performers");
    }
}

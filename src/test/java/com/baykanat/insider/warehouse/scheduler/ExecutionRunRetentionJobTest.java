package com.baykanat.insider.warehouse.scheduler;

import com.baykanat.insider.warehouse.config.AppProperties;
import com.baykanat.insider.warehouse.infrastructure.persistence.ExecutionRunJdbcRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ExecutionRunRetentionJob}.
 */
@ExtendWith(MockitoExtension.class)
class ExecutionRunRetentionJobTest {

    @Mock
    private ExecutionRunJdbcRepository executionRunRepository;

    private AppProperties appProperties;
    private ExecutionRunRetentionJob job;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        appProperties.getScheduler().setExecutionRunRetentionDays(30);
        appProperties.getScheduler().setJobMaxAttempts(2);
        appProperties.getScheduler().setJobInitialBackoffMs(1);
        appProperties.getScheduler().setJobMaxBackoffMs(2);
        job = new ExecutionRunRetentionJob(executionRunRepository, appProperties);
    }

    @Test
    @DisplayName("Deletes runs older than the configured retention and reports the count")
    void deletesExpiredRuns() throws Exception {
        when(executionRunRepository.deleteOlderThan(30)).thenReturn(7);

        Map<String, Object> details = job.newRun().attempt();

        assertThat(details).containsEntry("deleted", 7).containsEntry("retention_days", 30);
    }

    @Test
    @DisplayName("Non-positive retention keeps every run")
    void disabledRetention() throws Exception {
        appProperties.getScheduler().setExecutionRunRetentionDays(0);

        Map<String, Object> details = job.newRun().attempt();

        assertThat(details).containsEntry("skipped", true);
        verify(executionRunRepository, never()).deleteOlderThan(anyInt());
    }

    @Test
    @DisplayName("A failing delete is retried by the orchestrator and ends FAILED")
    void failingDeleteIsRetried() {
        when(executionRunRepository.deleteOlderThan(30))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));
        JobOrchestrator orchestrator = new JobOrchestrator(List.of(job), appProperties,
                new SimpleMeterRegistry(), new SyncTaskExecutor());

        JobStatus status = orchestrator.run(ExecutionRunRetentionJob.NAME);

        assertThat(status.getState()).isEqualTo(JobState.FAILED);
        assertThat(status.getAttempts()).isEqualTo(2);
        verify(executionRunRepository, times(2)).deleteOlderThan(30);
    }
}

package com.baykanat.insider.warehouse.scheduler;

import com.baykanat.insider.warehouse.config.AppProperties;
import com.baykanat.insider.warehouse.domain.exception.UnknownJobException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.SyncTaskExecutor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Unit tests for {@link JobOrchestrator}: retry with backoff, failure alerting and overlap protection.
 */
class JobOrchestratorTest {

    private AppProperties appProperties;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        appProperties.getScheduler().setJobMaxAttempts(3);
        appProperties.getScheduler().setJobInitialBackoffMs(1);
        appProperties.getScheduler().setJobBackoffMultiplier(2.0);
        appProperties.getScheduler().setJobMaxBackoffMs(4);
        meterRegistry = new SimpleMeterRegistry();
    }

    @Test
    @DisplayName("Successful job ends SUCCEEDED after one attempt with its details")
    void succeeds() {
        JobOrchestrator orchestrator = orchestrator(job("ok", () -> Map.of("rows", 5)));

        JobStatus status = orchestrator.run("ok");

        assertThat(status.getState()).isEqualTo(JobState.SUCCEEDED);
        assertThat(status.getAttempts()).isEqualTo(1);
        assertThat(status.getDetails()).containsEntry("rows", 5);
        assertThat(status.getFinishedAt()).isAfterOrEqualTo(status.getStartedAt());
        assertThat(orchestrator.status("ok")).isEqualTo(status);
    }

    @Test
    @DisplayName("Transient failure is retried and the job still succeeds")
    void retriesThenSucceeds() {
        AtomicInteger calls = new AtomicInteger();
        JobOrchestrator orchestrator = orchestrator(job("flaky", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("database unavailable");
            }
            return Map.of();
        }));

        JobStatus status = orchestrator.run("flaky");

        assertThat(status.getState()).isEqualTo(JobState.SUCCEEDED);
        assertThat(status.getAttempts()).isEqualTo(3);
        assertThat(meterRegistry.find("warehouse.job.failures").counter()).isNull();
    }

    @Test
    @DisplayName("Exhausted attempts end FAILED, increment the failure counter and do not throw")
    void exhaustsAttempts() {
        AtomicInteger calls = new AtomicInteger();
        JobOrchestrator orchestrator = orchestrator(job("broken", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("refresh timed out");
        }));

        JobStatus status = orchestrator.run("broken");

        assertThat(calls).hasValue(3);
        assertThat(status.getState()).isEqualTo(JobState.FAILED);
        assertThat(status.getAttempts()).isEqualTo(3);
        assertThat(status.getLastError()).isEqualTo("refresh timed out");
        assertThat(meterRegistry.get("warehouse.job.failures").tag("job", "broken").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("A failed job can run again")
    void failedJobCanRestart() {
        AtomicInteger calls = new AtomicInteger();
        JobOrchestrator orchestrator = orchestrator(job("again", () -> {
            if (calls.incrementAndGet() <= 3) {
                throw new IllegalStateException("down");
            }
            return Map.of();
        }));

        assertThat(orchestrator.run("again").getState()).isEqualTo(JobState.FAILED);
        assertThat(orchestrator.run("again").getState()).isEqualTo(JobState.SUCCEEDED);
    }

    @Test
    @DisplayName("Run requested while the job is RUNNING is skipped")
    void skipsOverlappingRun() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        JobOrchestrator orchestrator = orchestrator(job("long", () -> {
            calls.incrementAndGet();
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return Map.of();
        }));

        CompletableFuture<JobStatus> first = CompletableFuture.supplyAsync(() -> orchestrator.run("long"));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        JobStatus skipped = orchestrator.run("long");
        release.countDown();

        assertThat(skipped.getState()).isEqualTo(JobState.RUNNING);
        assertThat(first.get(5, TimeUnit.SECONDS).getState()).isEqualTo(JobState.SUCCEEDED);
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("start returns the RUNNING snapshot and the job finishes on the executor")
    void startReturnsRunning() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        JobOrchestrator orchestrator = new JobOrchestrator(List.of(job("async", () -> {
            release.await(5, TimeUnit.SECONDS);
            return Map.of("rows", 1);
        })), appProperties, meterRegistry, new SimpleAsyncTaskExecutor("job-test-"));

        JobStatus started = orchestrator.start("async");
        JobStatus again = orchestrator.start("async");
        release.countDown();

        assertThat(started.getState()).isEqualTo(JobState.RUNNING);
        assertThat(started.getStartedAt()).isNotNull();
        assertThat(again).isSameAs(started);
        assertThat(awaitFinished(orchestrator, "async").getState()).isEqualTo(JobState.SUCCEEDED);
    }

    @Test
    @DisplayName("start on an unknown job is rejected before anything is scheduled")
    void startUnknownJob() {
        JobOrchestrator orchestrator = orchestrator(job("a", Map::of));

        assertThatThrownBy(() -> orchestrator.start("missing")).isInstanceOf(UnknownJobException.class);
        assertThat(orchestrator.status("a").getState()).isEqualTo(JobState.IDLE);
    }

    @Test
    @DisplayName("Statuses start IDLE; unknown job names are rejected")
    void statusesAndUnknownJob() {
        JobOrchestrator orchestrator = orchestrator(job("a", Map::of), job("b", Map::of));

        assertThat(orchestrator.statuses())
                .extracting(JobStatus::getJobName, JobStatus::getState)
                .containsExactly(
                        tuple("a", JobState.IDLE),
                        tuple("b", JobState.IDLE));
        assertThatThrownBy(() -> orchestrator.run("missing")).isInstanceOf(UnknownJobException.class);
        assertThatThrownBy(() -> orchestrator.status("missing")).isInstanceOf(UnknownJobException.class);
    }

    private static JobStatus awaitFinished(JobOrchestrator orchestrator, String name) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (orchestrator.status(name).getState() == JobState.RUNNING && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        return orchestrator.status(name);
    }

    private JobOrchestrator orchestrator(WarehouseJob... jobs) {
        return new JobOrchestrator(List.of(jobs), appProperties, meterRegistry, new SyncTaskExecutor());
    }

    private static WarehouseJob job(String name, JobRun run) {
        return new WarehouseJob() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public JobRun newRun() {
                return run;
            }
        };
    }
}

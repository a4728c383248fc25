package com.baykanat.insider.warehouse.scheduler;

import com.baykanat.insider.warehouse.config.AppProperties;
import com.baykanat.insider.warehouse.domain.exception.UnknownJobException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Job'ları exponential backoff ile en fazla job-max-attempts kez dener. Denemeler tükenirse FAILED + ALERT log;
 * exception dışarı çıkmaz. Aynı job RUNNING iken gelen istek atlanır.
 */
@Slf4j
@Component
public class JobOrchestrator {

    private final Map<String, WarehouseJob> jobs = new LinkedHashMap<>();
    private final Map<String, JobStatus> statuses = new ConcurrentHashMap<>();
    private final AppProperties appProperties;
    private final MeterRegistry meterRegistry;
    private final TaskExecutor jobExecutor;

    public JobOrchestrator(List<WarehouseJob> jobs, AppProperties appProperties, MeterRegistry meterRegistry,
                           @Qualifier("jobExecutor") TaskExecutor jobExecutor) {
        jobs.forEach(job -> {
            this.jobs.put(job.name(), job);
            this.statuses.put(job.name(), JobStatus.idle(job.name()));
        });
        this.appProperties = appProperties;
        this.meterRegistry = meterRegistry;
        this.jobExecutor = jobExecutor;
    }

    public JobStatus run(String jobName) {
        return run(require(jobName));
    }

    /**
     * Job'u RUNNING olarak işaretleyip arka planda çalıştırır ve RUNNING durumunu döner.
     * Job zaten çalışıyorsa mevcut durum döner.
     */
    public JobStatus start(String jobName) {
        WarehouseJob job = require(jobName);
        JobStatus running = runningStatus(job.name());
        JobStatus current = claim(running);
        if (current != running) {
            return current;
        }
        try {
            jobExecutor.execute(() -> finish(job, running));
        } catch (TaskRejectedException e) {
            JobStatus rejected = failed(job.name(), running.getStartedAt(), 0, e);
            statuses.put(job.name(), rejected);
            return rejected;
        }
        return running;
    }

    public JobStatus run(WarehouseJob job) {
        JobStatus running = runningStatus(job.name());
        JobStatus current = claim(running);
        if (current != running) {
            return current;
        }
        return finish(job, running);
    }

    public JobStatus status(String jobName) {
        require(jobName);
        return statuses.get(jobName);
    }

    public List<JobStatus> statuses() {
        return new ArrayList<>(jobs.keySet().stream().map(statuses::get).toList());
    }

    private static JobStatus runningStatus(String name) {
        return JobStatus.builder().jobName(name).state(JobState.RUNNING)
                .startedAt(Instant.now()).details(Map.of()).build();
    }

    /** Durumu running'e geçirir; başka bir çalıştırma sürüyorsa onun durumunu döner. */
    private JobStatus claim(JobStatus running) {
        String name = running.getJobName();
        JobStatus current = statuses.compute(name, (key, previous) ->
                previous == null || previous.getState().canStart() ? running : previous);
        if (current != running) {
            log.warn("Job {} is already running since {}, skipping this run", name, current.getStartedAt());
            return current;
        }
        log.info("Job {} started", name);
        return running;
    }

    private JobStatus finish(WarehouseJob job, JobStatus running) {
        JobStatus finished = attemptWithBackOff(job, running.getStartedAt());
        statuses.put(job.name(), finished);
        return finished;
    }

    private JobStatus attemptWithBackOff(WarehouseJob job, Instant startedAt) {
        AppProperties.SchedulerProperties props = appProperties.getScheduler();
        int maxAttempts = Math.max(1, props.getJobMaxAttempts());
        BackOffExecution backOff = backOff(props).start();
        JobRun run;
        try {
            run = job.newRun();
        } catch (RuntimeException e) {
            return failed(job.name(), startedAt, 0, e);
        }

        Exception lastError = null;
        int attempt = 0;
        while (attempt < maxAttempts) {
            attempt++;
            try {
                Map<String, Object> details = run.attempt();
                log.info("Job {} succeeded on attempt {}/{}", job.name(), attempt, maxAttempts);
                return JobStatus.builder()
                        .jobName(job.name())
                        .state(JobState.SUCCEEDED)
                        .attempts(attempt)
                        .startedAt(startedAt)
                        .finishedAt(Instant.now())
                        .details(details != null ? details : Map.of())
                        .build();
            } catch (Exception e) {
                lastError = e;
                log.warn("Job {} attempt {}/{} failed: {}", job.name(), attempt, maxAttempts, e.getMessage());
            }
            if (attempt < maxAttempts && !pause(job.name(), backOff)) {
                break;
            }
        }
        return failed(job.name(), startedAt, attempt, lastError);
    }

    /** Bir sonraki denemeye kadar bekler; kesilirse false. */
    private boolean pause(String jobName, BackOffExecution backOff) {
        long waitMs = backOff.nextBackOff();
        if (waitMs == BackOffExecution.STOP) {
            return false;
        }
        log.debug("Job {} retrying in {}ms", jobName, waitMs);
        try {
            Thread.sleep(waitMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Job {} interrupted while backing off", jobName);
            return false;
        }
    }

    private JobStatus failed(String jobName, Instant startedAt, int attempts, Exception error) {
        String message = error != null ? error.getMessage() : "interrupted";
        log.error("ALERT: job {} failed after {} attempt(s): {}", jobName, attempts, message, error);
        meterRegistry.counter("warehouse.job.failures", "job", jobName).increment();
        return JobStatus.builder()
                .jobName(jobName)
                .state(JobState.FAILED)
                .attempts(attempts)
                .startedAt(startedAt)
                .finishedAt(Instant.now())
                .lastError(message)
                .details(Map.of())
                .build();
    }

    private static ExponentialBackOff backOff(AppProperties.SchedulerProperties props) {
        ExponentialBackOff backOff = new ExponentialBackOff(props.getJobInitialBackoffMs(), props.getJobBackoffMultiplier());
        backOff.setMaxInterval(props.getJobMaxBackoffMs());
        return backOff;
    }

    private WarehouseJob require(String jobName) {
        WarehouseJob job = jobs.get(jobName);
        if (job == null) {
            throw new UnknownJobException(jobName);
        }
        return job;
    }
}

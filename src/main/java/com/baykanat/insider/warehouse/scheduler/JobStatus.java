package com.baykanat.insider.warehouse.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/** Bir job'un son durumu (değişmez görüntü). */
@Value
@Builder(toBuilder = true)
public class JobStatus {

    @JsonProperty("job_name")
    String jobName;

    @JsonProperty("state")
    JobState state;

    @JsonProperty("attempts")
    int attempts;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("finished_at")
    Instant finishedAt;

    @JsonProperty("last_error")
    String lastError;

    @JsonProperty("details")
    Map<String, Object> details;

    public static JobStatus idle(String jobName) {
        return JobStatus.builder().jobName(jobName).state(JobState.IDLE).details(Map.of()).build();
    }
}

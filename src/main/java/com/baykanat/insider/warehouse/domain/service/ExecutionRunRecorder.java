package com.baykanat.insider.warehouse.domain.service;

import com.baykanat.insider.warehouse.domain.catalog.QueryDefinition;
import com.baykanat.insider.warehouse.domain.mapper.ExecutionRunMapper;
import com.baykanat.insider.warehouse.domain.model.ExecutionRun;
import com.baykanat.insider.warehouse.domain.model.QueryResult;
import com.baykanat.insider.warehouse.infrastructure.kafka.ExecutionRunKafkaProducer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

/** Her sorgu çalıştırması için ExecutionRun üretir: yapısal log, Micrometer metrikleri ve Kafka kaydı. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionRunRecorder {

    private final ExecutionRunMapper executionRunMapper;
    private final ExecutionRunKafkaProducer executionRunProducer;
    private final MeterRegistry meterRegistry;

    /** Gözlem hataları sorgu sonucunu etkilemez; null döner. */
    public ExecutionRun record(QueryDefinition query, QueryResult result, long durationMs) {
        try {
            ExecutionRun run = executionRunMapper.toExecutionRun(
                    result, query.getTarget().keySegment(), durationMs, Instant.now());
            log.info("execution_run query={} target={} source={} duration_ms={} rows={} from_cache={} uninitialized={}",
                    run.getQueryName(), run.getTarget(), run.getSource() != null ? run.getSource().value() : "none",
                    run.getDurationMs(), run.getRowCount(), run.isFromCache(), run.isUninitialized());

            String outcome = outcome(run);
            Timer.builder("warehouse.query.latency")
                    .tag("query", run.getQueryName())
                    .tag("outcome", outcome)
                    .register(meterRegistry)
                    .record(durationMs, TimeUnit.MILLISECONDS);
            Counter.builder("warehouse.query.cache")
                    .tag("query", run.getQueryName())
                    .tag("result", outcome)
                    .register(meterRegistry)
                    .increment();

            executionRunProducer.publish(run);
            return run;
        } catch (RuntimeException e) {
            log.warn("Failed to record execution run for {}: {}", query.getName(), e.getMessage());
            return null;
        }
    }

    private static String outcome(ExecutionRun run) {
        if (run.isUninitialized()) {
            return "uninitialized";
        }
        return run.isFromCache() ? "hit" : "miss";
    }
}

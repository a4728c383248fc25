package com.baykanat.insider.warehouse.domain.service;

import com.baykanat.insider.warehouse.domain.catalog.QueryDefinition;
import com.baykanat.insider.warehouse.domain.catalog.QueryTarget;
import com.baykanat.insider.warehouse.domain.mapper.ExecutionRunMapperImpl;
import com.baykanat.insider.warehouse.domain.model.ExecutionRun;
import com.baykanat.insider.warehouse.domain.model.QueryResult;
import com.baykanat.insider.warehouse.domain.model.QuerySource;
import com.baykanat.insider.warehouse.infrastructure.kafka.ExecutionRunKafkaProducer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link ExecutionRunRecorder}.
 */
@ExtendWith(MockitoExtension.class)
class ExecutionRunRecorderTest {

    private static final QueryDefinition QUERY = QueryDefinition.builder()
            .name("top_performers")
            .target(QueryTarget.view("subject_performance"))
            .sql("SELECT 1")
            .build();

    @Mock
    private ExecutionRunKafkaProducer producer;

    private SimpleMeterRegistry meterRegistry;
    private ExecutionRunRecorder recorder;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        recorder = new ExecutionRunRecorder(new ExecutionRunMapperImpl(), producer, meterRegistry);
    }

    @Test
    @DisplayName("Run carries query, target, source and timing and is published")
    void recordsAndPublishes() {
        QueryResult result = QueryResult.builder()
                .queryName("top_performers")
                .rows(List.of())
                .rowCount(7)
                .source(QuerySource.REPLICA)
                .build();

        ExecutionRun run = recorder.record(QUERY, result, 42);

        assertThat(run.getQueryName()).isEqualTo("top_performers");
        assertThat(run.getTarget()).isEqualTo("subject_performance");
        assertThat(run.getSource()).isEqualTo(QuerySource.REPLICA);
        assertThat(run.getDurationMs()).isEqualTo(42);
        assertThat(run.getRowCount()).isEqualTo(7);
        assertThat(run.getExecutedAt()).isNotNull();
        verify(producer).publish(run);
    }

    @Test
    @DisplayName("Latency timer and cache counter are tagged by outcome")
    void recordsMetrics() {
        recorder.record(QUERY, QueryResult.builder().queryName("top_performers").fromCache(true).build(), 3);
        recorder.record(QUERY, QueryResult.builder().queryName("top_performers").build(), 120);
        recorder.record(QUERY, QueryResult.uninitialized("top_performers", 20, 0), 1);

        assertThat(meterRegistry.get("warehouse.query.cache").tag("result", "hit").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("warehouse.query.cache").tag("result", "miss").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("warehouse.query.cache").tag("result", "uninitialized").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("warehouse.query.latency").tag("outcome", "miss").timer()
                .totalTime(TimeUnit.MILLISECONDS)).isEqualTo(120.0);
    }

    @Test
    @DisplayName("Publishing failure is logged and does not reach the caller")
    void publishFailureIsSwallowed() {
        doThrow(new IllegalStateException("broker down")).when(producer).publish(any());

        ExecutionRun run = recorder.record(QUERY, QueryResult.builder().queryName("top_performers").build(), 5);

        assertThat(run).isNull();
    }
}

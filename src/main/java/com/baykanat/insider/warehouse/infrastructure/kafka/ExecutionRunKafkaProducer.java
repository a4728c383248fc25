package com.baykanat.insider.warehouse.infrastructure.kafka;

import com.baykanat.insider.warehouse.config.AppProperties;
import com.baykanat.insider.warehouse.domain.model.ExecutionRun;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.Objects;

/** ExecutionRun kayıtlarını Kafka'ya gönderir; ack beklenmez, sorgu yolu bloklanmaz. */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExecutionRunKafkaProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final AppProperties appProperties;

    /** Partition key query_name; gönderim hatası sadece log. */
    @CircuitBreaker(name = "executionRunPublisher", fallbackMethod = "publishFallback")
    public void publish(ExecutionRun run) {
        String topic = Objects.requireNonNull(appProperties.getKafka().getTopic().getExecutionRuns());
        String key = Objects.requireNonNull(run.getQueryName(), "queryName");
        kafkaTemplate.send(topic, key, run).whenComplete((result, ex) -> {
            if (ex != null) {
                log.warn("Execution run for {} was not published: {}", key, ex.getMessage());
            }
        });
    }

    /** Circuit breaker açık veya Kafka yok; kayıt düşürülür. */
    @SuppressWarnings("unused")
    private void publishFallback(ExecutionRun run, Exception ex) {
        log.warn("Execution run publisher unavailable, dropping run for {}: {}", run.getQueryName(), ex.getMessage());
    }
}

package com.baykanat.insider.warehouse.infrastructure.kafka;

import com.baykanat.insider.warehouse.domain.mapper.ExecutionRunMapper;
import com.baykanat.insider.warehouse.domain.model.ExecutionRun;
import com.baykanat.insider.warehouse.infrastructure.persistence.ExecutionRunJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Headers;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** execution-runs topic'ten batch tüketir ve warehouse_execution_runs'a yazar. Çözülemeyen kayıtlar DLT'ye. */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExecutionRunKafkaConsumer {

    /** ErrorHandlingDeserializer hata durumunda bu header'ı set eder; value null olur. */
    private static final String VALUE_DESERIALIZATION_EXCEPTION_HEADER =
            "springDeserializationValueException";

    private final ExecutionRunJdbcRepository executionRunRepository;
    private final ExecutionRunMapper executionRunMapper;
    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${app.kafka.topic.execution-runs}")
    private String executionRunsTopic;

    @KafkaListener(
            topics = "${app.kafka.topic.execution-runs}",
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(List<ConsumerRecord<String, Object>> records, Acknowledgment acknowledgment) {
        log.debug("Received batch of {} execution runs", records.size());

        List<ExecutionRun> runs = new ArrayList<>(records.size());
        int dltCount = 0;

        for (ConsumerRecord<String, Object> record : records) {
            if (hasDeserializationError(record)) {
                log.error("Kafka deserialization failed for record at offset={}, partition={}",
                        record.offset(), record.partition());
                publishToDlt(record, "Kafka-level deserialization failure");
                dltCount++;
                continue;
            }

            try {
                ExecutionRun run = executionRunMapper.fromRecordValue(record.value());
                if (run != null && run.getQueryName() != null) {
                    runs.add(run);
                } else {
                    publishToDlt(record, "missing query_name");
                    dltCount++;
                }
            } catch (Exception e) {
                log.error("Failed to decode execution run at offset={}, partition={}: {}",
                        record.offset(), record.partition(), e.getMessage());
                publishToDlt(record, e.getMessage());
                dltCount++;
            }
        }

        if (!runs.isEmpty()) {
            executionRunRepository.batchInsert(runs);
            log.debug("Stored {} execution runs ({} sent to DLT)", runs.size(), dltCount);
        } else if (dltCount > 0) {
            log.warn("All {} records in batch were undecodable, {} sent to DLT", records.size(), dltCount);
        }

        acknowledgment.acknowledge();
    }

    private boolean hasDeserializationError(ConsumerRecord<String, Object> record) {
        Headers headers = record.headers();
        return headers.lastHeader(VALUE_DESERIALIZATION_EXCEPTION_HEADER) != null;
    }

    /** DLT gönderimi hata verirse sadece log, batch devam eder. */
    private void publishToDlt(ConsumerRecord<String, Object> record, String reason) {
        String topic = Objects.requireNonNull(executionRunsTopic, "executionRunsTopic") + ".DLT";
        try {
            String key = Objects.requireNonNullElse(record.key(), "");
            kafkaTemplate.send(topic, key, record.value());
            log.warn("Sent undecodable record to DLT: topic={}, offset={}, partition={}, reason={}",
                    topic, record.offset(), record.partition(), Objects.requireNonNullElse(reason, ""));
        } catch (Exception dltEx) {
            log.error("Failed to publish record to DLT {}: {}", topic, dltEx.getMessage());
        }
    }
}

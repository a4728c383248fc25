package com.baykanat.insider.warehouse.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import java.util.Objects;

/** Execution run ve DLT topic bean'leri. */
@Configuration
public class KafkaProducerConfig {

    private final String executionRunsTopic;

    public KafkaProducerConfig(AppProperties appProperties) {
        this.executionRunsTopic = Objects.requireNonNull(appProperties.getKafka().getTopic().getExecutionRuns(),
                "executionRunsTopic");
    }

    /** Partition key query_name; 3 partition tek consumer grubuna yeter. */
    @Bean
    public NewTopic executionRunsTopic() {
        return TopicBuilder.name(executionRunsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic executionRunsDlt() {
        return TopicBuilder.name(executionRunsTopic + ".DLT")
                .partitions(1)
                .replicas(1)
                .build();
    }
}

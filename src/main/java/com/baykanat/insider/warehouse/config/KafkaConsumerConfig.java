package com.baykanat.insider.warehouse.config;

import org.apache.kafka.common.TopicPartition;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaOperations;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.ExponentialBackOff;

/** Consumer hata işleme: exponential backoff retry, ardından DLT'ye gönderim. */
@Configuration
public class KafkaConsumerConfig {

    @SuppressWarnings("null")
    @Bean
    public CommonErrorHandler kafkaErrorHandler(KafkaOperations<?, ?> kafkaOperations, AppProperties appProperties) {
        String dltTopic = appProperties.getKafka().getTopic().getExecutionRuns() + ".DLT";
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(
                kafkaOperations,
                (record, ex) -> new TopicPartition(dltTopic, 0)
        );

        // insert hatası (DB kısa süreli yok) için 1s, 2s, 4s; sonra DLT
        ExponentialBackOff backOff = new ExponentialBackOff(1000L, 2.0);
        backOff.setMaxInterval(4000L);
        backOff.setMaxElapsedTime(7000L);

        return new DefaultErrorHandler(recoverer, backOff);
    }
}

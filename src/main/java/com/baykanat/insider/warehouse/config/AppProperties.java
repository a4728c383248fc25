package com.baykanat.insider.warehouse.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/** app.* için tip güvenli configuration (replica, timeout, cache, scheduler, Kafka topic adları). */
@Configuration
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private WarehouseProperties warehouse = new WarehouseProperties();
    private CacheProperties cache = new CacheProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();
    private KafkaTopicProperties kafka = new KafkaTopicProperties();

    @Getter
    @Setter
    public static class WarehouseProperties {
        private boolean replicaEnabled = false;
        private int statementTimeoutSeconds = 30;
        /** Motor genelindeki satır üst sınırı; hiçbir sorgunun maxLimit'i bunu aşamaz. */
        private int maxResultRows = 10000;
        private long slowQueryThresholdMs = 1000;
        private int refreshTimeoutSeconds = 900;
        /** Replica bağlantısı; yalnızca replicaEnabled=true iken kullanılır. */
        private ReplicaProperties replica = new ReplicaProperties();
    }

    @Getter
    @Setter
    public static class ReplicaProperties {
        private String url;
        private String username;
        private String password;
        private int maximumPoolSize = 10;
        private long connectionTimeoutMs = 2000;
    }

    @Getter
    @Setter
    public static class CacheProperties {
        /** redis veya memory. */
        private String backend = "redis";
        private long ttlSeconds = 3600;
        private String keyPrefix = "warehouse";
        /** memory backend için en fazla kayıt. */
        private long maxEntries = 10000;
        /** Yoğun saat öncesi ısıtılacak sorgular. */
        private List<String> warmQueries = new ArrayList<>(List.of(
                "student_engagement", "top_performers", "bottom_performers"));
    }

    @Getter
    @Setter
    public static class SchedulerProperties {
        private String zone = "UTC";
        private String refreshViewsCron = "0 0 2 * * *";
        private String statisticsCron = "0 0 3 * * *";
        private String warmCacheCron = "0 0 7 * * *";
        private int jobMaxAttempts = 3;
        private long jobInitialBackoffMs = 60000;
        private double jobBackoffMultiplier = 2.0;
        private long jobMaxBackoffMs = 240000;
        /** Aynı anda yenilenebilecek farklı view sayısı. */
        private int refreshParallelism = 2;
        private String executionRunCleanupCron = "0 30 4 * * *";
        /** 0 veya negatif: execution run kayıtları silinmez. */
        private int executionRunRetentionDays = 30;
    }

    @Getter
    @Setter
    public static class KafkaTopicProperties {
        private TopicNames topic = new TopicNames();

        @Getter
        @Setter
        public static class TopicNames {
            private String executionRuns = "warehouse-execution-runs";
        }
    }
}

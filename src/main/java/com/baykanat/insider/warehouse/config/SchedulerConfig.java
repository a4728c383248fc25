package com.baykanat.insider.warehouse.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** View refresh ve manuel job tetikleme için thread havuzları. */
@Configuration
public class SchedulerConfig {

    /** Farklı view'ların paralel yenilenmesi; havuz boyutu refresh-parallelism. */
    @Bean
    public ThreadPoolTaskExecutor viewRefreshExecutor(AppProperties appProperties) {
        int parallelism = Math.max(1, appProperties.getScheduler().getRefreshParallelism());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("view-refresh-");
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean
    public ThreadPoolTaskExecutor jobExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("warehouse-job-");
        executor.setCorePoolSize(3);
        executor.setMaxPoolSize(3);
        return executor;
    }
}

package com.baykanat.insider.warehouse.config;

import com.baykanat.insider.warehouse.domain.service.CacheKeyFactory;
import com.baykanat.insider.warehouse.infrastructure.cache.InMemoryResultCacheStore;
import com.baykanat.insider.warehouse.infrastructure.cache.RedisResultCacheStore;
import com.baykanat.insider.warehouse.infrastructure.cache.ResultCache;
import com.baykanat.insider.warehouse.infrastructure.cache.ResultCacheStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/** Sonuç cache'i; store app.cache.backend ile seçilir (redis varsayılan, memory tek instance için). */
@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    @ConditionalOnProperty(prefix = "app.cache", name = "backend", havingValue = "redis", matchIfMissing = true)
    public ResultCacheStore redisResultCacheStore(StringRedisTemplate stringRedisTemplate) {
        log.info("Result cache backend: redis");
        return new RedisResultCacheStore(stringRedisTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.cache", name = "backend", havingValue = "memory")
    public ResultCacheStore inMemoryResultCacheStore(AppProperties appProperties) {
        log.info("Result cache backend: memory (max {} entries)", appProperties.getCache().getMaxEntries());
        return new InMemoryResultCacheStore(appProperties.getCache().getMaxEntries());
    }

    @Bean
    public ResultCache resultCache(ResultCacheStore resultCacheStore, ObjectMapper objectMapper,
                                   AppProperties appProperties) {
        return new ResultCache(resultCacheStore, objectMapper, appProperties.getCache().getKeyPrefix());
    }

    @Bean
    public CacheKeyFactory cacheKeyFactory(ObjectMapper objectMapper, AppProperties appProperties) {
        return new CacheKeyFactory(objectMapper, appProperties.getCache().getKeyPrefix());
    }
}

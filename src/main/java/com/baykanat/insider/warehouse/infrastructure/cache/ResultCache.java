package com.baykanat.insider.warehouse.infrastructure.cache;

import com.baykanat.insider.warehouse.domain.model.CacheLookup;
import com.baykanat.insider.warehouse.domain.model.CacheStatistics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Sorgu sonuçları için read-through cache. Store hataları miss olarak ele alınır;
 * cache hiçbir zaman tek doğruluk kaynağı değildir.
 * <p>
 * Hesaplama sürerken aynı prefix invalidate edilirse hesaplanan değer yazılmaz;
 * her invalidate prefix'e yeni bir generation atar.
 */
@Slf4j
public class ResultCache {

    private final ResultCacheStore store;
    private final ObjectMapper objectMapper;
    private final String rootPrefix;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong storeFailures = new AtomicLong();
    private final AtomicLong invalidatedEntries = new AtomicLong();

    private final AtomicLong generation = new AtomicLong();
    private final Map<String, Long> invalidatedAt = new ConcurrentHashMap<>();

    public ResultCache(ResultCacheStore store, ObjectMapper objectMapper, String keyPrefix) {
        this.store = store;
        this.objectMapper = objectMapper.copy().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        this.rootPrefix = keyPrefix + ":";
    }

    /** Key varsa cache'teki değeri, yoksa supplier'ın hesapladığını (ve TTL ile yazılanı) döner. */
    public <T> CacheLookup<T> getOrCompute(String key, Class<T> type, Supplier<T> supplier, Duration ttl) {
        Optional<T> cached = read(key, type);
        if (cached.isPresent()) {
            hits.incrementAndGet();
            log.debug("Cache hit: {}", key);
            return new CacheLookup<>(cached.get(), true);
        }
        misses.incrementAndGet();
        log.debug("Cache miss: {}", key);
        long startedAt = generation.get();
        T value = supplier.get();
        return new CacheLookup<>(write(key, type, value, ttl, startedAt), false);
    }

    /** Cache'e bakmadan yeniden hesaplar ve yazar (warm). */
    public <T> T recompute(String key, Class<T> type, Supplier<T> supplier, Duration ttl) {
        long startedAt = generation.get();
        T value = supplier.get();
        return write(key, type, value, ttl, startedAt);
    }

    /** Prefix ile başlayan kayıtları siler; store'a ulaşılamazsa 0. */
    public long invalidate(String prefix) {
        invalidatedAt.merge(prefix, generation.incrementAndGet(), Math::max);
        try {
            long deleted = store.deleteByPrefix(prefix);
            invalidatedEntries.addAndGet(deleted);
            log.info("Cache invalidated: prefix={}, entries={}", prefix, deleted);
            return deleted;
        } catch (RuntimeException e) {
            storeFailures.incrementAndGet();
            log.warn("Cache invalidation failed for prefix {}: {}", prefix, e.getMessage());
            return 0L;
        }
    }

    /** Bu uygulamanın tüm kayıtlarını siler. */
    public long clear() {
        return invalidate(rootPrefix);
    }

    public CacheStatistics statistics() {
        return CacheStatistics.builder()
                .backend(store.backend())
                .hits(hits.get())
                .misses(misses.get())
                .storeFailures(storeFailures.get())
                .invalidatedEntries(invalidatedEntries.get())
                .build();
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        try {
            Optional<String> json = store.get(key);
            if (json.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json.get(), type));
        } catch (JsonProcessingException e) {
            storeFailures.incrementAndGet();
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            storeFailures.incrementAndGet();
            log.warn("Cache read failed for {}, computing: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Değeri JSON olarak yazar ve JSON'dan geri okunmuş halini döner; böylece miss ile hit
     * aynı Java tiplerini taşır. Serileştirilemeyen değer olduğu gibi döner.
     */
    private <T> T write(String key, Class<T> type, T value, Duration ttl, long startedAt) {
        String json;
        T normalized;
        try {
            json = objectMapper.writeValueAsString(value);
            normalized = objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            storeFailures.incrementAndGet();
            log.warn("Could not serialize cache entry {}: {}", key, e.getOriginalMessage());
            return value;
        }
        if (invalidatedSince(key, startedAt)) {
            log.debug("Skipping cache write for {}: invalidated while computing", key);
            return normalized;
        }
        try {
            store.put(key, json, ttl);
            if (invalidatedSince(key, startedAt)) {
                store.deleteByPrefix(key);
                log.debug("Evicted {}: invalidated during write", key);
            }
        } catch (RuntimeException e) {
            storeFailures.incrementAndGet();
            log.warn("Cache write failed for {}: {}", key, e.getMessage());
        }
        return normalized;
    }

    private boolean invalidatedSince(String key, long startedAt) {
        return invalidatedAt.entrySet().stream()
                .anyMatch(entry -> key.startsWith(entry.getKey()) && entry.getValue() > startedAt);
    }
}

package com.baykanat.insider.warehouse.infrastructure.cache;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Redis üzerinde paylaşımlı sonuç cache'i; prefix silme SCAN ile, KEYS kullanılmaz. */
@Slf4j
@RequiredArgsConstructor
public class RedisResultCacheStore implements ResultCacheStore {

    private static final int SCAN_BATCH = 500;

    private final RedisTemplate<String, String> redisTemplate;

    @Override
    public String backend() {
        return "redis";
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "getFallback")
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "putFallback")
    public void put(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "deleteFallback")
    public long deleteByPrefix(String prefix) {
        Long deleted = redisTemplate.execute((RedisCallback<Long>) connection -> scanAndDelete(connection, prefix));
        return deleted != null ? deleted : 0L;
    }

    private long scanAndDelete(RedisConnection connection, String prefix) {
        ScanOptions options = ScanOptions.scanOptions()
                .match(escapeGlob(prefix) + "*")
                .count(SCAN_BATCH)
                .build();
        long deleted = 0;
        List<byte[]> batch = new ArrayList<>(SCAN_BATCH);
        try (Cursor<byte[]> cursor = connection.keyCommands().scan(options)) {
            while (cursor.hasNext()) {
                batch.add(cursor.next());
                if (batch.size() == SCAN_BATCH) {
                    deleted += deleteKeys(connection, batch);
                    batch.clear();
                }
            }
        }
        if (!batch.isEmpty()) {
            deleted += deleteKeys(connection, batch);
        }
        log.debug("Redis prefix delete: prefix={}, deleted={}", prefix, deleted);
        return deleted;
    }

    private long deleteKeys(RedisConnection connection, List<byte[]> keys) {
        Long count = connection.keyCommands().del(keys.toArray(new byte[0][]));
        return count != null ? count : 0L;
    }

    /** SCAN MATCH glob karakterlerini kaçışlar. */
    static String escapeGlob(String prefix) {
        StringBuilder escaped = new StringBuilder(prefix.length());
        for (char c : prefix.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    @SuppressWarnings("unused")
    private Optional<String> getFallback(String key, Exception e) {
        log.warn("Redis unavailable, treating {} as cache miss: {}", key, e.getMessage());
        throw new CacheStoreUnavailableException("Redis read failed", e);
    }

    @SuppressWarnings("unused")
    private void putFallback(String key, String value, Duration ttl, Exception e) {
        log.warn("Redis unavailable, skipping cache write for {}: {}", key, e.getMessage());
        throw new CacheStoreUnavailableException("Redis write failed", e);
    }

    @SuppressWarnings("unused")
    private long deleteFallback(String prefix, Exception e) {
        log.warn("Redis unavailable, skipping invalidation of {}: {}", prefix, e.getMessage());
        throw new CacheStoreUnavailableException("Redis invalidation failed", e);
    }
}

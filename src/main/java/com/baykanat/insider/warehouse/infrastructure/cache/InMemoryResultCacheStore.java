package com.baykanat.insider.warehouse.infrastructure.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/** Tek instance için Caffeine tabanlı cache; her kayıt kendi TTL'i ile yazılır. */
public class InMemoryResultCacheStore implements ResultCacheStore {

    private final Cache<String, Entry> cache;

    public InMemoryResultCacheStore(long maxEntries) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry entry, long currentTime) {
                        return entry.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                        return entry.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    public String backend() {
        return "memory";
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = cache.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        cache.put(key, new Entry(value, ttl));
    }

    @Override
    public long deleteByPrefix(String prefix) {
        List<String> keys = cache.asMap().keySet().stream()
                .filter(key -> key.startsWith(prefix))
                .toList();
        cache.invalidateAll(keys);
        return keys.size();
    }

    private record Entry(String value, Duration ttl) {
    }
}

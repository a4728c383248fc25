package com.baykanat.insider.warehouse.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;

/** Serileştirilmiş sorgu sonuçlarının tutulduğu key-value store. Hata durumunda CacheStoreUnavailableException. */
public interface ResultCacheStore {

    /** redis veya memory. */
    String backend();

    Optional<String> get(String key);

    void put(String key, String value, Duration ttl);

    /** Prefix ile başlayan tüm key'leri siler; silinen kayıt sayısını döner. */
    long deleteByPrefix(String prefix);
}

package com.baykanat.insider.warehouse.infrastructure.cache;

/** Cache store'a ulaşılamadı (bağlantı hatası veya açık circuit breaker); çağıran miss gibi davranır. */
public class CacheStoreUnavailableException extends RuntimeException {

    public CacheStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

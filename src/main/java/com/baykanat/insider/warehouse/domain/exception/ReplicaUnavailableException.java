package com.baykanat.insider.warehouse.domain.exception;

/** Replica bağlantı hatası; yalnızca içeride kullanılır, primary'ye düşülür ve çağırana hiç ulaşmaz. */
public class ReplicaUnavailableException extends RuntimeException {

    public ReplicaUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

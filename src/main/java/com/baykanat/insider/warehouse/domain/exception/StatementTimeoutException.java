package com.baykanat.insider.warehouse.domain.exception;

import java.time.Duration;

/** Sorgu süre sınırını aştı; DB tarafında statement iptal edilmiştir. Çağırana döner, tekrar denenmez. */
public class StatementTimeoutException extends RuntimeException {

    private final String queryName;
    private final Duration timeout;

    public StatementTimeoutException(String queryName, Duration timeout, Throwable cause) {
        super("Query '" + queryName + "' exceeded " + timeout.toSeconds() + "s statement timeout", cause);
        this.queryName = queryName;
        this.timeout = timeout;
    }

    public String getQueryName() {
        return queryName;
    }

    public Duration getTimeout() {
        return timeout;
    }
}

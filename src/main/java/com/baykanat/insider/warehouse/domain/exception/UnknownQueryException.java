package com.baykanat.insider.warehouse.domain.exception;

/** Katalogda olmayan sorgu adı. */
public class UnknownQueryException extends QueryValidationException {

    public UnknownQueryException(String queryName) {
        super("Unknown query: " + queryName);
    }
}

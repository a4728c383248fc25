package com.baykanat.insider.warehouse.domain.exception;

/** Kayıtlı olmayan aggregate view adı. */
public class UnknownViewException extends RuntimeException {

    public UnknownViewException(String viewName) {
        super("Unknown aggregate view: " + viewName);
    }
}

package com.baykanat.insider.warehouse.domain.exception;

/** Tanımlı olmayan job adı. */
public class UnknownJobException extends RuntimeException {

    public UnknownJobException(String jobName) {
        super("Unknown job: " + jobName);
    }
}

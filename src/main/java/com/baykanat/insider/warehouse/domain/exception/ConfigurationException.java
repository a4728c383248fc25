package com.baykanat.insider.warehouse.domain.exception;

/** Tekrarlanan veya hatalı view/sorgu tanımı; açılışta fırlar ve context'in ayağa kalkmasını engeller. */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}

package com.baykanat.insider.warehouse.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Sonucun üretildiği bağlantı. */
public enum QuerySource {
    REPLICA,
    PRIMARY;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}

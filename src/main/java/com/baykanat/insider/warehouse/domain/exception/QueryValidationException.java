package com.baykanat.insider.warehouse.domain.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Çağıranın parametreleri şemaya uymuyor; 400 olarak döner, otomatik tekrar denenmez. */
public class QueryValidationException extends RuntimeException {

    private final transient Map<String, String> violations;

    public QueryValidationException(String message) {
        this(message, Map.of());
    }

    public QueryValidationException(String message, Map<String, String> violations) {
        super(message);
        this.violations = Collections.unmodifiableMap(new LinkedHashMap<>(violations));
    }

    /** Alan adı → hata mesajı. */
    public Map<String, String> getViolations() {
        return violations;
    }
}

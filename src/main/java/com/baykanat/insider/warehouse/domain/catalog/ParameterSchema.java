package com.baykanat.insider.warehouse.domain.catalog;

import com.baykanat.insider.warehouse.domain.exception.QueryValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/** Sorgunun tipli parametre şeması; doğrulama sonucu isme göre sıralı (kanonik) parametre map'idir. */
public final class ParameterSchema {

    private final List<ParameterSpec> specs;

    private ParameterSchema(List<ParameterSpec> specs) {
        this.specs = List.copyOf(specs);
    }

    public static ParameterSchema of(ParameterSpec... specs) {
        return new ParameterSchema(List.of(specs));
    }

    public static ParameterSchema empty() {
        return new ParameterSchema(List.of());
    }

    public List<ParameterSpec> getSpecs() {
        return specs;
    }

    /**
     * Ham parametreleri doğrular; varsayılanları uygular, opsiyonel ve gelmeyen parametreleri null olarak koyar.
     * Bilinmeyen parametre, eksik zorunlu parametre veya tip uyumsuzluğu → QueryValidationException.
     */
    public SortedMap<String, Object> validate(Map<String, ?> raw) {
        Map<String, ?> input = raw != null ? raw : Collections.emptyMap();
        Map<String, String> violations = new LinkedHashMap<>();
        SortedMap<String, Object> canonical = new TreeMap<>();

        for (String name : input.keySet()) {
            if (specs.stream().noneMatch(spec -> spec.getName().equals(name))) {
                violations.put(name, "unknown parameter");
            }
        }

        for (ParameterSpec spec : specs) {
            Object value = input.get(spec.getName());
            if (value == null || (value instanceof String s && s.isBlank())) {
                if (spec.isRequired()) {
                    violations.put(spec.getName(), "is required");
                } else {
                    canonical.put(spec.getName(), spec.getDefaultValue());
                }
                continue;
            }
            try {
                canonical.put(spec.getName(), spec.validate(value));
            } catch (IllegalArgumentException e) {
                violations.put(spec.getName(), e.getMessage());
            }
        }

        if (!violations.isEmpty()) {
            throw new QueryValidationException("Invalid query parameters", violations);
        }
        return canonical;
    }
}

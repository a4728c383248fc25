package com.baykanat.insider.warehouse.domain.catalog;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Set;

/** Tek bir sorgu parametresinin tanımı: tip, zorunluluk, varsayılan, izinli değerler ve sayısal aralık. */
@Value
@Builder
public class ParameterSpec {

    String name;
    ParameterType type;
    boolean required;
    /** Parametre gelmezse kullanılır; tipine coerce edilmiş olmalı. */
    Object defaultValue;
    @Singular
    Set<String> allowedValues;
    Long min;
    Long max;

    public static ParameterSpec required(String name, ParameterType type) {
        return ParameterSpec.builder().name(name).type(type).required(true).build();
    }

    public static ParameterSpec optional(String name, ParameterType type) {
        return ParameterSpec.builder().name(name).type(type).build();
    }

    /** Değeri coerce eder, izinli değer ve aralık kontrollerini uygular. */
    public Object validate(Object raw) {
        Object value = type.coerce(raw);
        if (!allowedValues.isEmpty() && !allowedValues.contains(String.valueOf(value))) {
            throw new IllegalArgumentException("must be one of " + allowedValues.stream().sorted().toList());
        }
        if (value instanceof Number number) {
            BigDecimal numeric = new BigDecimal(number.toString());
            if (min != null && numeric.compareTo(BigDecimal.valueOf(min)) < 0) {
                throw new IllegalArgumentException("must be >= " + min);
            }
            if (max != null && numeric.compareTo(BigDecimal.valueOf(max)) > 0) {
                throw new IllegalArgumentException("must be <= " + max);
            }
        }
        return value;
    }
}

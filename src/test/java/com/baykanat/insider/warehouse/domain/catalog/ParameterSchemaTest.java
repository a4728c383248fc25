package com.baykanat.insider.warehouse.domain.catalog;

import com.baykanat.insider.warehouse.domain.exception.QueryValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ParameterSchema validation and canonicalization.
 */
class ParameterSchemaTest {

    private final ParameterSchema schema = ParameterSchema.of(
            ParameterSpec.required("student_id", ParameterType.LONG),
            ParameterSpec.builder().name("granularity").type(ParameterType.STRING).defaultValue("week")
                    .allowedValue("day").allowedValue("week").allowedValue("month").build(),
            ParameterSpec.builder().name("days_back").type(ParameterType.INTEGER).defaultValue(30)
                    .min(1L).max(365L).build(),
            ParameterSpec.optional("since", ParameterType.DATE));

    @Test
    @DisplayName("Defaults are applied and optional parameters are present as null")
    void appliesDefaults() {
        SortedMap<String, Object> canonical = schema.validate(Map.of("student_id", 42));

        assertThat(canonical).containsEntry("student_id", 42L)
                .containsEntry("granularity", "week")
                .containsEntry("days_back", 30)
                .containsEntry("since", null);
        assertThat(canonical.keySet()).containsExactly("days_back", "granularity", "since", "student_id");
    }

    @Test
    @DisplayName("String values coming from HTTP are parsed into their declared types")
    void parsesStrings() {
        SortedMap<String, Object> canonical = schema.validate(Map.of(
                "student_id", "7", "days_back", "14", "since", "2024-09-01"));

        assertThat(canonical.get("student_id")).isEqualTo(7L);
        assertThat(canonical.get("days_back")).isEqualTo(14);
        assertThat(canonical.get("since")).isEqualTo(LocalDate.of(2024, 9, 1));
    }

    @Test
    @DisplayName("Insertion order of the raw parameters does not change the canonical map")
    void canonicalOrderIsIndependentOfInput() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("student_id", 1L);
        first.put("granularity", "day");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("granularity", "day");
        second.put("student_id", 1L);

        assertThat(schema.validate(first)).isEqualTo(schema.validate(second));
    }

    @Test
    @DisplayName("Missing, unknown, mistyped and out-of-range parameters are reported together")
    void reportsAllViolations() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("granularity", "year");
        raw.put("days_back", 1000);
        raw.put("teacher_id", 5);
        raw.put("since", 12);

        assertThatThrownBy(() -> schema.validate(raw))
                .isInstanceOf(QueryValidationException.class)
                .satisfies(ex -> assertThat(((QueryValidationException) ex).getViolations())
                        .containsKeys("student_id", "granularity", "days_back", "teacher_id", "since"));
    }

    @Test
    @DisplayName("A number that does not parse is a violation, not a server error")
    void rejectsUnparsableNumber() {
        assertThatThrownBy(() -> schema.validate(Map.of("student_id", "forty-two")))
                .isInstanceOf(QueryValidationException.class)
                .satisfies(ex -> assertThat(((QueryValidationException) ex).getViolations().get("student_id"))
                        .contains("expected long"));
    }

    @Test
    @DisplayName("Null parameter map is treated as empty")
    void nullParameters() {
        assertThat(ParameterSchema.empty().validate(null)).isEmpty();
    }
}

package com.deepansh.gateway.tool;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaValidatorTest {

    private static final Map<String, Object> SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "city", Map.of("type", "string"),
                    "days", Map.of("type", "integer"),
                    "unit", Map.of("type", "string", "enum", List.of("metric", "imperial")),
                    "tags", Map.of("type", "array", "items", Map.of("type", "string"))),
            "required", List.of("city"));

    @Test
    void validate_conformingArguments_noViolations() {
        assertThat(SchemaValidator.validate(
                Map.of("city", "Paris", "days", 3, "unit", "metric", "tags", List.of("a")), SCHEMA)).isEmpty();
    }

    @Test
    void validate_missingRequired_reported() {
        assertThat(SchemaValidator.validate(Map.of("days", 3), SCHEMA)).containsExactly("$.city: is required");
    }

    @Test
    void validate_wrongTypesAndEnum_allReportedWithPaths() {
        List<String> errors = SchemaValidator.validate(
                Map.of("city", "Paris", "days", "three", "unit", "kelvin", "tags", List.of("ok", 5)), SCHEMA);

        assertThat(errors).hasSize(3)
                .anyMatch(e -> e.startsWith("$.days:"))
                .anyMatch(e -> e.startsWith("$.unit:"))
                .anyMatch(e -> e.startsWith("$.tags[1]:"));
    }

    @Test
    void validate_wholeNumberDouble_acceptedAsInteger() {
        assertThat(SchemaValidator.validate(Map.of("city", "x", "days", 2.0), SCHEMA)).isEmpty();
        assertThat(SchemaValidator.validate(Map.of("city", "x", "days", 2.5), SCHEMA)).hasSize(1);
    }

    @Test
    void validate_numericEnum_comparesByValue() {
        Map<String, Object> schema = Map.of("type", "object",
                "properties", Map.of("level", Map.of("enum", List.of(1, 2, 3))));

        assertThat(SchemaValidator.validate(Map.of("level", 2L), schema)).isEmpty();
    }

    @Test
    void describeProblem_wellFormedAndEmptySchemas_null() {
        assertThat(SchemaValidator.describeProblem(SCHEMA)).isNull();
        assertThat(SchemaValidator.describeProblem(Map.of())).isNull();
    }

    @Test
    void describeProblem_badRequired_reported() {
        assertThat(SchemaValidator.describeProblem(Map.of("type", "object", "required", "city")))
                .contains("'required'");
    }
}

package com.deepansh.gateway.provider;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deep-copies a JSON schema while removing keywords a provider rejects.
 * Keys inside {@code properties} are parameter names, not keywords, and are kept.
 */
public final class SchemaSanitizer {

    public static final Set<String> GEMINI_UNSUPPORTED = Set.of(
            "title", "format", "exclusiveMinimum", "exclusiveMaximum",
            "minLength", "maxLength", "$schema", "additionalProperties");

    public static final Set<String> VLLM_UNSUPPORTED = Set.of(
            "title", "format", "exclusiveMinimum", "exclusiveMaximum");

    private SchemaSanitizer() {
    }

    public static Map<String, Object> sanitize(Map<String, Object> schema, Set<String> unsupported) {
        if (schema == null || schema.isEmpty()) {
            Map<String, Object> empty = new LinkedHashMap<>();
            empty.put("type", "object");
            empty.put("properties", new LinkedHashMap<>());
            return empty;
        }
        return cleanSchema(schema, unsupported);
    }

    /** A deep, mutable copy with nothing removed. */
    public static Map<String, Object> copy(Map<String, Object> schema) {
        return sanitize(schema, Set.of());
    }

    /** A deep copy in which every object schema has {@code additionalProperties: false}. */
    public static Map<String, Object> closed(Map<String, Object> schema) {
        Map<String, Object> out = copy(schema);
        closeObjects(out);
        return out;
    }

    @SuppressWarnings("unchecked")
    private static void closeObjects(Object node) {
        if (node instanceof List<?> list) {
            list.forEach(SchemaSanitizer::closeObjects);
            return;
        }
        if (!(node instanceof Map<?, ?>)) {
            return;
        }
        Map<String, Object> schema = (Map<String, Object>) node;
        if ("object".equals(schema.get("type"))) {
            schema.put("additionalProperties", false);
        }
        if (schema.get("properties") instanceof Map<?, ?> properties) {
            properties.values().forEach(SchemaSanitizer::closeObjects);
        }
        closeObjects(schema.get("items"));
    }

    private static Map<String, Object> cleanSchema(Map<?, ?> schema, Set<String> unsupported) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : schema.entrySet()) {
            String key = String.valueOf(e.getKey());
            if (unsupported.contains(key)) {
                continue;
            }
            if (("properties".equals(key) || "$defs".equals(key) || "definitions".equals(key))
                    && e.getValue() instanceof Map<?, ?> named) {
                Map<String, Object> cleaned = new LinkedHashMap<>();
                named.forEach((name, child) -> cleaned.put(String.valueOf(name), cleanValue(child, unsupported)));
                out.put(key, cleaned);
            } else {
                out.put(key, cleanValue(e.getValue(), unsupported));
            }
        }
        return out;
    }

    private static Object cleanValue(Object value, Set<String> unsupported) {
        if (value instanceof Map<?, ?> map) {
            return cleanSchema(map, unsupported);
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            list.forEach(item -> out.add(cleanValue(item, unsupported)));
            return out;
        }
        return value;
    }
}

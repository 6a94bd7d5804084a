package com.deepansh.gateway.tool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Minimal JSON Schema checks for tool arguments: object properties, required
 * fields, primitive types, enums and array items. Unknown keywords are ignored.
 */
public final class SchemaValidator {

    private static final Set<String> TYPES =
            Set.of("object", "string", "integer", "number", "boolean", "array", "null");

    private SchemaValidator() {
    }

    /** Returns human-readable violations; empty when the arguments conform. */
    public static List<String> validate(Map<String, Object> arguments, Map<String, Object> schema) {
        List<String> errors = new ArrayList<>();
        if (schema == null || schema.isEmpty()) {
            return errors;
        }
        check("$", arguments == null ? Map.of() : arguments, schema, errors);
        return errors;
    }

    /**
     * Structural sanity of a declared schema. Returns a description of the first
     * problem, or {@code null} when the schema is usable.
     */
    public static String describeProblem(Map<String, Object> schema) {
        if (schema == null) {
            return "schema is missing";
        }
        if (schema.isEmpty()) {
            return null;
        }
        return describeProblem("$", schema);
    }

    @SuppressWarnings("unchecked")
    private static String describeProblem(String path, Map<String, Object> schema) {
        Object type = schema.get("type");
        if (type != null) {
            if (type instanceof String t) {
                if (!TYPES.contains(t)) {
                    return path + ": unknown type '" + t + "'";
                }
            } else if (type instanceof Collection<?> types) {
                for (Object t : types) {
                    if (!(t instanceof String s) || !TYPES.contains(s)) {
                        return path + ": unknown type '" + t + "'";
                    }
                }
            } else {
                return path + ": 'type' must be a string or an array";
            }
        }

        Object properties = schema.get("properties");
        if (properties != null) {
            if (!(properties instanceof Map<?, ?> props)) {
                return path + ": 'properties' must be an object";
            }
            for (Map.Entry<?, ?> e : props.entrySet()) {
                if (!(e.getValue() instanceof Map<?, ?> child)) {
                    return path + "." + e.getKey() + ": property schema must be an object";
                }
                String problem = describeProblem(path + "." + e.getKey(), (Map<String, Object>) child);
                if (problem != null) {
                    return problem;
                }
            }
        }

        Object required = schema.get("required");
        if (required != null) {
            if (!(required instanceof Collection<?> names) || !names.stream().allMatch(String.class::isInstance)) {
                return path + ": 'required' must be an array of strings";
            }
        }

        Object items = schema.get("items");
        if (items != null) {
            if (!(items instanceof Map<?, ?> itemSchema)) {
                return path + ": 'items' must be an object";
            }
            return describeProblem(path + "[]", (Map<String, Object>) itemSchema);
        }

        Object enumValues = schema.get("enum");
        if (enumValues != null && !(enumValues instanceof Collection<?>)) {
            return path + ": 'enum' must be an array";
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static void check(String path, Object value, Map<String, Object> schema, List<String> errors) {
        Object type = schema.get("type");
        if (type != null && !matchesType(value, type)) {
            errors.add(path + ": expected " + type + " but got " + describe(value));
            return;
        }

        Object enumValues = schema.get("enum");
        if (enumValues instanceof Collection<?> allowed && !containsValue(allowed, value)) {
            errors.add(path + ": " + value + " is not one of " + allowed);
        }

        if (value instanceof Map<?, ?> object) {
            Object required = schema.get("required");
            if (required instanceof Collection<?> names) {
                for (Object name : names) {
                    if (!object.containsKey(name) || object.get(name) == null) {
                        errors.add(path + "." + name + ": is required");
                    }
                }
            }
            Object properties = schema.get("properties");
            if (properties instanceof Map<?, ?> props) {
                for (Map.Entry<?, ?> e : props.entrySet()) {
                    Object child = object.get(e.getKey());
                    if (child != null && e.getValue() instanceof Map<?, ?> childSchema) {
                        check(path + "." + e.getKey(), child, (Map<String, Object>) childSchema, errors);
                    }
                }
            }
        }

        if (value instanceof List<?> list && schema.get("items") instanceof Map<?, ?> itemSchema) {
            for (int i = 0; i < list.size(); i++) {
                check(path + "[" + i + "]", list.get(i), (Map<String, Object>) itemSchema, errors);
            }
        }
    }

    private static boolean matchesType(Object value, Object type) {
        if (type instanceof Collection<?> types) {
            return types.stream().anyMatch(t -> matchesType(value, t));
        }
        return switch (String.valueOf(type)) {
            case "object" -> value instanceof Map<?, ?>;
            case "array" -> value instanceof List<?>;
            case "string" -> value instanceof String;
            case "boolean" -> value instanceof Boolean;
            case "integer" -> isInteger(value);
            case "number" -> value instanceof Number;
            case "null" -> value == null;
            default -> true;
        };
    }

    private static boolean isInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof java.math.BigInteger) {
            return true;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        return false;
    }

    private static boolean containsValue(Collection<?> allowed, Object value) {
        for (Object candidate : allowed) {
            if (candidate == null ? value == null : candidate.equals(value)) {
                return true;
            }
            if (candidate instanceof Number a && value instanceof Number b
                    && Double.compare(a.doubleValue(), b.doubleValue()) == 0) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Object value) {
        if (value == null) return "null";
        if (value instanceof Map<?, ?>) return "object";
        if (value instanceof List<?>) return "array";
        if (value instanceof String) return "string";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof Number) return "number";
        return value.getClass().getSimpleName();
    }
}

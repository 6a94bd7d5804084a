package com.deepansh.gateway.streaming;

import java.util.List;
import java.util.Map;

/** Null-tolerant accessors over the Map/List trees Jackson produces. */
public final class JsonMaps {

    private JsonMaps() {
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> map(Object value) {
        return value instanceof Map<?, ?> m ? (Map<String, Object>) m : null;
    }

    public static Map<String, Object> map(Map<String, Object> parent, String key) {
        return parent == null ? null : map(parent.get(key));
    }

    @SuppressWarnings("unchecked")
    public static List<Object> list(Object value) {
        return value instanceof List<?> l ? (List<Object>) l : List.of();
    }

    public static List<Object> list(Map<String, Object> parent, String key) {
        return parent == null ? List.of() : list(parent.get(key));
    }

    public static String string(Map<String, Object> parent, String key) {
        if (parent == null) {
            return null;
        }
        Object value = parent.get(key);
        return value == null ? null : value.toString();
    }

    public static Integer integer(Map<String, Object> parent, String key) {
        if (parent == null) {
            return null;
        }
        return parent.get(key) instanceof Number n ? n.intValue() : null;
    }

    public static int intOrZero(Map<String, Object> parent, String key) {
        Integer value = integer(parent, key);
        return value == null ? 0 : value;
    }

    /** First element of an array field, as an object. */
    public static Map<String, Object> first(Map<String, Object> parent, String key) {
        List<Object> items = list(parent, key);
        return items.isEmpty() ? null : map(items.get(0));
    }
}

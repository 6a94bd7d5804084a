package com.deepansh.gateway.model;

import java.util.Map;

/**
 * Incremental tool-call fragment. The first fragment for an index usually
 * carries id and name, later ones only a slice of the JSON arguments text.
 * {@code providerMetadata} is merged into the finished call's metadata.
 */
public record ToolCallDelta(
        int index,
        String id,
        String name,
        String argumentsFragment,
        Map<String, Object> providerMetadata
) {

    public ToolCallDelta {
        providerMetadata = providerMetadata == null ? Map.of() : Map.copyOf(providerMetadata);
    }

    public ToolCallDelta(int index, String id, String name, String argumentsFragment) {
        this(index, id, name, argumentsFragment, Map.of());
    }

    public static ToolCallDelta start(int index, String id, String name) {
        return new ToolCallDelta(index, id, name, null);
    }

    public static ToolCallDelta arguments(int index, String fragment) {
        return new ToolCallDelta(index, null, null, fragment);
    }
}

package com.deepansh.gateway.model;

import java.util.Locale;

/** Canonical terminal classification of a model turn. */
public enum FinishReason {

    STOP("stop"),
    LENGTH("length"),
    TOOL_CALLS("tool_calls"),
    CONTENT_FILTER("content_filter"),
    ERROR("error");

    private final String wireValue;

    FinishReason(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Maps any provider's finish/stop reason onto the canonical set.
     * Returns null for null input so "still streaming" stays distinguishable.
     * Unknown non-null values count as a natural stop.
     */
    public static FinishReason normalize(String providerReason) {
        if (providerReason == null || providerReason.isBlank()) {
            return null;
        }
        return switch (providerReason.toLowerCase(Locale.ROOT)) {
            case "stop", "end_turn", "stop_sequence", "finish_reason_unspecified", "complete", "done" -> STOP;
            case "length", "max_tokens", "model_length" -> LENGTH;
            case "tool_calls", "tool_use", "function_call" -> TOOL_CALLS;
            case "content_filter", "safety", "recitation", "blocklist", "prohibited_content", "spii",
                 "refusal" -> CONTENT_FILTER;
            case "error", "malformed_function_call" -> ERROR;
            default -> STOP;
        };
    }
}

package com.deepansh.gateway.provider;

import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-provider configuration, bound from {@code gateway.providers.<id>}.
 * API keys are expected to come from environment variables.
 */
@Data
public class ProviderSettings {

    /** Adapter family: openai, anthropic, gemini, mistral, compatible, iassistant. Defaults to the provider id. */
    private String type;

    private String apiKey = "";
    private String baseUrl;

    /** Hard upper bound for max tokens; requests above it are clamped. */
    private Integer maxTokensCeiling;

    /** Used when a request does not set max tokens. */
    private Integer defaultMaxTokens;

    /** Keep provider extras (telemetry, related questions, grounding) on chunks. */
    private boolean preserveMetadata;

    /** Provider-specific extras, e.g. iAssistant profile id and search mode. */
    private Map<String, String> options = new HashMap<>();

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String option(String key, String defaultValue) {
        String value = options == null ? null : options.get(key);
        return value == null || value.isBlank() ? defaultValue : value;
    }
}

package com.deepansh.gateway.provider;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Self-hosted OpenAI-compatible servers (vLLM and similar). The base URL must be
 * configured, the API key is optional, and tool schemas are stripped of keywords
 * these servers reject.
 */
public class CompatibleAdapter extends OpenAiAdapter {

    public CompatibleAdapter(String providerId, ProviderSettings settings, ObjectMapper objectMapper) {
        super(providerId, settings, objectMapper);
    }

    @Override
    protected String defaultBaseUrl() {
        return null;
    }

    @Override
    protected Map<String, Object> sanitizeSchema(Map<String, Object> schema) {
        return SchemaSanitizer.sanitize(schema, SchemaSanitizer.VLLM_UNSUPPORTED);
    }

    @Override
    protected void addAuthHeaders(ProviderRequest.ProviderRequestBuilder request) {
        if (settings.hasApiKey()) {
            request.header("Authorization", "Bearer " + settings.getApiKey());
        }
    }
}

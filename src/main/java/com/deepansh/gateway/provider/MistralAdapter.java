package com.deepansh.gateway.provider;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Mistral chat completions: the OpenAI shape with a narrower temperature range,
 * no {@code stream_options}, and content that may arrive as typed parts.
 */
public class MistralAdapter extends OpenAiAdapter {

    public MistralAdapter(String providerId, ProviderSettings settings, ObjectMapper objectMapper) {
        super(providerId, settings, objectMapper);
    }

    @Override
    protected double maxTemperature() {
        return 1.5;
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://api.mistral.ai/v1";
    }

    @Override
    protected boolean requestsStreamUsage() {
        return false;
    }
}

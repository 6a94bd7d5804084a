package com.deepansh.gateway.provider;

import com.deepansh.gateway.exception.ConfigurationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/** Configured adapters by provider id, e.g. {@code openai}, {@code anthropic}, {@code vllm}. */
@Slf4j
public class ProviderAdapterRegistry {

    private final Map<String, ProviderAdapter> adapters = new LinkedHashMap<>();

    public ProviderAdapterRegistry(Map<String, ProviderAdapter> adapters) {
        this.adapters.putAll(adapters);
    }

    /** Builds one adapter per configured provider, picking the family from {@code type} (or the id). */
    public static ProviderAdapterRegistry fromSettings(Map<String, ProviderSettings> providers, ObjectMapper objectMapper) {
        Map<String, ProviderAdapter> adapters = new LinkedHashMap<>();
        providers.forEach((id, settings) -> {
            adapters.put(id, create(id, settings, objectMapper));
            log.info("Configured provider [{}] type={} baseUrl={}", id, typeOf(id, settings),
                    settings.getBaseUrl() != null ? settings.getBaseUrl() : "(default)");
        });
        return new ProviderAdapterRegistry(adapters);
    }

    public static ProviderAdapter create(String id, ProviderSettings settings, ObjectMapper objectMapper) {
        return switch (typeOf(id, settings)) {
            case "openai" -> new OpenAiAdapter(id, settings, objectMapper);
            case "openai-responses", "responses" -> new OpenAiResponsesAdapter(id, settings, objectMapper);
            case "anthropic" -> new AnthropicAdapter(id, settings, objectMapper);
            case "gemini", "google" -> new GeminiAdapter(id, settings, objectMapper);
            case "mistral" -> new MistralAdapter(id, settings, objectMapper);
            case "compatible", "vllm", "local" -> new CompatibleAdapter(id, settings, objectMapper);
            case "iassistant" -> new IAssistantAdapter(id, settings, objectMapper);
            default -> throw new ConfigurationException(
                    "Unknown provider type '" + typeOf(id, settings) + "' for provider '" + id + "'");
        };
    }

    private static String typeOf(String id, ProviderSettings settings) {
        String type = settings.getType() != null && !settings.getType().isBlank() ? settings.getType() : id;
        return type.toLowerCase();
    }

    public ProviderAdapter get(String providerId) {
        ProviderAdapter adapter = adapters.get(providerId);
        if (adapter == null) {
            throw new ConfigurationException("Unknown provider '" + providerId
                    + "'. Configured providers: " + adapters.keySet());
        }
        return adapter;
    }

    public Set<String> providerIds() {
        return adapters.keySet();
    }
}

package com.deepansh.gateway.provider;

import com.deepansh.gateway.exception.ConfigurationException;
import com.deepansh.gateway.model.GenerationOptions;
import com.deepansh.gateway.model.ToolCall;
import com.deepansh.gateway.model.ToolResult;
import com.deepansh.gateway.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Configuration-driven pieces every adapter shares: option validation,
 * max-token clamping, provider-handled tool filtering, and tool-result text.
 */
@Slf4j
public abstract class AbstractProviderAdapter implements ProviderAdapter {

    protected final String providerId;
    protected final ProviderSettings settings;
    protected final ObjectMapper objectMapper;
    protected final ToolResultContent resultContent;

    protected AbstractProviderAdapter(String providerId, ProviderSettings settings, ObjectMapper objectMapper) {
        this.providerId = providerId;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.resultContent = new ToolResultContent(objectMapper);
    }

    @Override
    public String getProviderId() {
        return providerId;
    }

    /** Inclusive upper bound this provider accepts for temperature. */
    protected abstract double maxTemperature();

    protected abstract String defaultBaseUrl();

    protected String baseUrl() {
        String url = settings.getBaseUrl() != null && !settings.getBaseUrl().isBlank()
                ? settings.getBaseUrl() : defaultBaseUrl();
        if (url == null) {
            throw new ConfigurationException("No base-url configured for provider '" + providerId + "'");
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    protected String requireApiKey() {
        if (!settings.hasApiKey()) {
            throw new ConfigurationException("No api-key configured for provider '" + providerId
                    + "'. Set gateway.providers." + providerId + ".api-key");
        }
        return settings.getApiKey();
    }

    protected void validateOptions(GenerationOptions options) {
        Double temperature = options.getTemperature();
        if (temperature != null && (temperature < 0 || temperature > maxTemperature())) {
            throw new ConfigurationException(String.format(
                    "temperature %s is outside %s's range [0, %s]", temperature, providerId, maxTemperature()));
        }
        Double topP = options.getTopP();
        if (topP != null && (topP < 0 || topP > 1)) {
            throw new ConfigurationException("topP " + topP + " is outside the range [0, 1]");
        }
    }

    /**
     * Requested (or configured default) max tokens, clamped to the ceiling.
     * Null when neither the request nor the configuration sets one.
     */
    protected Integer resolveMaxTokens(GenerationOptions options) {
        Integer requested = options.getMaxTokens() != null ? options.getMaxTokens() : settings.getDefaultMaxTokens();
        if (requested == null) {
            return null;
        }
        if (requested <= 0) {
            throw new ConfigurationException("maxTokens must be positive but was " + requested);
        }
        Integer ceiling = settings.getMaxTokensCeiling();
        if (ceiling != null && ceiling > 0 && requested > ceiling) {
            log.debug("Clamping maxTokens {} to {}'s ceiling {}", requested, providerId, ceiling);
            return ceiling;
        }
        return requested;
    }

    /** Function tools only; provider-handled declarations are dropped with a warning. */
    protected List<ToolDefinition> functionTools(List<ToolDefinition> tools) {
        if (tools == null) {
            return List.of();
        }
        return tools.stream()
                .filter(tool -> {
                    if (tool.isProviderHandled()) {
                        log.warn("Provider {} has no native '{}' capability; dropping it", providerId, tool.getName());
                        return false;
                    }
                    return true;
                })
                .toList();
    }

    protected String argumentsJson(ToolCall call) {
        if (call.getArguments() == null && call.getRawArguments() != null) {
            return call.getRawArguments();
        }
        try {
            return objectMapper.writeValueAsString(call.getArguments() == null ? Map.of() : call.getArguments());
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Tool call arguments are not serializable", e);
        }
    }

    protected static String echoNameOf(ToolResult result) {
        return result.getEchoName() != null ? result.getEchoName() : result.getName();
    }
}

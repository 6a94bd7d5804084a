package com.deepansh.gateway.provider;

import com.deepansh.gateway.exception.ConfigurationException;
import com.deepansh.gateway.model.GenerationOptions;
import com.deepansh.gateway.model.Message;
import com.deepansh.gateway.model.ToolResult;
import com.deepansh.gateway.streaming.BufferedSseParser;
import com.deepansh.gateway.streaming.IAssistantStreamingParser;
import com.deepansh.gateway.streaming.NonStreamingParser;
import com.deepansh.gateway.streaming.StreamingParser;
import com.deepansh.gateway.tool.ToolDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * iAssistant retrieval-augmented answering. One-shot: only the last user
 * message is sent as the question, there is no tool calling, and the
 * response is always an SSE stream.
 */
@Slf4j
public class IAssistantAdapter extends AbstractProviderAdapter {

    public IAssistantAdapter(String providerId, ProviderSettings settings, ObjectMapper objectMapper) {
        super(providerId, settings, objectMapper);
    }

    @Override
    protected double maxTemperature() {
        return 2.0;
    }

    @Override
    protected String defaultBaseUrl() {
        return null;
    }

    @Override
    public Map<String, Object> formatMessages(List<Message> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message msg = messages.get(i);
            if (msg.getRole() == Message.Role.user) {
                Map<String, Object> fields = new LinkedHashMap<>();
                fields.put("question", msg.getTextContent() == null ? "" : msg.getTextContent());
                return fields;
            }
        }
        throw new ConfigurationException("No user message found for " + providerId + " query");
    }

    @Override
    public List<Map<String, Object>> formatTools(List<ToolDefinition> tools) {
        if (tools != null && !tools.isEmpty()) {
            log.warn("Provider {} does not support tool calling; dropping {} tool(s)", providerId, tools.size());
        }
        return List.of();
    }

    @Override
    public List<ToolDefinition> parseTools(List<Map<String, Object>> formatted) {
        return List.of();
    }

    @Override
    public ProviderRequest buildRequest(String model, List<Message> messages,
                                        List<ToolDefinition> tools, GenerationOptions options) {
        validateOptions(options);
        formatTools(tools);

        Map<String, Object> body = new LinkedHashMap<>(formatMessages(messages));
        body.put("filter", List.of());
        body.put("profileId", settings.option("profile-id", model));
        body.put("metaData", true);
        body.put("telemetry", true);

        String url = UriComponentsBuilder.fromHttpUrl(baseUrl() + "/internal-api/v2/rag/ask")
                .queryParam("uuid", "llm-gateway-request-" + System.currentTimeMillis())
                .queryParam("searchFields", settings.option("search-fields", "{}"))
                .queryParam("sSearchMode", settings.option("search-mode", "multiword"))
                .queryParam("sSearchDistance", settings.option("search-distance", ""))
                .build()
                .encode()
                .toUriString();

        return ProviderRequest.builder()
                .provider(providerId)
                .model(model)
                .url(url)
                .header("Authorization", "Bearer " + requireApiKey())
                .header("Content-Type", "application/json")
                .header("Accept", "text/event-stream")
                .header("Cache-Control", "no-cache")
                .body(body)
                .stream(options.isStream())
                .build();
    }

    @Override
    public StreamingParser createStreamingParser() {
        return new IAssistantStreamingParser(providerId, objectMapper, settings.isPreserveMetadata());
    }

    /** The server always answers with SSE, buffered or not. */
    @Override
    public NonStreamingParser createNonStreamingParser() {
        return new BufferedSseParser(this::createStreamingParser);
    }

    @Override
    public Map<String, Object> formatToolResult(ToolResult result) {
        throw new ConfigurationException("Provider " + providerId + " does not support tool calling");
    }

    @Override
    public Message parseToolResult(Map<String, Object> formatted) {
        throw new ConfigurationException("Provider " + providerId + " does not support tool calling");
    }
}

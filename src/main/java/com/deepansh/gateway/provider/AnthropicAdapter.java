package com.deepansh.gateway.provider;

import com.deepansh.gateway.model.ContentPart;
import com.deepansh.gateway.model.GenerationOptions;
import com.deepansh.gateway.model.Message;
import com.deepansh.gateway.model.ToolCall;
import com.deepansh.gateway.model.ToolResult;
import com.deepansh.gateway.streaming.AnthropicResponseParser;
import com.deepansh.gateway.streaming.AnthropicStreamingParser;
import com.deepansh.gateway.streaming.NonStreamingParser;
import com.deepansh.gateway.streaming.StreamingParser;
import com.deepansh.gateway.tool.ToolDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.deepansh.gateway.streaming.JsonMaps.list;
import static com.deepansh.gateway.streaming.JsonMaps.map;
import static com.deepansh.gateway.streaming.JsonMaps.string;

/**
 * Anthropic Messages API.
 *
 * <ul>
 *   <li>System messages are hoisted into the top-level {@code system} field.</li>
 *   <li>Tool calls replay as {@code tool_use} blocks on the assistant turn.</li>
 *   <li>Consecutive tool results are merged into one user turn of {@code tool_result} blocks.</li>
 *   <li>{@code max_tokens} is mandatory, so a default is always sent.</li>
 * </ul>
 * Structured output is requested through a forced {@code json_response} tool.
 */
@Slf4j
public class AnthropicAdapter extends AbstractProviderAdapter {

    static final String API_VERSION = "2023-06-01";
    static final int FALLBACK_MAX_TOKENS = 4096;

    public AnthropicAdapter(String providerId, ProviderSettings settings, ObjectMapper objectMapper) {
        super(providerId, settings, objectMapper);
    }

    @Override
    protected double maxTemperature() {
        return 1.0;
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://api.anthropic.com/v1";
    }

    @Override
    public Map<String, Object> formatMessages(List<Message> messages) {
        List<String> system = new ArrayList<>();
        List<Map<String, Object>> formatted = new ArrayList<>();
        List<Map<String, Object>> pendingResults = new ArrayList<>();

        for (Message msg : messages) {
            if (msg.getRole() == Message.Role.tool) {
                pendingResults.add(formatToolMessage(msg));
                continue;
            }
            flushResults(pendingResults, formatted);
            switch (msg.getRole()) {
                case system -> system.add(msg.getTextContent());
                case assistant -> formatted.add(formatAssistant(msg));
                default -> formatted.add(Map.of("role", "user",
                        "content", msg.hasParts() ? formatParts(msg.getParts()) : nullToEmpty(msg.getContent())));
            }
        }
        flushResults(pendingResults, formatted);

        Map<String, Object> fields = new LinkedHashMap<>();
        if (!system.isEmpty()) {
            fields.put("system", String.join("\n\n", system));
        }
        fields.put("messages", formatted);
        return fields;
    }

    private static void flushResults(List<Map<String, Object>> pending, List<Map<String, Object>> formatted) {
        if (pending.isEmpty()) {
            return;
        }
        formatted.add(Map.of("role", "user", "content", List.copyOf(pending)));
        pending.clear();
    }

    private Map<String, Object> formatAssistant(Message msg) {
        if (!msg.hasToolCalls()) {
            return Map.of("role", "assistant", "content", nullToEmpty(msg.getTextContent()));
        }
        List<Map<String, Object>> blocks = new ArrayList<>();
        String text = msg.getTextContent();
        if (text != null && !text.isEmpty()) {
            blocks.add(Map.of("type", "text", "text", text));
        }
        for (ToolCall call : msg.getToolCalls()) {
            Map<String, Object> block = new LinkedHashMap<>();
            block.put("type", "tool_use");
            block.put("id", call.getId());
            block.put("name", call.getEchoName());
            block.put("input", call.getArguments() != null ? call.getArguments() : Map.of());
            blocks.add(block);
        }
        return Map.of("role", "assistant", "content", blocks);
    }

    private Map<String, Object> formatToolMessage(Message msg) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("type", "tool_result");
        block.put("tool_use_id", msg.getToolCallId());
        String content = nullToEmpty(msg.getTextContent());
        block.put("content", content);
        if (msg.isToolError()) {
            block.put("is_error", true);
        }
        return block;
    }

    private List<Map<String, Object>> formatParts(List<ContentPart> parts) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (ContentPart part : parts) {
            switch (part.getType()) {
                case TEXT -> out.add(Map.of("type", "text", "text", nullToEmpty(part.getText())));
                case IMAGE -> out.add(Map.of("type", "image", "source", part.getImageUrl() != null
                        ? Map.of("type", "url", "url", part.getImageUrl())
                        : Map.of("type", "base64", "media_type", part.getMimeType(), "data", part.getImageData())));
                default -> log.debug("Skipping {} part in {} message", part.getType(), providerId);
            }
        }
        return out;
    }

    @Override
    public List<Map<String, Object>> formatTools(List<ToolDefinition> tools) {
        return functionTools(tools).stream()
                .map(tool -> toolEntry(tool.getName(), tool.getDescription(), tool.getParametersSchema()))
                .toList();
    }

    private static Map<String, Object> toolEntry(String name, String description, Map<String, Object> schema) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name", name);
        entry.put("description", nullToEmpty(description));
        entry.put("input_schema", SchemaSanitizer.copy(schema));
        return entry;
    }

    @Override
    public List<ToolDefinition> parseTools(List<Map<String, Object>> formatted) {
        return formatted.stream()
                .map(entry -> {
                    Map<String, Object> schema = map(entry, "input_schema");
                    return ToolDefinition.builder()
                            .name(string(entry, "name"))
                            .description(string(entry, "description"))
                            .parametersSchema(schema != null ? schema : Map.of())
                            .build();
                })
                .toList();
    }

    @Override
    public ProviderRequest buildRequest(String model, List<Message> messages,
                                        List<ToolDefinition> tools, GenerationOptions options) {
        validateOptions(options);

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.putAll(formatMessages(messages));
        body.put("stream", options.isStream());

        Integer maxTokens = resolveMaxTokens(options);
        body.put("max_tokens", maxTokens != null ? maxTokens : FALLBACK_MAX_TOKENS);
        if (options.getTemperature() != null) {
            body.put("temperature", options.getTemperature());
        }
        if (options.getTopP() != null) {
            body.put("top_p", options.getTopP());
        }
        if (options.getStopSequences() != null && !options.getStopSequences().isEmpty()) {
            body.put("stop_sequences", options.getStopSequences());
        }

        List<Map<String, Object>> formattedTools = new ArrayList<>(formatTools(tools));
        if (options.getResponseSchema() != null) {
            formattedTools.add(toolEntry(AnthropicStreamingParser.JSON_RESPONSE_TOOL,
                    "Respond with a JSON object that follows this schema.", options.getResponseSchema()));
            body.put("tool_choice", Map.of("type", "tool", "name", AnthropicStreamingParser.JSON_RESPONSE_TOOL));
        }
        if (!formattedTools.isEmpty()) {
            body.put("tools", formattedTools);
        }

        log.debug("Built {} request [model={}, messages={}, tools={}]",
                providerId, model, messages.size(), formattedTools.size());
        return ProviderRequest.builder()
                .provider(providerId)
                .model(model)
                .url(baseUrl() + "/messages")
                .header("x-api-key", requireApiKey())
                .header("anthropic-version", API_VERSION)
                .header("Content-Type", "application/json")
                .header("Accept", options.isStream() ? "text/event-stream" : "application/json")
                .body(body)
                .stream(options.isStream())
                .build();
    }

    @Override
    public StreamingParser createStreamingParser() {
        return new AnthropicStreamingParser(providerId, objectMapper, settings.isPreserveMetadata());
    }

    @Override
    public NonStreamingParser createNonStreamingParser() {
        return new AnthropicResponseParser(providerId, objectMapper);
    }

    /** A single {@code tool_result} block; Anthropic identifies results by id only. */
    @Override
    public Map<String, Object> formatToolResult(ToolResult result) {
        return formatToolMessage(Message.toolResult(result, resultContent.serialize(result)));
    }

    @Override
    public Message parseToolResult(Map<String, Object> formatted) {
        Object content = formatted.get("content");
        String text;
        if (content instanceof String s) {
            text = s;
        } else {
            StringBuilder joined = new StringBuilder();
            for (Object item : list(content)) {
                Map<String, Object> block = map(item);
                if (block != null && "text".equals(block.get("type"))) {
                    joined.append(string(block, "text"));
                }
            }
            text = joined.toString();
        }
        return Message.builder()
                .role(Message.Role.tool)
                .toolCallId(string(formatted, "tool_use_id"))
                .content(text)
                .providerMetadata(Boolean.TRUE.equals(formatted.get("is_error"))
                        ? Map.of(Message.TOOL_ERROR, true) : null)
                .build();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}

package com.deepansh.gateway.provider;

import com.deepansh.gateway.model.ContentPart;
import com.deepansh.gateway.model.GenerationOptions;
import com.deepansh.gateway.model.Message;
import com.deepansh.gateway.model.ToolCall;
import com.deepansh.gateway.model.ToolResult;
import com.deepansh.gateway.streaming.NonStreamingParser;
import com.deepansh.gateway.streaming.OpenAiResponseParser;
import com.deepansh.gateway.streaming.OpenAiStreamingParser;
import com.deepansh.gateway.streaming.StreamingParser;
import com.deepansh.gateway.tool.ToolDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.deepansh.gateway.streaming.JsonMaps.map;
import static com.deepansh.gateway.streaming.JsonMaps.string;

/**
 * OpenAI chat-completions. Also the base for Mistral and OpenAI-compatible
 * servers, which share the message and tool shapes.
 *
 * An assistant message that made tool calls must carry its {@code tool_calls}
 * array, or the model cannot correlate the tool results that follow.
 */
@Slf4j
public class OpenAiAdapter extends AbstractProviderAdapter {

    public OpenAiAdapter(String providerId, ProviderSettings settings, ObjectMapper objectMapper) {
        super(providerId, settings, objectMapper);
    }

    @Override
    protected double maxTemperature() {
        return 2.0;
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://api.openai.com/v1";
    }

    /** Asks for a trailing usage chunk when streaming. */
    protected boolean requestsStreamUsage() {
        return true;
    }

    protected Map<String, Object> sanitizeSchema(Map<String, Object> schema) {
        return SchemaSanitizer.copy(schema);
    }

    protected void addAuthHeaders(ProviderRequest.ProviderRequestBuilder request) {
        request.header("Authorization", "Bearer " + requireApiKey());
    }

    @Override
    public Map<String, Object> formatMessages(List<Message> messages) {
        List<Map<String, Object>> formatted = messages.stream()
                .map(this::formatMessage)
                .toList();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("messages", formatted);
        return fields;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("role", msg.getRole().name());

        switch (msg.getRole()) {
            case tool -> {
                m.put("tool_call_id", msg.getToolCallId());
                if (msg.getEchoName() != null) {
                    m.put("name", msg.getEchoName());
                }
                m.put("content", msg.getTextContent() != null ? msg.getTextContent() : "");
            }
            case assistant -> {
                m.put("content", msg.getTextContent()); // null is valid alongside tool_calls
                if (msg.hasToolCalls()) {
                    m.put("tool_calls", msg.getToolCalls().stream().map(this::formatToolCall).toList());
                }
            }
            default -> m.put("content", msg.hasParts() ? formatParts(msg.getParts()) : nullToEmpty(msg.getContent()));
        }
        return m;
    }

    private Map<String, Object> formatToolCall(ToolCall call) {
        Map<String, Object> fn = new LinkedHashMap<>();
        fn.put("name", call.getEchoName());
        fn.put("arguments", argumentsJson(call));

        Map<String, Object> tc = new LinkedHashMap<>();
        tc.put("id", call.getId());
        tc.put("type", "function");
        tc.put("function", fn);
        return tc;
    }

    private List<Map<String, Object>> formatParts(List<ContentPart> parts) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (ContentPart part : parts) {
            switch (part.getType()) {
                case TEXT -> out.add(Map.of("type", "text", "text", nullToEmpty(part.getText())));
                case IMAGE -> {
                    String url = part.getImageUrl() != null
                            ? part.getImageUrl()
                            : "data:" + part.getMimeType() + ";base64," + part.getImageData();
                    out.add(Map.of("type", "image_url", "image_url", Map.of("url", url)));
                }
                default -> log.debug("Skipping {} part in {} message", part.getType(), providerId);
            }
        }
        return out;
    }

    @Override
    public List<Map<String, Object>> formatTools(List<ToolDefinition> tools) {
        return functionTools(tools).stream()
                .map(tool -> {
                    Map<String, Object> fn = new LinkedHashMap<>();
                    fn.put("name", tool.getName());
                    fn.put("description", nullToEmpty(tool.getDescription()));
                    fn.put("parameters", sanitizeSchema(tool.getParametersSchema()));
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("type", "function");
                    entry.put("function", fn);
                    return entry;
                })
                .toList();
    }

    @Override
    public List<ToolDefinition> parseTools(List<Map<String, Object>> formatted) {
        List<ToolDefinition> tools = new ArrayList<>();
        for (Map<String, Object> entry : formatted) {
            // both the nested {type, function} and the flat form occur in the wild
            Map<String, Object> fn = map(entry, "function") != null ? map(entry, "function") : entry;
            Map<String, Object> parameters = map(fn, "parameters");
            tools.add(ToolDefinition.builder()
                    .name(string(fn, "name"))
                    .description(string(fn, "description"))
                    .parametersSchema(parameters != null ? parameters : Map.of())
                    .build());
        }
        return tools;
    }

    @Override
    public ProviderRequest buildRequest(String model, List<Message> messages,
                                        List<ToolDefinition> tools, GenerationOptions options) {
        validateOptions(options);

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.putAll(formatMessages(messages));
        body.put("stream", options.isStream());
        if (options.isStream() && requestsStreamUsage()) {
            body.put("stream_options", Map.of("include_usage", true));
        }

        Integer maxTokens = resolveMaxTokens(options);
        if (maxTokens != null) {
            body.put("max_tokens", maxTokens);
        }
        if (options.getTemperature() != null) {
            body.put("temperature", options.getTemperature());
        }
        if (options.getTopP() != null) {
            body.put("top_p", options.getTopP());
        }
        if (options.getStopSequences() != null && !options.getStopSequences().isEmpty()) {
            body.put("stop", options.getStopSequences());
        }

        List<Map<String, Object>> formattedTools = formatTools(tools);
        if (!formattedTools.isEmpty()) {
            body.put("tools", formattedTools);
            body.put("tool_choice", "auto");
        }
        if (options.getResponseSchema() != null) {
            body.put("response_format", Map.of(
                    "type", "json_schema",
                    "json_schema", Map.of("name", "response", "schema", sanitizeSchema(options.getResponseSchema()))));
        }

        ProviderRequest.ProviderRequestBuilder request = ProviderRequest.builder()
                .provider(providerId)
                .model(model)
                .url(baseUrl() + "/chat/completions")
                .header("Content-Type", "application/json")
                .header("Accept", options.isStream() ? "text/event-stream" : "application/json")
                .body(body)
                .stream(options.isStream());
        addAuthHeaders(request);

        log.debug("Built {} request [model={}, messages={}, tools={}]",
                providerId, model, messages.size(), formattedTools.size());
        return request.build();
    }

    @Override
    public StreamingParser createStreamingParser() {
        return new OpenAiStreamingParser(providerId, objectMapper, settings.isPreserveMetadata());
    }

    @Override
    public NonStreamingParser createNonStreamingParser() {
        return new OpenAiResponseParser(providerId, objectMapper);
    }

    @Override
    public Map<String, Object> formatToolResult(ToolResult result) {
        return formatMessage(Message.toolResult(result, resultContent.serialize(result)));
    }

    @Override
    public Message parseToolResult(Map<String, Object> formatted) {
        return Message.builder()
                .role(Message.Role.tool)
                .toolCallId(string(formatted, "tool_call_id"))
                .name(string(formatted, "name"))
                .content(string(formatted, "content"))
                .build();
    }

    protected static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}

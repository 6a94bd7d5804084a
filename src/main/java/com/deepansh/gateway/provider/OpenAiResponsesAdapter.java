package com.deepansh.gateway.provider;

import com.deepansh.gateway.model.ContentPart;
import com.deepansh.gateway.model.GenerationOptions;
import com.deepansh.gateway.model.Message;
import com.deepansh.gateway.model.ToolCall;
import com.deepansh.gateway.model.ToolResult;
import com.deepansh.gateway.streaming.NonStreamingParser;
import com.deepansh.gateway.streaming.OpenAiResponsesResponseParser;
import com.deepansh.gateway.streaming.OpenAiResponsesStreamingParser;
import com.deepansh.gateway.streaming.StreamingParser;
import com.deepansh.gateway.tool.ToolDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.deepansh.gateway.streaming.JsonMaps.map;
import static com.deepansh.gateway.streaming.JsonMaps.string;

/**
 * OpenAI Responses API ({@code /responses}), used by the GPT-5 family.
 *
 * System messages become the top-level {@code instructions}. The rest of the
 * conversation is a flat {@code input} list: an assistant turn with tool calls
 * expands to one {@code function_call} item per call, and each tool result is a
 * {@code function_call_output} item keyed by the same {@code call_id}. Tool
 * declarations are flat ({@code name} next to {@code type}) rather than nested
 * under {@code function}.
 *
 * These models run at a fixed temperature, so temperature and top-p are
 * validated but not sent.
 */
@Slf4j
public class OpenAiResponsesAdapter extends AbstractProviderAdapter {

    public OpenAiResponsesAdapter(String providerId, ProviderSettings settings, ObjectMapper objectMapper) {
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

    @Override
    public Map<String, Object> formatMessages(List<Message> messages) {
        String instructions = messages.stream()
                .filter(m -> m.getRole() == Message.Role.system)
                .map(Message::getTextContent)
                .filter(text -> text != null && !text.isEmpty())
                .collect(Collectors.joining("\n"));

        List<Map<String, Object>> input = new ArrayList<>();
        for (Message msg : messages) {
            switch (msg.getRole()) {
                case system -> {
                    // carried in instructions
                }
                case tool -> input.add(functionCallOutput(msg));
                case assistant -> {
                    String text = msg.getTextContent();
                    if (text != null && !text.isEmpty()) {
                        input.add(roleItem("assistant", text));
                    }
                    if (msg.hasToolCalls()) {
                        msg.getToolCalls().forEach(call -> input.add(functionCall(call)));
                    }
                }
                case user -> {
                    Map<String, Object> item = new LinkedHashMap<>();
                    item.put("role", "user");
                    item.put("content", msg.hasParts() ? formatParts(msg.getParts()) : nullToEmpty(msg.getContent()));
                    input.add(item);
                }
            }
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        if (!instructions.isEmpty()) {
            fields.put("instructions", instructions);
        }
        fields.put("input", input);
        return fields;
    }

    private static Map<String, Object> roleItem(String role, String text) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("role", role);
        item.put("content", text);
        return item;
    }

    private Map<String, Object> functionCall(ToolCall call) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("type", "function_call");
        item.put("call_id", call.getId());
        item.put("name", call.getEchoName());
        item.put("arguments", argumentsJson(call));
        return item;
    }

    private static Map<String, Object> functionCallOutput(Message msg) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("type", "function_call_output");
        item.put("call_id", msg.getToolCallId());
        item.put("output", nullToEmpty(msg.getTextContent()));
        return item;
    }

    private List<Map<String, Object>> formatParts(List<ContentPart> parts) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (ContentPart part : parts) {
            switch (part.getType()) {
                case TEXT -> out.add(Map.of("type", "input_text", "text", nullToEmpty(part.getText())));
                case IMAGE -> {
                    String url = part.getImageUrl() != null
                            ? part.getImageUrl()
                            : "data:" + part.getMimeType() + ";base64," + part.getImageData();
                    out.add(Map.of("type", "input_image", "image_url", url, "detail", "high"));
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
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("type", "function");
                    entry.put("name", tool.getName());
                    entry.put("description", nullToEmpty(tool.getDescription()));
                    entry.put("parameters", SchemaSanitizer.copy(tool.getParametersSchema()));
                    return entry;
                })
                .toList();
    }

    @Override
    public List<ToolDefinition> parseTools(List<Map<String, Object>> formatted) {
        List<ToolDefinition> tools = new ArrayList<>();
        for (Map<String, Object> entry : formatted) {
            Map<String, Object> parameters = map(entry, "parameters");
            tools.add(ToolDefinition.builder()
                    .name(string(entry, "name"))
                    .description(string(entry, "description"))
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
        body.put("store", false);

        Integer maxTokens = resolveMaxTokens(options);
        if (maxTokens != null) {
            body.put("max_output_tokens", maxTokens);
        }
        if (options.getTemperature() != null || options.getTopP() != null) {
            log.debug("{} runs at a fixed temperature; ignoring sampling options", providerId);
        }

        List<Map<String, Object>> formattedTools = formatTools(tools);
        if (!formattedTools.isEmpty()) {
            body.put("tools", formattedTools);
            body.put("tool_choice", "auto");
        }
        if (options.getResponseSchema() != null) {
            Map<String, Object> format = new LinkedHashMap<>();
            format.put("type", "json_schema");
            format.put("name", "response");
            format.put("strict", true);
            format.put("schema", SchemaSanitizer.closed(options.getResponseSchema()));
            body.put("text", Map.of("format", format));
        }

        ProviderRequest request = ProviderRequest.builder()
                .provider(providerId)
                .model(model)
                .url(baseUrl() + "/responses")
                .header("Content-Type", "application/json")
                .header("Accept", options.isStream() ? "text/event-stream" : "application/json")
                .header("Authorization", "Bearer " + requireApiKey())
                .body(body)
                .stream(options.isStream())
                .build();

        log.debug("Built {} request [model={}, messages={}, tools={}]",
                providerId, model, messages.size(), formattedTools.size());
        return request;
    }

    @Override
    public StreamingParser createStreamingParser() {
        return new OpenAiResponsesStreamingParser(providerId, objectMapper, settings.isPreserveMetadata());
    }

    @Override
    public NonStreamingParser createNonStreamingParser() {
        return new OpenAiResponsesResponseParser(providerId, objectMapper);
    }

    @Override
    public Map<String, Object> formatToolResult(ToolResult result) {
        return functionCallOutput(Message.toolResult(result, resultContent.serialize(result)));
    }

    @Override
    public Message parseToolResult(Map<String, Object> formatted) {
        return Message.builder()
                .role(Message.Role.tool)
                .toolCallId(string(formatted, "call_id"))
                .content(string(formatted, "output"))
                .build();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}

package com.deepansh.gateway.provider;

import com.deepansh.gateway.model.ContentPart;
import com.deepansh.gateway.model.GenerationOptions;
import com.deepansh.gateway.model.Message;
import com.deepansh.gateway.model.ToolCall;
import com.deepansh.gateway.model.ToolResult;
import com.deepansh.gateway.streaming.GeminiResponseParser;
import com.deepansh.gateway.streaming.GeminiStreamingParser;
import com.deepansh.gateway.streaming.NonStreamingParser;
import com.deepansh.gateway.streaming.StreamingParser;
import com.deepansh.gateway.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.deepansh.gateway.streaming.JsonMaps.list;
import static com.deepansh.gateway.streaming.JsonMaps.map;
import static com.deepansh.gateway.streaming.JsonMaps.string;

/**
 * Google Gemini {@code generateContent} / {@code streamGenerateContent}.
 *
 * Gemini uses "model" instead of "assistant", sends tool results as
 * {@code functionResponse} parts on a user turn, and only accepts object-valued
 * responses, so non-object results are wrapped as {@code {"result": value}}.
 *
 * Built-in Google Search is the one provider-handled capability. The API
 * rejects it in combination with function declarations, so when it is
 * requested the function tools are left out.
 */
@Slf4j
public class GeminiAdapter extends AbstractProviderAdapter {

    public static final String GOOGLE_SEARCH = "google_search";

    private static final Set<String> SEARCH_ALIASES = Set.of(GOOGLE_SEARCH, "googleSearch");
    private static final String RESULT_KEY = "result";

    public GeminiAdapter(String providerId, ProviderSettings settings, ObjectMapper objectMapper) {
        super(providerId, settings, objectMapper);
    }

    @Override
    protected double maxTemperature() {
        return 2.0;
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://generativelanguage.googleapis.com/v1beta";
    }

    @Override
    public Map<String, Object> formatMessages(List<Message> messages) {
        List<String> system = new ArrayList<>();
        List<Map<String, Object>> contents = new ArrayList<>();
        List<Map<String, Object>> pendingResponses = new ArrayList<>();
        Set<String> generatedIds = new HashSet<>();

        for (Message msg : messages) {
            if (msg.getRole() == Message.Role.tool) {
                pendingResponses.add(functionResponsePart(msg, !generatedIds.contains(msg.getToolCallId())));
                continue;
            }
            if (msg.hasToolCalls()) {
                msg.getToolCalls().stream()
                        .filter(GeminiAdapter::hasGeneratedId)
                        .forEach(call -> generatedIds.add(call.getId()));
            }
            if (!pendingResponses.isEmpty()) {
                contents.add(Map.of("role", "user", "parts", List.copyOf(pendingResponses)));
                pendingResponses.clear();
            }
            switch (msg.getRole()) {
                case system -> system.add(msg.getTextContent());
                case assistant -> contents.add(Map.of("role", "model", "parts", modelParts(msg)));
                default -> contents.add(Map.of("role", "user", "parts", userParts(msg)));
            }
        }
        if (!pendingResponses.isEmpty()) {
            contents.add(Map.of("role", "user", "parts", List.copyOf(pendingResponses)));
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        if (!system.isEmpty()) {
            fields.put("systemInstruction", Map.of("parts", List.of(Map.of("text", String.join("\n\n", system)))));
        }
        fields.put("contents", contents);
        return fields;
    }

    private List<Map<String, Object>> userParts(Message msg) {
        if (!msg.hasParts()) {
            return List.of(Map.of("text", msg.getContent() == null ? "" : msg.getContent()));
        }
        List<Map<String, Object>> parts = new ArrayList<>();
        for (ContentPart part : msg.getParts()) {
            switch (part.getType()) {
                case TEXT -> parts.add(Map.of("text", part.getText() == null ? "" : part.getText()));
                case IMAGE -> parts.add(part.getImageUrl() != null
                        ? Map.of("fileData", Map.of("mimeType", mimeOrDefault(part), "fileUri", part.getImageUrl()))
                        : Map.of("inlineData", Map.of("mimeType", mimeOrDefault(part), "data", part.getImageData())));
                default -> log.debug("Skipping {} part in {} message", part.getType(), providerId);
            }
        }
        return parts;
    }

    private static String mimeOrDefault(ContentPart part) {
        return part.getMimeType() != null ? part.getMimeType() : "image/png";
    }

    private List<Map<String, Object>> modelParts(Message msg) {
        List<Map<String, Object>> parts = new ArrayList<>();
        String text = msg.getTextContent();
        if (text != null && !text.isEmpty()) {
            parts.add(Map.of("text", text));
        }
        if (msg.hasToolCalls()) {
            for (ToolCall call : msg.getToolCalls()) {
                Map<String, Object> functionCall = new LinkedHashMap<>();
                if (call.getId() != null && !hasGeneratedId(call)) {
                    functionCall.put("id", call.getId());
                }
                functionCall.put("name", call.getEchoName());
                functionCall.put("args", call.getArguments() != null ? call.getArguments() : Map.of());

                Map<String, Object> part = new LinkedHashMap<>();
                part.put("functionCall", functionCall);
                if (call.getProviderMetadata() != null
                        && call.getProviderMetadata().get(GeminiStreamingParser.THOUGHT_SIGNATURE) instanceof String signature) {
                    part.put(GeminiStreamingParser.THOUGHT_SIGNATURE, signature);
                }
                parts.add(part);
            }
        }
        if (parts.isEmpty()) {
            parts.add(Map.of("text", ""));
        }
        return parts;
    }

    private static boolean hasGeneratedId(ToolCall call) {
        return call.getProviderMetadata() != null
                && Boolean.TRUE.equals(call.getProviderMetadata().get(GeminiStreamingParser.GENERATED_ID));
    }

    private Map<String, Object> functionResponsePart(Message msg, boolean includeId) {
        Object value = resultContent.read(msg.getTextContent());
        Map<String, Object> response = value instanceof Map<?, ?> ? map(value) : mapOf(RESULT_KEY, value);

        Map<String, Object> functionResponse = new LinkedHashMap<>();
        if (includeId && msg.getToolCallId() != null) {
            functionResponse.put("id", msg.getToolCallId());
        }
        functionResponse.put("name", msg.getEchoName());
        functionResponse.put("response", response);
        return Map.of("functionResponse", functionResponse);
    }

    @Override
    public List<Map<String, Object>> formatTools(List<ToolDefinition> tools) {
        if (tools == null || tools.isEmpty()) {
            return List.of();
        }
        boolean search = false;
        List<Map<String, Object>> declarations = new ArrayList<>();
        for (ToolDefinition tool : tools) {
            if (tool.isProviderHandled()) {
                if (SEARCH_ALIASES.contains(tool.getName())) {
                    search = true;
                } else {
                    log.warn("Provider {} has no native '{}' capability; dropping it", providerId, tool.getName());
                }
                continue;
            }
            Map<String, Object> declaration = new LinkedHashMap<>();
            declaration.put("name", tool.getName());
            declaration.put("description", tool.getDescription() == null ? "" : tool.getDescription());
            declaration.put("parameters", SchemaSanitizer.sanitize(tool.getParametersSchema(), SchemaSanitizer.GEMINI_UNSUPPORTED));
            declarations.add(declaration);
        }

        if (search) {
            if (!declarations.isEmpty()) {
                log.warn("{} cannot combine google_search with function tools; dropping {} function declaration(s)",
                        providerId, declarations.size());
            }
            return List.of(Map.of(GOOGLE_SEARCH, Map.of()));
        }
        return declarations.isEmpty() ? List.of() : List.of(Map.of("functionDeclarations", declarations));
    }

    @Override
    public List<ToolDefinition> parseTools(List<Map<String, Object>> formatted) {
        List<ToolDefinition> tools = new ArrayList<>();
        for (Map<String, Object> entry : formatted) {
            if (entry.containsKey(GOOGLE_SEARCH) || entry.containsKey("googleSearch")) {
                tools.add(ToolDefinition.providerNative(GOOGLE_SEARCH, "Google Search grounding"));
            }
            for (Object item : list(entry, "functionDeclarations")) {
                Map<String, Object> declaration = map(item);
                Map<String, Object> parameters = map(declaration, "parameters");
                tools.add(ToolDefinition.builder()
                        .name(string(declaration, "name"))
                        .description(string(declaration, "description"))
                        .parametersSchema(parameters != null ? parameters : Map.of())
                        .build());
            }
        }
        return tools;
    }

    @Override
    public ProviderRequest buildRequest(String model, List<Message> messages,
                                        List<ToolDefinition> tools, GenerationOptions options) {
        validateOptions(options);

        Map<String, Object> body = new HashMap<>(formatMessages(messages));
        List<Map<String, Object>> formattedTools = formatTools(tools);
        if (!formattedTools.isEmpty()) {
            body.put("tools", formattedTools);
        }

        Map<String, Object> generationConfig = new LinkedHashMap<>();
        Integer maxTokens = resolveMaxTokens(options);
        if (maxTokens != null) {
            generationConfig.put("maxOutputTokens", maxTokens);
        }
        if (options.getTemperature() != null) {
            generationConfig.put("temperature", options.getTemperature());
        }
        if (options.getTopP() != null) {
            generationConfig.put("topP", options.getTopP());
        }
        if (options.getStopSequences() != null && !options.getStopSequences().isEmpty()) {
            generationConfig.put("stopSequences", options.getStopSequences());
        }
        if (options.getResponseSchema() != null) {
            generationConfig.put("responseMimeType", "application/json");
            generationConfig.put("responseSchema",
                    SchemaSanitizer.sanitize(options.getResponseSchema(), SchemaSanitizer.GEMINI_UNSUPPORTED));
        }
        if (!generationConfig.isEmpty()) {
            body.put("generationConfig", generationConfig);
        }

        String url = baseUrl() + "/models/" + model
                + (options.isStream() ? ":streamGenerateContent?alt=sse" : ":generateContent");

        log.debug("Built {} request [model={}, messages={}, tools={}]",
                providerId, model, messages.size(), formattedTools.size());
        return ProviderRequest.builder()
                .provider(providerId)
                .model(model)
                .url(url)
                .header("x-goog-api-key", requireApiKey())
                .header("Content-Type", "application/json")
                .body(body)
                .stream(options.isStream())
                .build();
    }

    @Override
    public StreamingParser createStreamingParser() {
        return new GeminiStreamingParser(providerId, objectMapper, settings.isPreserveMetadata());
    }

    @Override
    public NonStreamingParser createNonStreamingParser() {
        return new GeminiResponseParser(providerId, objectMapper, settings.isPreserveMetadata());
    }

    /** A single {@code functionResponse} part. */
    @Override
    public Map<String, Object> formatToolResult(ToolResult result) {
        return functionResponsePart(Message.toolResult(result, resultContent.serialize(result)), true);
    }

    @Override
    public Message parseToolResult(Map<String, Object> formatted) {
        Map<String, Object> functionResponse = map(formatted, "functionResponse");
        Map<String, Object> response = map(functionResponse, "response");
        Object value = response != null && response.size() == 1 && response.containsKey(RESULT_KEY)
                ? response.get(RESULT_KEY) : response;
        return Message.builder()
                .role(Message.Role.tool)
                .toolCallId(string(functionResponse, "id"))
                .name(string(functionResponse, "name"))
                .content(value instanceof String s ? s : toJson(value))
                .build();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize {} function response: {}", providerId, e.getOriginalMessage());
            return String.valueOf(value);
        }
    }

    private static Map<String, Object> mapOf(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(key, value);
        return map;
    }
}

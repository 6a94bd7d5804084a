package com.deepansh.gateway.streaming;

import com.deepansh.gateway.exception.ProviderProtocolException;
import com.deepansh.gateway.model.FinishReason;
import com.deepansh.gateway.model.ResponseChunk;
import com.deepansh.gateway.model.ToolCallDelta;
import com.deepansh.gateway.model.Usage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.deepansh.gateway.streaming.JsonMaps.first;
import static com.deepansh.gateway.streaming.JsonMaps.integer;
import static com.deepansh.gateway.streaming.JsonMaps.intOrZero;
import static com.deepansh.gateway.streaming.JsonMaps.list;
import static com.deepansh.gateway.streaming.JsonMaps.map;
import static com.deepansh.gateway.streaming.JsonMaps.string;

/**
 * Gemini {@code streamGenerateContent?alt=sse}. Every event is a complete
 * GenerateContentResponse; function calls arrive whole, never fragmented.
 * A call without an id gets a generated one, flagged with {@link #GENERATED_ID}
 * so it is never sent back. A {@code thoughtSignature} on the part is kept in
 * the call's metadata and must be replayed on the next turn.
 *
 * Gemini reports {@code STOP} even when it requested function calls, so
 * any function call in the response forces {@code tool_calls}.
 */
@Slf4j
public class GeminiStreamingParser extends AbstractSseStreamingParser {

    public static final String THOUGHT_SIGNATURE = "thoughtSignature";
    public static final String GENERATED_ID = "generatedId";

    private int nextToolIndex;
    private Usage usage;

    public GeminiStreamingParser(String provider, ObjectMapper objectMapper, boolean preserveMetadata) {
        super(provider, objectMapper, preserveMetadata);
    }

    @Override
    protected void onEvent(SseEvent event, List<ResponseChunk> out) {
        Map<String, Object> json = readJson(event);
        if (json == null) {
            return;
        }
        mapResponse(json, out);
    }

    /** Maps one GenerateContentResponse; shared with the buffered parser. */
    void mapResponse(Map<String, Object> json, List<ResponseChunk> out) {
        Map<String, Object> error = map(json, "error");
        if (error != null) {
            out.add(ResponseChunk.failed(new ProviderProtocolException(provider,
                    String.valueOf(error.getOrDefault("message", "stream error")),
                    intOrZero(error, "code"), string(error, "status"))));
            return;
        }

        Usage chunkUsage = parseUsage(map(json, "usageMetadata"));
        if (chunkUsage != null) {
            usage = chunkUsage;
        }

        Map<String, Object> candidate = first(json, "candidates");
        if (candidate == null) {
            String blockReason = string(map(json, "promptFeedback"), "blockReason");
            if (blockReason != null) {
                log.warn("{} blocked the prompt: {}", provider, blockReason);
                out.add(ResponseChunk.terminal(FinishReason.CONTENT_FILTER, usage));
            }
            return;
        }

        StringBuilder text = new StringBuilder();
        List<ToolCallDelta> toolDeltas = new ArrayList<>();
        for (Object item : list(map(candidate, "content"), "parts")) {
            Map<String, Object> part = map(item);
            if (part == null || Boolean.TRUE.equals(part.get("thought"))) {
                continue;
            }
            if (part.get("text") instanceof String s) {
                text.append(s);
            }
            Map<String, Object> functionCall = map(part, "functionCall");
            if (functionCall != null) {
                String id = string(functionCall, "id");
                Map<String, Object> metadata = new HashMap<>();
                if (id == null) {
                    metadata.put(GENERATED_ID, true);
                }
                if (part.get(THOUGHT_SIGNATURE) instanceof String signature) {
                    metadata.put(THOUGHT_SIGNATURE, signature);
                }
                toolDeltas.add(new ToolCallDelta(nextToolIndex++,
                        id != null ? id : generateId(),
                        string(functionCall, "name"),
                        argumentsJson(functionCall.get("args")),
                        metadata));
            }
        }
        if (text.length() > 0 || !toolDeltas.isEmpty()) {
            out.add(ResponseChunk.builder().contentDelta(text.toString()).toolCallDeltas(toolDeltas).build());
        }

        Map<String, Object> grounding = map(candidate, "groundingMetadata");
        if (grounding != null && preserveMetadata) {
            out.add(ResponseChunk.builder().providerMetadata(Map.of("groundingMetadata", grounding)).build());
        }

        String finish = string(candidate, "finishReason");
        if (finish != null) {
            log.debug("{} finishReason: {}", provider, finish);
            FinishReason reason = FinishReason.normalize(finish);
            if (nextToolIndex > 0 && reason == FinishReason.STOP) {
                reason = FinishReason.TOOL_CALLS;
            }
            out.add(ResponseChunk.terminal(reason, usage));
        }
    }

    private String argumentsJson(Object args) {
        if (args == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.warn("Could not re-serialize {} function args: {}", provider, e.getOriginalMessage());
            return null;
        }
    }

    static Usage parseUsage(Map<String, Object> usage) {
        if (usage == null) {
            return null;
        }
        int prompt = intOrZero(usage, "promptTokenCount");
        int completion = intOrZero(usage, "candidatesTokenCount");
        Integer total = integer(usage, "totalTokenCount");
        return new Usage(prompt, completion, total == null ? prompt + completion : total);
    }

    private static String generateId() {
        return "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }
}

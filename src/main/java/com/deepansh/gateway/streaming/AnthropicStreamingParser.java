package com.deepansh.gateway.streaming;

import com.deepansh.gateway.exception.ProviderProtocolException;
import com.deepansh.gateway.model.FinishReason;
import com.deepansh.gateway.model.ResponseChunk;
import com.deepansh.gateway.model.ToolCallDelta;
import com.deepansh.gateway.model.Usage;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.deepansh.gateway.streaming.JsonMaps.intOrZero;
import static com.deepansh.gateway.streaming.JsonMaps.integer;
import static com.deepansh.gateway.streaming.JsonMaps.map;
import static com.deepansh.gateway.streaming.JsonMaps.string;

/**
 * Anthropic Messages stream.
 *
 * <pre>
 * message_start → (content_block_start → content_block_delta* → content_block_stop)*
 *               → message_delta → message_stop
 * </pre>
 *
 * Content block indexes count text and tool_use blocks together; tool call
 * indexes are assigned sequentially over tool_use blocks only. A tool_use block
 * named {@value #JSON_RESPONSE_TOOL} carries structured output and is surfaced
 * as content.
 */
public class AnthropicStreamingParser extends AbstractSseStreamingParser {

    public static final String JSON_RESPONSE_TOOL = "json_response";

    private enum EventType {
        MESSAGE_START, CONTENT_BLOCK_START, CONTENT_BLOCK_DELTA, CONTENT_BLOCK_STOP,
        MESSAGE_DELTA, MESSAGE_STOP, PING, ERROR, UNKNOWN;

        static EventType of(String name) {
            if (name == null) {
                return UNKNOWN;
            }
            try {
                return valueOf(name.toUpperCase());
            } catch (IllegalArgumentException e) {
                return UNKNOWN;
            }
        }
    }

    private final Map<Integer, Integer> toolIndexByBlock = new HashMap<>();
    private final Set<Integer> jsonResponseBlocks = new HashSet<>();
    private int nextToolIndex;
    private int inputTokens;
    private int outputTokens;
    private String stopReason;

    public AnthropicStreamingParser(String provider, ObjectMapper objectMapper, boolean preserveMetadata) {
        super(provider, objectMapper, preserveMetadata);
    }

    @Override
    protected void onEvent(SseEvent event, List<ResponseChunk> out) {
        Map<String, Object> json = readJson(event);
        if (json == null) {
            return;
        }
        String type = string(json, "type") != null ? string(json, "type") : event.event();

        switch (EventType.of(type)) {
            case MESSAGE_START -> {
                Map<String, Object> usage = map(map(json, "message"), "usage");
                inputTokens = intOrZero(usage, "input_tokens");
                outputTokens = intOrZero(usage, "output_tokens");
            }
            case CONTENT_BLOCK_START -> blockStart(json, out);
            case CONTENT_BLOCK_DELTA -> blockDelta(json, out);
            case MESSAGE_DELTA -> {
                String reason = string(map(json, "delta"), "stop_reason");
                if (reason != null) {
                    stopReason = reason;
                }
                Integer output = integer(map(json, "usage"), "output_tokens");
                if (output != null) {
                    outputTokens = output;
                }
            }
            case MESSAGE_STOP -> out.add(ResponseChunk.terminal(finishReason(), Usage.of(inputTokens, outputTokens)));
            case ERROR -> {
                Map<String, Object> error = map(json, "error");
                out.add(ResponseChunk.failed(new ProviderProtocolException(provider,
                        error != null ? String.valueOf(error.get("message")) : "stream error",
                        0, string(error, "type"))));
            }
            case CONTENT_BLOCK_STOP, PING, UNKNOWN -> {
                // no canonical counterpart
            }
        }
    }

    private void blockStart(Map<String, Object> json, List<ResponseChunk> out) {
        int blockIndex = intOrZero(json, "index");
        Map<String, Object> block = map(json, "content_block");
        String blockType = string(block, "type");
        if ("tool_use".equals(blockType)) {
            String name = string(block, "name");
            if (JSON_RESPONSE_TOOL.equals(name)) {
                jsonResponseBlocks.add(blockIndex);
                return;
            }
            int toolIndex = nextToolIndex++;
            toolIndexByBlock.put(blockIndex, toolIndex);
            out.add(ResponseChunk.builder()
                    .toolCallDeltas(List.of(ToolCallDelta.start(toolIndex, string(block, "id"), name)))
                    .build());
        } else if ("text".equals(blockType)) {
            String text = string(block, "text");
            if (text != null && !text.isEmpty()) {
                out.add(ResponseChunk.content(text));
            }
        }
    }

    private void blockDelta(Map<String, Object> json, List<ResponseChunk> out) {
        int blockIndex = intOrZero(json, "index");
        Map<String, Object> delta = map(json, "delta");
        String deltaType = string(delta, "type");
        if ("text_delta".equals(deltaType)) {
            out.add(ResponseChunk.content(string(delta, "text")));
        } else if ("input_json_delta".equals(deltaType)) {
            String partial = string(delta, "partial_json");
            if (partial == null || partial.isEmpty()) {
                return;
            }
            if (jsonResponseBlocks.contains(blockIndex)) {
                out.add(ResponseChunk.content(partial));
                return;
            }
            Integer toolIndex = toolIndexByBlock.get(blockIndex);
            if (toolIndex != null) {
                out.add(ResponseChunk.builder()
                        .toolCallDeltas(List.of(ToolCallDelta.arguments(toolIndex, partial)))
                        .build());
            }
        }
    }

    private FinishReason finishReason() {
        FinishReason reason = FinishReason.normalize(stopReason);
        if (reason == null) {
            return toolIndexByBlock.isEmpty() ? FinishReason.STOP : FinishReason.TOOL_CALLS;
        }
        if (reason == FinishReason.TOOL_CALLS && toolIndexByBlock.isEmpty()) {
            return FinishReason.STOP;
        }
        return reason;
    }
}

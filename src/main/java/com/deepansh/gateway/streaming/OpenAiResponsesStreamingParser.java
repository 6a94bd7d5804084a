package com.deepansh.gateway.streaming;

import com.deepansh.gateway.exception.ProviderProtocolException;
import com.deepansh.gateway.model.FinishReason;
import com.deepansh.gateway.model.ResponseChunk;
import com.deepansh.gateway.model.ToolCallDelta;
import com.deepansh.gateway.model.Usage;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.deepansh.gateway.streaming.JsonMaps.integer;
import static com.deepansh.gateway.streaming.JsonMaps.intOrZero;
import static com.deepansh.gateway.streaming.JsonMaps.map;
import static com.deepansh.gateway.streaming.JsonMaps.string;

/**
 * OpenAI Responses API stream. Every event is typed in its {@code type} field:
 *
 * <pre>
 * response.created → (response.output_item.added
 *                     → response.output_text.delta* | response.function_call_arguments.delta*)*
 *                  → response.completed | response.incomplete | response.failed
 * </pre>
 *
 * Function calls are keyed by {@code call_id}, which is what the follow-up
 * {@code function_call_output} item must echo. Argument deltas reference the
 * item by {@code item_id} or {@code output_index}; both are mapped onto a
 * sequential tool index.
 */
@Slf4j
public class OpenAiResponsesStreamingParser extends AbstractSseStreamingParser {

    private final Map<String, Integer> toolIndexByItem = new HashMap<>();
    private final Map<Integer, Integer> toolIndexByOutput = new HashMap<>();
    private int nextToolIndex;

    public OpenAiResponsesStreamingParser(String provider, ObjectMapper objectMapper, boolean preserveMetadata) {
        super(provider, objectMapper, preserveMetadata);
    }

    @Override
    protected void onEvent(SseEvent event, List<ResponseChunk> out) {
        String data = event.data().trim();
        if (data.isEmpty() || OpenAiStreamingParser.DONE.equals(data)) {
            return;
        }
        Map<String, Object> json = readJson(event);
        if (json == null) {
            return;
        }
        String type = string(json, "type") != null ? string(json, "type") : event.event();
        if (type == null) {
            return;
        }

        switch (type) {
            case "response.output_text.delta", "response.refusal.delta" -> {
                String text = string(json, "delta");
                if (text != null && !text.isEmpty()) {
                    out.add(ResponseChunk.content(text));
                }
            }
            case "response.output_item.added" -> itemAdded(json, out);
            case "response.function_call_arguments.delta" -> argumentsDelta(json, out);
            case "response.completed", "response.incomplete" -> {
                Map<String, Object> response = map(json, "response");
                out.add(ResponseChunk.terminal(finishReason(response), parseUsage(map(response, "usage"))));
            }
            case "response.failed" -> out.add(ResponseChunk.failed(
                    failure(map(map(json, "response"), "error"), "Response generation failed")));
            case "error" -> out.add(ResponseChunk.failed(failure(json, "stream error")));
            default -> log.trace("{} ignoring event {}", provider, type);
        }
    }

    private void itemAdded(Map<String, Object> json, List<ResponseChunk> out) {
        Map<String, Object> item = map(json, "item");
        if (!"function_call".equals(string(item, "type"))) {
            return;
        }
        int toolIndex = nextToolIndex++;
        if (string(item, "id") != null) {
            toolIndexByItem.put(string(item, "id"), toolIndex);
        }
        Integer outputIndex = integer(json, "output_index");
        if (outputIndex != null) {
            toolIndexByOutput.put(outputIndex, toolIndex);
        }
        String callId = string(item, "call_id") != null ? string(item, "call_id") : string(item, "id");
        String arguments = string(item, "arguments");
        out.add(ResponseChunk.builder()
                .toolCallDeltas(List.of(new ToolCallDelta(toolIndex, callId, string(item, "name"),
                        arguments == null || arguments.isEmpty() ? null : arguments)))
                .build());
    }

    private void argumentsDelta(Map<String, Object> json, List<ResponseChunk> out) {
        String fragment = string(json, "delta");
        if (fragment == null || fragment.isEmpty()) {
            return;
        }
        Integer toolIndex = toolIndexByItem.get(string(json, "item_id"));
        if (toolIndex == null) {
            toolIndex = toolIndexByOutput.get(integer(json, "output_index"));
        }
        if (toolIndex == null) {
            log.warn("{} arguments delta for unknown item {}", provider, string(json, "item_id"));
            return;
        }
        out.add(ResponseChunk.builder()
                .toolCallDeltas(List.of(ToolCallDelta.arguments(toolIndex, fragment)))
                .build());
    }

    /** The API has no finish_reason; it is derived from status and the calls seen. */
    private FinishReason finishReason(Map<String, Object> response) {
        FinishReason incomplete = incompleteReason(response);
        if (incomplete != null) {
            return incomplete;
        }
        return nextToolIndex > 0 ? FinishReason.TOOL_CALLS : FinishReason.STOP;
    }

    static FinishReason incompleteReason(Map<String, Object> response) {
        if (!"incomplete".equals(string(response, "status"))) {
            return null;
        }
        String reason = string(map(response, "incomplete_details"), "reason");
        if ("max_output_tokens".equals(reason)) {
            return FinishReason.LENGTH;
        }
        if ("content_filter".equals(reason)) {
            return FinishReason.CONTENT_FILTER;
        }
        return FinishReason.STOP;
    }

    private ProviderProtocolException failure(Map<String, Object> error, String fallback) {
        String message = string(error, "message");
        return new ProviderProtocolException(provider, message != null ? message : fallback, 0,
                string(error, "code") != null ? string(error, "code") : string(error, "type"));
    }

    static Usage parseUsage(Map<String, Object> usage) {
        if (usage == null) {
            return null;
        }
        int input = intOrZero(usage, "input_tokens");
        int output = intOrZero(usage, "output_tokens");
        Integer total = integer(usage, "total_tokens");
        return new Usage(input, output, total == null ? input + output : total);
    }
}

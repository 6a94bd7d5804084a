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
import java.util.List;
import java.util.Map;

import static com.deepansh.gateway.streaming.JsonMaps.first;
import static com.deepansh.gateway.streaming.JsonMaps.integer;
import static com.deepansh.gateway.streaming.JsonMaps.list;
import static com.deepansh.gateway.streaming.JsonMaps.map;
import static com.deepansh.gateway.streaming.JsonMaps.string;

/**
 * Chat-completions stream format, shared by OpenAI, Mistral and
 * OpenAI-compatible servers such as vLLM.
 *
 * The finish reason arrives on the last choice chunk, but usage may follow in
 * a separate chunk with empty {@code choices}. The terminal chunk is therefore
 * held until usage, {@code [DONE]} or end of input, whichever comes first.
 */
@Slf4j
public class OpenAiStreamingParser extends AbstractSseStreamingParser {

    static final String DONE = "[DONE]";

    private FinishReason heldReason;
    private Usage usage;
    private boolean sawToolCalls;

    public OpenAiStreamingParser(String provider, ObjectMapper objectMapper, boolean preserveMetadata) {
        super(provider, objectMapper, preserveMetadata);
    }

    @Override
    protected void onEvent(SseEvent event, List<ResponseChunk> out) {
        String data = event.data().trim();
        if (data.isEmpty()) {
            return;
        }
        if (DONE.equals(data)) {
            out.add(ResponseChunk.terminal(resolveReason(heldReason), usage));
            return;
        }

        Map<String, Object> json = readJson(event);
        if (json == null) {
            return;
        }

        Map<String, Object> error = map(json, "error");
        if (error != null) {
            out.add(ResponseChunk.failed(new ProviderProtocolException(provider,
                    String.valueOf(error.getOrDefault("message", "stream error")), 0,
                    string(error, "code") != null ? string(error, "code") : string(error, "type"))));
            return;
        }

        Usage chunkUsage = parseUsage(map(json, "usage"));
        if (chunkUsage != null) {
            usage = chunkUsage;
        }

        Map<String, Object> choice = first(json, "choices");
        if (choice != null) {
            Map<String, Object> delta = map(choice, "delta");
            Object rawContent = delta == null ? null : delta.get("content");
            List<ToolCallDelta> toolDeltas = toolCallDeltas(delta);
            if (rawContent != null || !toolDeltas.isEmpty()) {
                String content = contentText(rawContent);
                out.add(ResponseChunk.builder().contentDelta(content).toolCallDeltas(toolDeltas).build());
            }
            String finish = string(choice, "finish_reason");
            if (finish != null) {
                heldReason = FinishReason.normalize(finish);
                log.debug("{} finish_reason: {}", provider, finish);
            }
        }

        if (heldReason != null && usage != null) {
            out.add(ResponseChunk.terminal(resolveReason(heldReason), usage));
        }
    }

    @Override
    protected void onEndOfInput(List<ResponseChunk> out) {
        if (heldReason != null) {
            out.add(ResponseChunk.terminal(resolveReason(heldReason), usage));
        }
    }

    /** Some compatible servers report {@code stop} even after streaming tool calls. */
    private FinishReason resolveReason(FinishReason reason) {
        if (sawToolCalls && (reason == null || reason == FinishReason.STOP)) {
            return FinishReason.TOOL_CALLS;
        }
        return reason == null ? FinishReason.STOP : reason;
    }

    private List<ToolCallDelta> toolCallDeltas(Map<String, Object> delta) {
        List<Object> calls = list(delta, "tool_calls");
        if (calls.isEmpty()) {
            return List.of();
        }
        List<ToolCallDelta> deltas = new ArrayList<>();
        for (int position = 0; position < calls.size(); position++) {
            Map<String, Object> call = map(calls.get(position));
            if (call == null) {
                continue;
            }
            Integer index = integer(call, "index");
            Map<String, Object> function = map(call, "function");
            Object arguments = function == null ? null : function.get("arguments");
            deltas.add(new ToolCallDelta(
                    index != null ? index : position,
                    string(call, "id"),
                    string(function, "name"),
                    argumentsText(arguments)));
        }
        sawToolCalls = true;
        return deltas;
    }

    /** Mistral may send arguments as an object rather than a JSON string. */
    private String argumentsText(Object arguments) {
        if (arguments == null || arguments instanceof String) {
            return (String) arguments;
        }
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            log.warn("Could not re-serialize {} tool arguments: {}", provider, e.getOriginalMessage());
            return null;
        }
    }

    /** Plain string, or (Mistral) an array of typed text parts. */
    static String contentText(Object content) {
        if (content == null) {
            return "";
        }
        if (content instanceof String s) {
            return s;
        }
        StringBuilder text = new StringBuilder();
        for (Object part : list(content)) {
            if (part instanceof String s) {
                text.append(s);
                continue;
            }
            Map<String, Object> p = map(part);
            if (p != null && "text".equals(p.get("type")) && p.get("text") != null) {
                text.append(p.get("text"));
            }
        }
        return text.toString();
    }

    static Usage parseUsage(Map<String, Object> usage) {
        if (usage == null) {
            return null;
        }
        Integer prompt = integer(usage, "prompt_tokens");
        Integer completion = integer(usage, "completion_tokens");
        Integer total = integer(usage, "total_tokens");
        int p = prompt == null ? 0 : prompt;
        int c = completion == null ? 0 : completion;
        return new Usage(p, c, total == null ? p + c : total);
    }
}

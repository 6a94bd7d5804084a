package com.deepansh.gateway.streaming;

import com.deepansh.gateway.exception.ProviderProtocolException;
import com.deepansh.gateway.model.FinishReason;
import com.deepansh.gateway.model.ResponseChunk;
import com.deepansh.gateway.model.ToolCallDelta;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.deepansh.gateway.streaming.JsonMaps.first;
import static com.deepansh.gateway.streaming.JsonMaps.list;
import static com.deepansh.gateway.streaming.JsonMaps.map;
import static com.deepansh.gateway.streaming.JsonMaps.string;

/** Buffered chat-completions body (OpenAI, Mistral, compatible servers). */
@Slf4j
public class OpenAiResponseParser extends AbstractJsonResponseParser {

    public OpenAiResponseParser(String provider, ObjectMapper objectMapper) {
        super(provider, objectMapper);
    }

    @Override
    protected void mapBody(Map<String, Object> json, List<ResponseChunk> out) {
        Map<String, Object> choice = first(json, "choices");
        if (choice == null) {
            throw new ProviderProtocolException(provider, "Response has no choices");
        }
        Map<String, Object> message = map(choice, "message");

        List<ToolCallDelta> deltas = new ArrayList<>();
        List<Object> toolCalls = list(message, "tool_calls");
        for (int i = 0; i < toolCalls.size(); i++) {
            Map<String, Object> call = map(toolCalls.get(i));
            Map<String, Object> function = map(call, "function");
            deltas.add(new ToolCallDelta(i, string(call, "id"), string(function, "name"),
                    argumentsText(function == null ? null : function.get("arguments"))));
        }

        String content = OpenAiStreamingParser.contentText(message == null ? null : message.get("content"));
        if (!content.isEmpty() || !deltas.isEmpty()) {
            out.add(ResponseChunk.builder().contentDelta(content).toolCallDeltas(deltas).build());
        }

        FinishReason reason = FinishReason.normalize(string(choice, "finish_reason"));
        if (!deltas.isEmpty() && (reason == null || reason == FinishReason.STOP)) {
            reason = FinishReason.TOOL_CALLS;
        }
        out.add(ResponseChunk.terminal(reason == null ? FinishReason.STOP : reason,
                OpenAiStreamingParser.parseUsage(map(json, "usage"))));
    }

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
}

package com.deepansh.gateway.streaming;

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

import static com.deepansh.gateway.streaming.JsonMaps.intOrZero;
import static com.deepansh.gateway.streaming.JsonMaps.list;
import static com.deepansh.gateway.streaming.JsonMaps.map;
import static com.deepansh.gateway.streaming.JsonMaps.string;

/** Buffered Anthropic Messages body. */
@Slf4j
public class AnthropicResponseParser extends AbstractJsonResponseParser {

    public AnthropicResponseParser(String provider, ObjectMapper objectMapper) {
        super(provider, objectMapper);
    }

    @Override
    protected void mapBody(Map<String, Object> json, List<ResponseChunk> out) {
        StringBuilder text = new StringBuilder();
        List<ToolCallDelta> deltas = new ArrayList<>();
        for (Object item : list(json, "content")) {
            Map<String, Object> block = map(item);
            String type = string(block, "type");
            if ("text".equals(type)) {
                text.append(string(block, "text"));
            } else if ("tool_use".equals(type)) {
                String input = toJson(block.get("input"));
                if (AnthropicStreamingParser.JSON_RESPONSE_TOOL.equals(string(block, "name"))) {
                    text.append(input);
                } else {
                    deltas.add(new ToolCallDelta(deltas.size(), string(block, "id"), string(block, "name"), input));
                }
            }
        }
        if (text.length() > 0 || !deltas.isEmpty()) {
            out.add(ResponseChunk.builder().contentDelta(text.toString()).toolCallDeltas(deltas).build());
        }

        FinishReason reason = FinishReason.normalize(string(json, "stop_reason"));
        if (reason == null || (reason == FinishReason.TOOL_CALLS && deltas.isEmpty())) {
            reason = deltas.isEmpty() ? FinishReason.STOP : FinishReason.TOOL_CALLS;
        }
        Map<String, Object> usage = map(json, "usage");
        out.add(ResponseChunk.terminal(reason,
                usage == null ? null : Usage.of(intOrZero(usage, "input_tokens"), intOrZero(usage, "output_tokens"))));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value == null ? Map.of() : value);
        } catch (JsonProcessingException e) {
            log.warn("Could not re-serialize {} tool arguments: {}", provider, e.getOriginalMessage());
            return null;
        }
    }
}

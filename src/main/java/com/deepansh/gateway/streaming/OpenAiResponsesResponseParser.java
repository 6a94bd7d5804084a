package com.deepansh.gateway.streaming;

import com.deepansh.gateway.exception.ProviderProtocolException;
import com.deepansh.gateway.model.FinishReason;
import com.deepansh.gateway.model.ResponseChunk;
import com.deepansh.gateway.model.ToolCallDelta;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.deepansh.gateway.streaming.JsonMaps.list;
import static com.deepansh.gateway.streaming.JsonMaps.map;
import static com.deepansh.gateway.streaming.JsonMaps.string;

/** Buffered Responses API body: an {@code output} array of message and function_call items. */
public class OpenAiResponsesResponseParser extends AbstractJsonResponseParser {

    public OpenAiResponsesResponseParser(String provider, ObjectMapper objectMapper) {
        super(provider, objectMapper);
    }

    @Override
    protected void mapBody(Map<String, Object> json, List<ResponseChunk> out) {
        if (!json.containsKey("output")) {
            throw new ProviderProtocolException(provider, "Response has no output");
        }
        StringBuilder text = new StringBuilder();
        List<ToolCallDelta> deltas = new ArrayList<>();
        for (Object raw : list(json, "output")) {
            Map<String, Object> item = map(raw);
            String type = string(item, "type");
            if ("message".equals(type)) {
                for (Object part : list(item, "content")) {
                    Map<String, Object> p = map(part);
                    if ("output_text".equals(string(p, "type")) && string(p, "text") != null) {
                        text.append(string(p, "text"));
                    }
                }
            } else if ("function_call".equals(type)) {
                String callId = string(item, "call_id") != null ? string(item, "call_id") : string(item, "id");
                deltas.add(new ToolCallDelta(deltas.size(), callId, string(item, "name"), string(item, "arguments")));
            }
            // reasoning items carry no canonical content
        }

        if (text.length() > 0 || !deltas.isEmpty()) {
            out.add(ResponseChunk.builder().contentDelta(text.toString()).toolCallDeltas(deltas).build());
        }
        FinishReason reason = OpenAiResponsesStreamingParser.incompleteReason(json);
        if (reason == null) {
            reason = deltas.isEmpty() ? FinishReason.STOP : FinishReason.TOOL_CALLS;
        }
        out.add(ResponseChunk.terminal(reason, OpenAiResponsesStreamingParser.parseUsage(map(json, "usage"))));
    }
}

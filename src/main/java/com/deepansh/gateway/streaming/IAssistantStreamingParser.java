package com.deepansh.gateway.streaming;

import com.deepansh.gateway.model.FinishReason;
import com.deepansh.gateway.model.ResponseChunk;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

import static com.deepansh.gateway.streaming.JsonMaps.list;
import static com.deepansh.gateway.streaming.JsonMaps.map;
import static com.deepansh.gateway.streaming.JsonMaps.string;

/**
 * iAssistant RAG stream. The event type comes from the {@code event:} field or,
 * when the server omits it, from {@code eventType} inside the data.
 * Telemetry, related questions and passages are dropped unless metadata
 * preservation is on.
 */
@Slf4j
public class IAssistantStreamingParser extends AbstractSseStreamingParser {

    private static final TypeReference<Object> ANY = new TypeReference<>() {};

    private enum EventType {
        ANSWER, COMPLETE, TELEMETRY, RELATED, PASSAGES, UNKNOWN;

        static EventType of(String name) {
            if (name == null) {
                return UNKNOWN;
            }
            return switch (name) {
                case "answer" -> ANSWER;
                case "complete", "done", "end", "final" -> COMPLETE;
                case "telemetry" -> TELEMETRY;
                case "related" -> RELATED;
                case "passages" -> PASSAGES;
                default -> UNKNOWN;
            };
        }
    }

    public IAssistantStreamingParser(String provider, ObjectMapper objectMapper, boolean preserveMetadata) {
        super(provider, objectMapper, preserveMetadata);
    }

    @Override
    protected void onEvent(SseEvent event, List<ResponseChunk> out) {
        Object parsed = parseQuietly(event.data());
        Map<String, Object> json = map(parsed);
        String name = event.event() != null ? event.event() : string(json, "eventType");

        switch (EventType.of(name)) {
            case ANSWER -> {
                String text;
                if (json != null) {
                    text = string(json, "answer");
                } else if (parsed instanceof String s) {
                    text = s;
                } else {
                    text = event.data();
                }
                if (text != null && !text.isEmpty()) {
                    out.add(ResponseChunk.content(text));
                }
            }
            case COMPLETE -> out.add(ResponseChunk.terminal(FinishReason.STOP, null));
            case TELEMETRY -> preserve("telemetry", json == null ? null : json.get("telemetry"), out);
            case RELATED -> preserve("related_questions",
                    list(map(json, "questions"), "related_questions"), out);
            case PASSAGES -> preserve("passages", json == null ? null : json.get("passages"), out);
            case UNKNOWN -> log.debug("Ignoring {} event [{}]", provider, name);
        }
    }

    private void preserve(String key, Object value, List<ResponseChunk> out) {
        if (!preserveMetadata || value == null) {
            return;
        }
        out.add(ResponseChunk.builder().providerMetadata(Map.of(key, value)).build());
    }

    private Object parseQuietly(String data) {
        try {
            return objectMapper.readValue(data, ANY);
        } catch (JsonProcessingException e) {
            // plain-text answer fragment
            return null;
        }
    }
}

package com.deepansh.gateway.streaming;

import com.deepansh.gateway.exception.IncompleteStreamException;
import com.deepansh.gateway.model.ResponseChunk;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared SSE plumbing: byte decoding, terminal bookkeeping, and the synthetic
 * error at end of input. Subclasses only map one event at a time.
 *
 * A malformed event is logged and skipped. Nothing is emitted after the
 * first terminal chunk.
 */
@Slf4j
public abstract class AbstractSseStreamingParser implements StreamingParser {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    protected final String provider;
    protected final ObjectMapper objectMapper;
    protected final boolean preserveMetadata;

    private final SseLineDecoder decoder = new SseLineDecoder();
    private boolean terminated;

    protected AbstractSseStreamingParser(String provider, ObjectMapper objectMapper, boolean preserveMetadata) {
        this.provider = provider;
        this.objectMapper = objectMapper;
        this.preserveMetadata = preserveMetadata;
    }

    @Override
    public final List<ResponseChunk> feed(byte[] bytes, int offset, int length) {
        if (terminated) {
            return List.of();
        }
        return dispatch(decoder.feed(bytes, offset, length));
    }

    @Override
    public final List<ResponseChunk> finish() {
        if (terminated) {
            return List.of();
        }
        List<ResponseChunk> out = new ArrayList<>(dispatch(decoder.finish()));
        if (!terminated) {
            List<ResponseChunk> held = new ArrayList<>();
            onEndOfInput(held);
            collect(out, held);
        }
        if (!terminated) {
            log.warn("{} stream ended without a finish reason", provider);
            out.add(ResponseChunk.failed(new IncompleteStreamException(
                    provider + " stream ended before a finish reason was received")));
            terminated = true;
        }
        return out;
    }

    @Override
    public final boolean isTerminated() {
        return terminated;
    }

    /** Maps one event; append produced chunks to {@code out}. */
    protected abstract void onEvent(SseEvent event, List<ResponseChunk> out);

    /** Hook for parsers that hold back a terminal chunk until more data arrives. */
    protected void onEndOfInput(List<ResponseChunk> out) {
    }

    /** Parses an event's JSON data; null (and a warning) when it is malformed. */
    protected Map<String, Object> readJson(SseEvent event) {
        try {
            return objectMapper.readValue(event.data(), MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed {} event [{}]: {}", provider, event.event(), e.getOriginalMessage());
            return null;
        }
    }

    private List<ResponseChunk> dispatch(List<SseEvent> events) {
        if (events.isEmpty()) {
            return List.of();
        }
        List<ResponseChunk> out = new ArrayList<>();
        for (SseEvent event : events) {
            if (terminated) {
                break;
            }
            List<ResponseChunk> produced = new ArrayList<>();
            try {
                onEvent(event, produced);
            } catch (ClassCastException | NullPointerException e) {
                log.warn("Skipping {} event [{}] with unexpected shape: {}", provider, event.event(), e.toString());
                continue;
            }
            collect(out, produced);
        }
        return out;
    }

    /** Copies chunks into {@code out}, stopping after the first terminal one. */
    private void collect(List<ResponseChunk> out, List<ResponseChunk> produced) {
        for (ResponseChunk chunk : produced) {
            out.add(chunk);
            if (chunk.isTerminal()) {
                terminated = true;
                return;
            }
        }
    }
}

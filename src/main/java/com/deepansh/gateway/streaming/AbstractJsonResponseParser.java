package com.deepansh.gateway.streaming;

import com.deepansh.gateway.exception.ProviderProtocolException;
import com.deepansh.gateway.model.FinishReason;
import com.deepansh.gateway.model.ResponseChunk;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.deepansh.gateway.streaming.JsonMaps.map;
import static com.deepansh.gateway.streaming.JsonMaps.string;

/**
 * Buffered JSON body to chunks. The result always ends with exactly one
 * terminal chunk: an unparseable body becomes an {@code error} chunk.
 */
@Slf4j
public abstract class AbstractJsonResponseParser implements NonStreamingParser {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    protected final String provider;
    protected final ObjectMapper objectMapper;

    protected AbstractJsonResponseParser(String provider, ObjectMapper objectMapper) {
        this.provider = provider;
        this.objectMapper = objectMapper;
    }

    @Override
    public final List<ResponseChunk> parse(byte[] body) {
        Map<String, Object> json;
        try {
            json = objectMapper.readValue(body, MAP_TYPE);
        } catch (IOException e) {
            log.error("{} returned an unparseable body: {}", provider, e.getMessage());
            return List.of(ResponseChunk.failed(
                    new ProviderProtocolException(provider, "Response body is not valid JSON", e)));
        }

        Map<String, Object> error = map(json, "error");
        if (error != null) {
            return List.of(ResponseChunk.failed(new ProviderProtocolException(provider,
                    String.valueOf(error.getOrDefault("message", "unknown error")), 0,
                    string(error, "code") != null ? string(error, "code") : string(error, "type"))));
        }

        List<ResponseChunk> out = new ArrayList<>();
        try {
            mapBody(json, out);
        } catch (ProviderProtocolException e) {
            return List.of(ResponseChunk.failed(e));
        } catch (ClassCastException | NullPointerException e) {
            return List.of(ResponseChunk.failed(
                    new ProviderProtocolException(provider, "Unexpected response shape: " + e, e)));
        }

        int terminal = -1;
        for (int i = 0; i < out.size(); i++) {
            if (out.get(i).isTerminal()) {
                terminal = i;
                break;
            }
        }
        if (terminal < 0) {
            out.add(ResponseChunk.terminal(FinishReason.STOP, null));
        } else {
            out.subList(terminal + 1, out.size()).clear();
        }
        return out;
    }

    protected abstract void mapBody(Map<String, Object> json, List<ResponseChunk> out);
}

package com.deepansh.gateway.streaming;

import com.deepansh.gateway.model.ResponseChunk;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Map;

/** Buffered {@code generateContent} body; same mapping as one streamed event. */
public class GeminiResponseParser extends AbstractJsonResponseParser {

    private final boolean preserveMetadata;

    public GeminiResponseParser(String provider, ObjectMapper objectMapper, boolean preserveMetadata) {
        super(provider, objectMapper);
        this.preserveMetadata = preserveMetadata;
    }

    @Override
    protected void mapBody(Map<String, Object> json, List<ResponseChunk> out) {
        new GeminiStreamingParser(provider, objectMapper, preserveMetadata).mapResponse(json, out);
    }
}

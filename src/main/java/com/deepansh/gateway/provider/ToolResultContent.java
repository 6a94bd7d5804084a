package com.deepansh.gateway.provider;

import com.deepansh.gateway.model.ToolError;
import com.deepansh.gateway.model.ToolResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The text a model reads for a tool result. Strings pass through unchanged,
 * other values become JSON, errors become {@code {"error": type, "message": ...}}.
 */
@Slf4j
public class ToolResultContent {

    private static final TypeReference<Object> ANY = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ToolResultContent(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String serialize(ToolResult result) {
        if (result.getError() != null) {
            return write(errorPayload(result.getError()));
        }
        Object value = result.getResult();
        if (value instanceof String s) {
            return s;
        }
        return write(value);
    }

    /** Structured form, for providers that want an object rather than text. */
    public Object toValue(ToolResult result) {
        if (result.getError() != null) {
            return errorPayload(result.getError());
        }
        return result.getResult();
    }

    /** Recovers a value from serialized content; text that is not JSON stays text. */
    public Object read(String content) {
        if (content == null) {
            return null;
        }
        String trimmed = content.trim();
        if (!(trimmed.startsWith("{") || trimmed.startsWith("["))) {
            return content;
        }
        try {
            return objectMapper.readValue(trimmed, ANY);
        } catch (JsonProcessingException e) {
            // looked like JSON but is plain text
            return content;
        }
    }

    private static Map<String, Object> errorPayload(ToolError error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", error.type().code());
        payload.put("message", error.message());
        return payload;
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Tool result is not JSON-serializable, falling back to toString: {}", e.getOriginalMessage());
            return String.valueOf(value);
        }
    }
}

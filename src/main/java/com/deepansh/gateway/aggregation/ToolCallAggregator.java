package com.deepansh.gateway.aggregation;

import com.deepansh.gateway.exception.ArgumentParseException;
import com.deepansh.gateway.model.ResponseChunk;
import com.deepansh.gateway.model.ToolCall;
import com.deepansh.gateway.model.ToolCallDelta;
import com.deepansh.gateway.model.ToolNameMapping;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;

/**
 * Reassembles complete tool calls from streamed deltas, for one response.
 *
 * The first delta for an index fixes its id and name; later deltas only append
 * argument text. Arguments are parsed once, when the response ends. A parse
 * failure is attached to the call instead of thrown, so the executor can report
 * it to the model as an ArgumentParseError.
 */
@Slf4j
public class ToolCallAggregator {

    private static final TypeReference<Object> ANY = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Function<String, ToolNameMapping> nameResolver;
    private final TreeMap<Integer, PendingCall> pending = new TreeMap<>();

    public ToolCallAggregator(ObjectMapper objectMapper, Function<String, ToolNameMapping> nameResolver) {
        this.objectMapper = objectMapper;
        this.nameResolver = nameResolver;
    }

    public void accept(ResponseChunk chunk) {
        chunk.getToolCallDeltas().forEach(this::accept);
    }

    public void accept(ToolCallDelta delta) {
        PendingCall call = pending.computeIfAbsent(delta.index(), i -> new PendingCall());
        if (call.id == null && delta.id() != null && !delta.id().isEmpty()) {
            call.id = delta.id();
        }
        if (call.name == null && delta.name() != null && !delta.name().isEmpty()) {
            call.name = delta.name();
        }
        if (delta.argumentsFragment() != null) {
            call.arguments.append(delta.argumentsFragment());
        }
        call.metadata.putAll(delta.providerMetadata());
    }

    public boolean hasPendingCalls() {
        return !pending.isEmpty();
    }

    /** Finalizes all calls in index order. Calls that never received a name are dropped. */
    public List<ToolCall> finish() {
        List<ToolCall> calls = new ArrayList<>();
        for (Map.Entry<Integer, PendingCall> entry : pending.entrySet()) {
            PendingCall call = entry.getValue();
            if (call.name == null) {
                log.warn("Dropping tool call at index {} without a name", entry.getKey());
                continue;
            }
            calls.add(build(entry.getKey(), call));
        }
        pending.clear();
        return calls;
    }

    private ToolCall build(int index, PendingCall call) {
        String raw = call.arguments.toString();
        ToolNameMapping mapping = nameResolver.apply(call.name);

        Map<String, Object> metadata = new HashMap<>(call.metadata);
        if (mapping.isRenamed()) {
            metadata.put(ToolCall.ECHO_NAME, mapping.echoName());
        }

        ToolCall.ToolCallBuilder builder = ToolCall.builder()
                .id(call.id != null ? call.id : "call_" + index + "_" + UUID.randomUUID().toString().substring(0, 8))
                .name(mapping.dispatchName())
                .rawArguments(raw)
                .providerMetadata(metadata);
        try {
            builder.arguments(parseArguments(raw));
        } catch (ArgumentParseException e) {
            log.warn("Tool call [{}] arguments did not parse: {}", call.name, e.getMessage());
            builder.arguments(Map.of()).argumentError(e);
        }
        return builder.build();
    }

    private Map<String, Object> parseArguments(String raw) {
        if (raw.isBlank()) {
            return new LinkedHashMap<>();
        }
        Object value;
        try {
            value = objectMapper.readValue(raw, ANY);
            // some models double-encode the arguments object as a JSON string
            if (value instanceof String nested && nested.trim().startsWith("{")) {
                value = objectMapper.readValue(nested, ANY);
            }
        } catch (JsonProcessingException e) {
            throw new ArgumentParseException("Arguments are not valid JSON: " + e.getOriginalMessage(), raw, e);
        }
        if (!(value instanceof Map<?, ?>)) {
            throw new ArgumentParseException("Arguments must be a JSON object", raw, null);
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> arguments = (Map<String, Object>) value;
        return arguments;
    }

    private static final class PendingCall {
        private String id;
        private String name;
        private final StringBuilder arguments = new StringBuilder();
        private final Map<String, Object> metadata = new HashMap<>();
    }
}

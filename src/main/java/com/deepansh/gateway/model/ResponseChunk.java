package com.deepansh.gateway.model;

import com.deepansh.gateway.exception.GatewayException;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * The unit produced by streaming. A response is complete exactly when a chunk
 * carries a non-null {@link #finishReason}.
 */
@Value
@Builder(toBuilder = true)
public class ResponseChunk {

    @Builder.Default
    String contentDelta = "";

    @Builder.Default
    List<ToolCallDelta> toolCallDeltas = List.of();

    FinishReason finishReason;

    /** Usually present only on the terminal chunk. */
    Usage usage;

    /** Opt-in provider extras (telemetry, related questions, grounding). */
    @Builder.Default
    Map<String, Object> providerMetadata = Map.of();

    /** The classified failure when {@link #finishReason} is {@code ERROR}. */
    GatewayException error;

    public boolean isTerminal() {
        return finishReason != null;
    }

    public boolean hasToolCallDeltas() {
        return !toolCallDeltas.isEmpty();
    }

    public static ResponseChunk content(String text) {
        return ResponseChunk.builder().contentDelta(text == null ? "" : text).build();
    }

    public static ResponseChunk terminal(FinishReason reason, Usage usage) {
        return ResponseChunk.builder().finishReason(reason).usage(usage).build();
    }

    public static ResponseChunk failed(GatewayException error) {
        return ResponseChunk.builder().finishReason(FinishReason.ERROR).error(error).build();
    }
}

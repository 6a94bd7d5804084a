package com.deepansh.gateway.model;

import com.deepansh.gateway.exception.ToolErrorType;
import lombok.Builder;
import lombok.Value;

/** Outcome of exactly one tool call: either {@link #result} or {@link #error}. */
@Value
@Builder
public class ToolResult {

    String toolCallId;
    String name;

    /** Provider-produced function name, when it differs from {@link #name}. */
    String echoName;

    Object result;
    ToolError error;
    long executionTimeMs;

    /** Sentinel: the provider resolved this call itself, nothing ran locally. */
    boolean providerHandled;

    public boolean isSuccess() {
        return error == null;
    }

    public static ToolResult success(ToolCall call, Object result, long executionTimeMs) {
        return ToolResult.builder()
                .toolCallId(call.getId())
                .name(call.getName())
                .echoName(echoNameOf(call))
                .result(result)
                .executionTimeMs(executionTimeMs)
                .build();
    }

    public static ToolResult failure(ToolCall call, ToolErrorType type, String message, long executionTimeMs) {
        return ToolResult.builder()
                .toolCallId(call.getId())
                .name(call.getName())
                .echoName(echoNameOf(call))
                .error(new ToolError(type, message))
                .executionTimeMs(executionTimeMs)
                .build();
    }

    public static ToolResult providerHandled(ToolCall call) {
        return ToolResult.builder()
                .toolCallId(call.getId())
                .name(call.getName())
                .echoName(echoNameOf(call))
                .providerHandled(true)
                .build();
    }

    private static String echoNameOf(ToolCall call) {
        String echo = call.getEchoName();
        return echo != null && !echo.equals(call.getName()) ? echo : null;
    }
}

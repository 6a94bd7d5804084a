package com.deepansh.gateway.tool;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/** Per-exchange information handed to every tool handler. */
@Value
@Builder
public class ToolContext {

    /** Identity of the end user the exchange runs for. */
    String callerId;

    @Builder.Default
    CancellationToken cancellationToken = new CancellationToken();

    @Builder.Default
    Map<String, Object> attributes = Map.of();

    public static ToolContext anonymous() {
        return ToolContext.builder().callerId("anonymous").build();
    }
}

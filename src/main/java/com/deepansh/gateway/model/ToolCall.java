package com.deepansh.gateway.model;

import com.deepansh.gateway.exception.ArgumentParseException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    /** Metadata key holding the literal function name the provider produced. */
    public static final String ECHO_NAME = "echoName";

    /** ID assigned by the provider (or generated), echoed back in the tool result */
    private String id;

    /** Internal dispatch identifier, always a registered tool name. */
    private String name;

    private Map<String, Object> arguments;

    /** Argument text exactly as accumulated from the stream. */
    private String rawArguments;

    /** Opaque provider quirks; only read when re-serializing for the same provider. */
    @Builder.Default
    private Map<String, Object> providerMetadata = new HashMap<>();

    /** Set by the aggregator when {@link #rawArguments} did not parse. */
    private ArgumentParseException argumentError;

    public boolean hasArgumentError() {
        return argumentError != null;
    }

    /** The name to use when talking back to the provider. */
    public String getEchoName() {
        if (providerMetadata != null && providerMetadata.get(ECHO_NAME) instanceof String echo) {
            return echo;
        }
        return name;
    }
}

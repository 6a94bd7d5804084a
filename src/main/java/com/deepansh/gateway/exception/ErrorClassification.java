package com.deepansh.gateway.exception;

/**
 * Stable, caller-visible error classes. The {@link #code()} strings are part of
 * the public contract and must not change.
 */
public enum ErrorClassification {

    CONFIGURATION_ERROR("ConfigurationError", false),
    TRANSPORT_ERROR("TransportError", true),
    INCOMPLETE_STREAM_ERROR("IncompleteStreamError", false),
    ARGUMENT_PARSE_ERROR("ArgumentParseError", false),
    TOOL_EXECUTION_ERROR("ToolExecutionError", false),
    MAX_TOOL_ITERATIONS_EXCEEDED("MaxToolIterationsExceeded", false),
    PROVIDER_PROTOCOL_ERROR("ProviderProtocolError", false),
    CANCELLED("Cancelled", false);

    private final String code;
    private final boolean retryable;

    ErrorClassification(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    public String code() {
        return code;
    }

    /** Only transport failures may be retried, and only before content was streamed. */
    public boolean isRetryable() {
        return retryable;
    }
}

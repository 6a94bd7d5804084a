package com.deepansh.gateway.exception;

/**
 * Root of every error the gateway surfaces to callers.
 *
 * Unchecked so the streaming iterator and tool callbacks can propagate it
 * without wrapping. Each subclass pins one {@link ErrorClassification}.
 */
public abstract class GatewayException extends RuntimeException {

    protected GatewayException(String message) {
        super(message);
    }

    protected GatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorClassification getClassification();

    public String getCode() {
        return getClassification().code();
    }
}

package com.deepansh.gateway.exception;

/**
 * The upstream stream closed before a terminal chunk arrived.
 * Not retried: part of the answer may already be on the caller's screen.
 */
public class IncompleteStreamException extends GatewayException {

    public IncompleteStreamException(String message) {
        super(message);
    }

    public IncompleteStreamException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorClassification getClassification() {
        return ErrorClassification.INCOMPLETE_STREAM_ERROR;
    }
}

package com.deepansh.gateway.exception;

import lombok.Getter;

/**
 * Network-level failure: connection refused, timeout, rate limit, 5xx.
 * Retried with backoff while no content has been streamed yet.
 */
@Getter
public class TransportException extends GatewayException {

    /** HTTP status when the failure came from a response, otherwise 0. */
    private final int statusCode;

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public TransportException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    @Override
    public ErrorClassification getClassification() {
        return ErrorClassification.TRANSPORT_ERROR;
    }
}

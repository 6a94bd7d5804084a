package com.deepansh.gateway.exception;

public class CancelledException extends GatewayException {

    public CancelledException(String message) {
        super(message);
    }

    @Override
    public ErrorClassification getClassification() {
        return ErrorClassification.CANCELLED;
    }
}

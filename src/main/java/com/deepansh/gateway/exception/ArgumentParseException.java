package com.deepansh.gateway.exception;

import lombok.Getter;

/**
 * Accumulated tool-call arguments are not valid JSON. Attached to the tool call
 * by the aggregator and turned into a tool-result error by the executor.
 */
@Getter
public class ArgumentParseException extends GatewayException {

    private final String rawArguments;

    public ArgumentParseException(String message, String rawArguments, Throwable cause) {
        super(message, cause);
        this.rawArguments = rawArguments;
    }

    @Override
    public ErrorClassification getClassification() {
        return ErrorClassification.ARGUMENT_PARSE_ERROR;
    }
}

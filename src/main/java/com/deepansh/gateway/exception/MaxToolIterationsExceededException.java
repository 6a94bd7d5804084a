package com.deepansh.gateway.exception;

import lombok.Getter;

@Getter
public class MaxToolIterationsExceededException extends GatewayException {

    private final int maxIterations;

    public MaxToolIterationsExceededException(int maxIterations) {
        super("Model kept requesting tools after " + maxIterations + " tool round trips");
        this.maxIterations = maxIterations;
    }

    @Override
    public ErrorClassification getClassification() {
        return ErrorClassification.MAX_TOOL_ITERATIONS_EXCEEDED;
    }
}

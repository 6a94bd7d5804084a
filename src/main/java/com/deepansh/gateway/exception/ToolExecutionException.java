package com.deepansh.gateway.exception;

import lombok.Getter;

/**
 * A single tool call failed. Never fails the exchange: the executor folds it
 * into a {@code ToolResult} error so the model can react on its next turn.
 */
@Getter
public class ToolExecutionException extends GatewayException {

    private final ToolErrorType type;
    private final String toolName;

    public ToolExecutionException(ToolErrorType type, String toolName, String message) {
        super(message);
        this.type = type;
        this.toolName = toolName;
    }

    public ToolExecutionException(ToolErrorType type, String toolName, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.toolName = toolName;
    }

    @Override
    public ErrorClassification getClassification() {
        return ErrorClassification.TOOL_EXECUTION_ERROR;
    }
}

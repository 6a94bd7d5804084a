package com.deepansh.gateway.exception;

/** Classification of a failed tool call, echoed to the model inside the tool message. */
public enum ToolErrorType {

    NOT_FOUND("NotFound"),
    VALIDATION_FAILED("ValidationFailed"),
    ARGUMENT_PARSE_ERROR("ArgumentParseError"),
    TIMEOUT("Timeout"),
    HANDLER_ERROR("HandlerError");

    private final String code;

    ToolErrorType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}

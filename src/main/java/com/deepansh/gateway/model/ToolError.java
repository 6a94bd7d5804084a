package com.deepansh.gateway.model;

import com.deepansh.gateway.exception.ToolErrorType;

public record ToolError(ToolErrorType type, String message) {
}

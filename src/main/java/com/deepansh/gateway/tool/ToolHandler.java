package com.deepansh.gateway.tool;

import java.util.Map;

/**
 * Business logic behind a tool. Must be safe to invoke concurrently with
 * distinct arguments. The returned value is serialized to JSON for the model.
 */
@FunctionalInterface
public interface ToolHandler {

    Object handle(Map<String, Object> arguments, ToolContext context) throws Exception;
}

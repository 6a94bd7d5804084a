package com.deepansh.gateway.tool;

import java.util.Map;

/**
 * Contract for tools contributed as Spring beans. Every bean implementing it is
 * registered in the {@link ToolRegistry} at startup.
 *
 * The {@link #getInputSchema()} return value is serialized as JSON Schema
 * and sent to the model so it knows exactly how to invoke the tool.
 *
 * Throwing is fine: the executor turns the exception into a HandlerError
 * tool result and the conversation continues.
 */
public interface GatewayTool {

    /** Unique snake_case name the model uses to invoke this tool */
    String getName();

    /** Primary signal the model uses to decide when to call this tool. */
    String getDescription();

    /** JSON Schema (as a Map) describing the tool's input parameters. */
    Map<String, Object> getInputSchema();

    /** Maximum concurrent invocations across the process; 0 uses the configured default. */
    default int getConcurrencyLimit() {
        return 0;
    }

    Object execute(Map<String, Object> arguments, ToolContext context) throws Exception;
}

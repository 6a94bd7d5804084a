package com.deepansh.gateway.model;

/**
 * Result of resolving a provider-produced function name.
 *
 * @param dispatchName the registered tool to run
 * @param echoName     the literal name to send back to the provider
 */
public record ToolNameMapping(String dispatchName, String echoName) {

    public static ToolNameMapping identity(String name) {
        return new ToolNameMapping(name, name);
    }

    public boolean isRenamed() {
        return dispatchName != null && !dispatchName.equals(echoName);
    }
}

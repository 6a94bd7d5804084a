package com.deepansh.gateway.tool;

import com.deepansh.gateway.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central registry of dispatchable tools, indexed by name for O(1) dispatch.
 *
 * Spring beans implementing {@link GatewayTool} are registered at startup;
 * application code can add handlers programmatically. Registration is
 * rejected for duplicate names and malformed schemas, so a bad tool fails at
 * boot rather than mid-conversation.
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, RegisteredTool> tools = new ConcurrentHashMap<>();
    private final int defaultConcurrencyLimit;

    public ToolRegistry(int defaultConcurrencyLimit) {
        if (defaultConcurrencyLimit <= 0) {
            throw new ConfigurationException("Default tool concurrency limit must be positive");
        }
        this.defaultConcurrencyLimit = defaultConcurrencyLimit;
    }

    public ToolRegistry(List<GatewayTool> toolBeans, int defaultConcurrencyLimit) {
        this(defaultConcurrencyLimit);
        toolBeans.forEach(tool ->
                register(ToolDefinition.from(tool), tool::execute, tool.getConcurrencyLimit()));
        log.info("Total tools registered: {}", tools.size());
    }

    public void register(ToolDefinition definition, ToolHandler handler) {
        register(definition, handler, 0);
    }

    /** {@code concurrencyLimit <= 0} falls back to the configured default. */
    public void register(ToolDefinition definition, ToolHandler handler, int concurrencyLimit) {
        if (definition == null || !ToolNames.isValid(definition.getName())) {
            throw new ConfigurationException("Invalid tool name: "
                    + (definition == null ? null : definition.getName()));
        }
        if (!definition.isProviderHandled()) {
            if (handler == null) {
                throw new ConfigurationException("Tool '" + definition.getName() + "' has no handler");
            }
            String problem = SchemaValidator.describeProblem(definition.getParametersSchema());
            if (problem != null) {
                throw new ConfigurationException(
                        "Tool '" + definition.getName() + "' has a malformed schema: " + problem);
            }
        }

        int limit = concurrencyLimit > 0 ? concurrencyLimit : defaultConcurrencyLimit;
        RegisteredTool registered = new RegisteredTool(definition, handler, limit);
        if (tools.putIfAbsent(definition.getName(), registered) != null) {
            throw new ConfigurationException("Tool '" + definition.getName() + "' is already registered");
        }
        log.info("Registered tool: [{}] {} (concurrency={})", definition.getName(),
                definition.isProviderHandled() ? "provider-handled" : definition.getDescription(), limit);
    }

    /** Declares a capability the provider executes itself (e.g. web search). */
    public void registerProviderHandled(String name, String description) {
        register(ToolDefinition.providerNative(name, description), null, 0);
    }

    public Optional<RegisteredTool> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    public List<ToolDefinition> getAllDefinitions() {
        return tools.values().stream()
                .map(RegisteredTool::getDefinition)
                .toList();
    }

    /** Definitions for the given names, in the given order; unknown names are skipped. */
    public List<ToolDefinition> getDefinitions(List<String> names) {
        return names.stream()
                .map(tools::get)
                .filter(Objects::nonNull)
                .map(RegisteredTool::getDefinition)
                .toList();
    }

    public boolean hasTool(String name) {
        return name != null && tools.containsKey(name);
    }

    public int toolCount() {
        return tools.size();
    }
}

package com.deepansh.gateway.core;

import com.deepansh.gateway.exception.GatewayException;
import com.deepansh.gateway.model.GenerationOptions;
import com.deepansh.gateway.model.Message;
import com.deepansh.gateway.model.MessageValidator;
import com.deepansh.gateway.model.ModelSelection;
import com.deepansh.gateway.observability.ExchangeTrace;
import com.deepansh.gateway.provider.ProviderAdapter;
import com.deepansh.gateway.provider.ProviderAdapterRegistry;
import com.deepansh.gateway.tool.ToolContext;
import com.deepansh.gateway.tool.ToolDefinition;
import com.deepansh.gateway.tool.ToolExecutor;
import com.deepansh.gateway.tool.ToolRegistry;
import com.deepansh.gateway.transport.ProviderTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.UUID;

/**
 * The single internal chat/completion entry point.
 *
 * Execution flow per exchange:
 * <pre>
 *  1. Resolve "provider:model" to an adapter and validate the conversation
 *  2. Adapter builds the request, transport sends it (retried while opening)
 *  3. Chunks are parsed incrementally and forwarded to the caller
 *  4. On a tool_calls finish: run tools in parallel, append results, go to 2
 *  5. Stop on any other finish reason, a failure, or cancellation
 * </pre>
 *
 * Exchanges share only the registries and the tool pool; everything else is
 * per-exchange state held by {@link GatewayExchange}.
 */
@Slf4j
public class Gateway {

    private final ProviderAdapterRegistry adapters;
    private final ProviderTransport transport;
    private final ToolRegistry toolRegistry;
    private final ToolExecutor toolExecutor;
    private final ObjectMapper objectMapper;
    private final int maxToolIterations;

    public Gateway(ProviderAdapterRegistry adapters, ProviderTransport transport, ToolRegistry toolRegistry,
                   ToolExecutor toolExecutor, ObjectMapper objectMapper, int maxToolIterations) {
        this.adapters = adapters;
        this.transport = transport;
        this.toolRegistry = toolRegistry;
        this.toolExecutor = toolExecutor;
        this.objectMapper = objectMapper;
        this.maxToolIterations = maxToolIterations;
    }

    public GatewayExchange run(List<Message> conversation, String model, List<ToolDefinition> tools,
                               GenerationOptions options) {
        return run(conversation, model, tools, options, ToolContext.anonymous());
    }

    /**
     * Starts an exchange. Nothing is sent until the returned sequence is
     * consumed. Configuration and validation problems do not throw: they come
     * back as an exchange whose only chunk is the classified error.
     *
     * @param conversation caller's messages; copied, never mutated
     * @param model        "provider:model", e.g. "openai:gpt-4o-mini"
     * @param tools        tools the model may call this exchange; may be empty
     */
    public GatewayExchange run(List<Message> conversation, String model, List<ToolDefinition> tools,
                               GenerationOptions options, ToolContext context) {
        String exchangeId = UUID.randomUUID().toString();
        ExchangeTrace trace = new ExchangeTrace(exchangeId, model);
        Conversation owned = new Conversation(conversation == null ? List.of() : conversation);
        List<ToolDefinition> declared = tools == null ? List.of() : tools;
        GenerationOptions effective = options == null ? GenerationOptions.defaults() : options;

        try {
            ModelSelection selection = ModelSelection.parse(model);
            ProviderAdapter adapter = adapters.get(selection.provider());
            MessageValidator.validateConversation(owned.getMessages());

            log.info("Exchange started [id={}, model={}, messages={}, tools={}, caller={}]",
                    exchangeId, selection, owned.size(),
                    declared.stream().map(ToolDefinition::getName).toList(), context.getCallerId());

            return new GatewayExchange(adapter, transport, toolExecutor, objectMapper, maxToolIterations,
                    selection.model(), declared, effective, context, owned, trace);
        } catch (GatewayException e) {
            return GatewayExchange.failed(e, owned, trace, context);
        }
    }

    /** Runs with every tool currently registered. */
    public GatewayExchange runWithRegisteredTools(List<Message> conversation, String model,
                                                  GenerationOptions options, ToolContext context) {
        return run(conversation, model, toolRegistry.getAllDefinitions(), options, context);
    }
}

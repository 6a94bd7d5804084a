package com.deepansh.gateway.core;

import com.deepansh.gateway.aggregation.ToolCallAggregator;
import com.deepansh.gateway.exception.CancelledException;
import com.deepansh.gateway.exception.GatewayException;
import com.deepansh.gateway.exception.IncompleteStreamException;
import com.deepansh.gateway.exception.MaxToolIterationsExceededException;
import com.deepansh.gateway.exception.ProviderProtocolException;
import com.deepansh.gateway.model.FinishReason;
import com.deepansh.gateway.model.GenerationOptions;
import com.deepansh.gateway.model.Message;
import com.deepansh.gateway.model.ResponseChunk;
import com.deepansh.gateway.model.ToolCall;
import com.deepansh.gateway.model.ToolResult;
import com.deepansh.gateway.observability.ExchangeTrace;
import com.deepansh.gateway.provider.ProviderAdapter;
import com.deepansh.gateway.provider.ProviderRequest;
import com.deepansh.gateway.provider.ToolResultContent;
import com.deepansh.gateway.streaming.ChunkStream;
import com.deepansh.gateway.tool.ToolContext;
import com.deepansh.gateway.tool.ToolDefinition;
import com.deepansh.gateway.tool.ToolExecutor;
import com.deepansh.gateway.transport.ProviderTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One running exchange: a lazy, finite, non-restartable sequence of chunks.
 *
 * Each call to {@link #hasNext()} advances the state machine just far enough
 * to produce the next chunk, so nothing is requested from the provider until
 * the caller starts consuming. The sequence always ends with exactly one
 * terminal chunk: the model's own finish chunk on success, or an
 * {@code error} chunk carrying the classified failure. Iteration never throws.
 *
 * Consumed by a single thread; {@link #cancel()} may be called from any thread.
 */
@Slf4j
public class GatewayExchange implements Iterator<ResponseChunk>, AutoCloseable {

    private final ProviderAdapter adapter;
    private final ProviderTransport transport;
    private final ToolExecutor toolExecutor;
    private final ObjectMapper objectMapper;
    private final ToolResultContent resultContent;
    private final int maxToolIterations;

    private final String model;
    private final List<ToolDefinition> tools;
    private final Set<String> declaredNames;
    private final Set<String> providerHandledNames;
    private final GenerationOptions options;
    private final ToolContext context;
    private final Conversation conversation;
    private final ExchangeTrace trace;

    private final Deque<ResponseChunk> outbox = new ArrayDeque<>();
    private final Runnable cancelListener = this::closeStream;
    private volatile ExchangeState state = ExchangeState.REQUESTING;
    private volatile ChunkStream stream;
    private GatewayException failure;

    private ToolCallAggregator aggregator;
    private StringBuilder turnContent;
    private List<ToolCall> pendingCalls;

    GatewayExchange(ProviderAdapter adapter, ProviderTransport transport, ToolExecutor toolExecutor,
                    ObjectMapper objectMapper, int maxToolIterations, String model,
                    List<ToolDefinition> tools, GenerationOptions options, ToolContext context,
                    Conversation conversation, ExchangeTrace trace) {
        this.adapter = adapter;
        this.transport = transport;
        this.toolExecutor = toolExecutor;
        this.objectMapper = objectMapper;
        this.resultContent = new ToolResultContent(objectMapper);
        this.maxToolIterations = maxToolIterations;
        this.model = model;
        this.tools = List.copyOf(tools);
        this.declaredNames = tools.stream().map(ToolDefinition::getName).collect(Collectors.toUnmodifiableSet());
        this.providerHandledNames = tools.stream()
                .filter(ToolDefinition::isProviderHandled)
                .map(ToolDefinition::getName)
                .collect(Collectors.toUnmodifiableSet());
        this.options = options;
        this.context = context;
        this.conversation = conversation;
        this.trace = trace;
        context.getCancellationToken().onCancel(cancelListener);
    }

    /** An exchange that failed before it started, e.g. on an invalid conversation. */
    static GatewayExchange failed(GatewayException error, Conversation conversation, ExchangeTrace trace,
                                  ToolContext context) {
        GatewayExchange exchange = new GatewayExchange(null, null, null, null, 0, null,
                List.of(), GenerationOptions.defaults(), context, conversation, trace);
        exchange.fail(error);
        return exchange;
    }

    @Override
    public boolean hasNext() {
        while (outbox.isEmpty() && !state.isTerminal()) {
            advance();
        }
        return !outbox.isEmpty();
    }

    @Override
    public ResponseChunk next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Exchange has ended");
        }
        return outbox.poll();
    }

    /**
     * Stops the exchange. While streaming, the upstream body is closed; while
     * tools run, they finish but their results are discarded and no new model
     * turn starts.
     */
    public void cancel() {
        context.getCancellationToken().cancel();
    }

    @Override
    public void close() {
        if (!state.isTerminal()) {
            cancel();
        }
        closeStream();
    }

    public ExchangeState getState() {
        return state;
    }

    /** The classified failure when the state is FAILED or CANCELLED. */
    public GatewayException getFailure() {
        return failure;
    }

    /** All messages so far, including assistant tool-call turns and tool results. */
    public List<Message> getMessages() {
        return conversation.getMessages();
    }

    public Conversation getConversation() {
        return conversation;
    }

    private void advance() {
        if (context.getCancellationToken().isCancelled()) {
            finishCancelled();
            return;
        }
        try {
            switch (state) {
                case REQUESTING -> request();
                case STREAMING -> stream();
                case EXECUTING -> execute();
                default -> throw new IllegalStateException("No transition from " + state);
            }
        } catch (GatewayException e) {
            fail(e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure in exchange {}", trace.getExchangeId(), e);
            fail(new ProviderProtocolException(adapter.getProviderId(), "Unexpected failure: " + e.getMessage(), e));
        }
    }

    private void request() {
        ProviderRequest request = adapter.buildRequest(model, conversation.snapshot(), tools, options);
        trace.recordModelTurn();
        log.debug("Model turn {} [exchange={}, provider={}, messages={}]",
                trace.getModelTurns(), trace.getExchangeId(), request.getProvider(), conversation.size());

        if (request.isStream()) {
            stream = ChunkStream.reading(transport.openStream(request), adapter.createStreamingParser());
        } else {
            stream = ChunkStream.of(adapter.createNonStreamingParser().parse(transport.send(request)));
        }
        if (context.getCancellationToken().isCancelled()) {
            closeStream();
        }
        aggregator = new ToolCallAggregator(objectMapper, raw -> adapter.mapToolCallName(raw, declaredNames));
        turnContent = new StringBuilder();
        state = ExchangeState.STREAMING;
    }

    private void stream() {
        ChunkStream current = stream;
        if (current == null || !current.hasNext()) {
            if (context.getCancellationToken().isCancelled()) {
                finishCancelled();
            } else {
                fail(new IncompleteStreamException(adapter.getProviderId() + " response ended without a finish reason"));
            }
            return;
        }
        ResponseChunk chunk = current.next();
        if (context.getCancellationToken().isCancelled()) {
            finishCancelled();
            return;
        }

        if (chunk.getFinishReason() == FinishReason.ERROR) {
            fail(chunk.getError() != null ? chunk.getError()
                    : new ProviderProtocolException(adapter.getProviderId(), "Provider ended the response with an error"));
            return;
        }

        aggregator.accept(chunk);
        turnContent.append(chunk.getContentDelta());

        if (!chunk.isTerminal()) {
            outbox.add(chunk);
            return;
        }

        trace.addUsage(chunk.getUsage());
        closeStream();
        log.debug("Model turn {} finished: {}", trace.getModelTurns(), chunk.getFinishReason().wireValue());

        List<ToolCall> calls = aggregator.finish();
        if (chunk.getFinishReason() != FinishReason.TOOL_CALLS || calls.isEmpty()) {
            complete(chunk);
            return;
        }
        if (calls.stream().allMatch(call -> providerHandledNames.contains(call.getName()))) {
            log.debug("All {} tool call(s) were resolved by the provider", calls.size());
            complete(chunk.toBuilder().finishReason(FinishReason.STOP).build());
            return;
        }
        if (conversation.getToolIterations() >= maxToolIterations) {
            fail(new MaxToolIterationsExceededException(maxToolIterations));
            return;
        }

        log.info("Model requested {} tool(s): {} [exchange={}]", calls.size(),
                calls.stream().map(ToolCall::getName).toList(), trace.getExchangeId());
        pendingCalls = calls;
        state = ExchangeState.EXECUTING;
    }

    private void execute() {
        List<ToolResult> results = toolExecutor.executeAll(pendingCalls, context);
        results.forEach(trace::recordToolResult);

        if (context.getCancellationToken().isCancelled()) {
            log.info("Discarding {} tool result(s) of cancelled exchange {}", results.size(), trace.getExchangeId());
            finishCancelled();
            return;
        }

        // every call on the assistant turn needs a matching tool message; provider-handled ones get none
        List<ToolCall> localCalls = pendingCalls.stream()
                .filter(call -> !providerHandledNames.contains(call.getName()))
                .toList();
        conversation.append(Message.assistantToolCalls(
                turnContent.length() > 0 ? turnContent.toString() : null, localCalls));
        for (ToolResult result : results) {
            if (!result.isProviderHandled()) {
                conversation.append(Message.toolResult(result, resultContent.serialize(result)));
            }
        }
        conversation.recordToolIteration(pendingCalls);
        pendingCalls = null;
        state = ExchangeState.REQUESTING;
    }

    private void complete(ResponseChunk terminal) {
        String text = turnContent.toString();
        if (!text.isEmpty()) {
            conversation.append(Message.assistant(text));
        }
        outbox.add(terminal);
        state = ExchangeState.COMPLETE;
        detach();
        trace.logSummary("complete", null);
    }

    private void fail(GatewayException error) {
        closeStream();
        failure = error;
        outbox.add(ResponseChunk.failed(error));
        state = ExchangeState.FAILED;
        detach();
        trace.logSummary("failed [" + error.getCode() + "]", error);
    }

    private void finishCancelled() {
        closeStream();
        failure = new CancelledException("Exchange " + trace.getExchangeId() + " was cancelled");
        outbox.add(ResponseChunk.failed(failure));
        state = ExchangeState.CANCELLED;
        detach();
        trace.logSummary("cancelled", null);
    }

    /** A context may outlive the exchange; stop listening once it has ended. */
    private void detach() {
        context.getCancellationToken().removeListener(cancelListener);
    }

    private void closeStream() {
        ChunkStream current = stream;
        if (current != null) {
            current.close();
        }
    }
}

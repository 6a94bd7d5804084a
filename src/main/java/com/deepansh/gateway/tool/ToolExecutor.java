package com.deepansh.gateway.tool;

import com.deepansh.gateway.exception.ToolErrorType;
import com.deepansh.gateway.exception.ToolExecutionException;
import com.deepansh.gateway.model.ToolCall;
import com.deepansh.gateway.model.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dispatches tool calls to their handlers.
 *
 * Never throws for a tool-level failure: every call produces exactly one
 * {@link ToolResult}, so the model can see the error and decide what to do next.
 * Checks run in order: provider-handled, unknown tool, argument parse error,
 * schema validation. Only then is the handler submitted to the pool, behind the
 * tool's semaphore and a per-call deadline.
 */
@Slf4j
public class ToolExecutor {

    private final ToolRegistry registry;
    private final ExecutorService pool;
    private final long timeoutMs;

    public ToolExecutor(ToolRegistry registry, ExecutorService pool, long timeoutMs) {
        this.registry = registry;
        this.pool = pool;
        this.timeoutMs = timeoutMs;
    }

    public ToolResult execute(ToolCall call, ToolContext context) {
        return start(call, context).await();
    }

    /** Runs all calls concurrently; results come back in input order. */
    public List<ToolResult> executeAll(List<ToolCall> calls, ToolContext context) {
        List<Invocation> invocations = calls.stream()
                .map(call -> start(call, context))
                .toList();
        return invocations.stream()
                .map(Invocation::await)
                .toList();
    }

    private Invocation start(ToolCall call, ToolContext context) {
        long startNanos = System.nanoTime();
        RegisteredTool tool = registry.find(call.getName()).orElse(null);

        if (tool == null) {
            String msg = String.format("Unknown tool '%s'. Available tools: %s",
                    call.getName(), registry.getAllDefinitions().stream().map(ToolDefinition::getName).toList());
            log.warn(msg);
            return Invocation.done(ToolResult.failure(call, ToolErrorType.NOT_FOUND, msg, 0));
        }
        if (tool.isProviderHandled()) {
            log.debug("Tool [{}] is provider-handled, skipping local execution", call.getName());
            return Invocation.done(ToolResult.providerHandled(call));
        }
        if (call.hasArgumentError()) {
            log.warn("Tool [{}] arguments did not parse: {}", call.getName(), call.getArgumentError().getMessage());
            return Invocation.done(ToolResult.failure(call, ToolErrorType.ARGUMENT_PARSE_ERROR,
                    call.getArgumentError().getMessage(), 0));
        }

        Map<String, Object> arguments = call.getArguments() != null ? call.getArguments() : Map.of();
        List<String> violations = SchemaValidator.validate(arguments, tool.getDefinition().getParametersSchema());
        if (!violations.isEmpty()) {
            String msg = "Invalid arguments for '" + call.getName() + "': " + String.join("; ", violations);
            log.warn(msg);
            return Invocation.done(ToolResult.failure(call, ToolErrorType.VALIDATION_FAILED, msg, 0));
        }

        log.info("Executing tool: [{}] with args: {}", call.getName(), arguments);
        long deadlineNanos = startNanos + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        try {
            Future<Object> future = pool.submit(() -> invoke(tool, arguments, context, deadlineNanos));
            return new Invocation(call, future, null, startNanos, deadlineNanos);
        } catch (RejectedExecutionException e) {
            log.error("Tool pool rejected [{}]", call.getName(), e);
            return Invocation.done(ToolResult.failure(call, ToolErrorType.HANDLER_ERROR,
                    "Tool pool is saturated: " + e.getMessage(), elapsedMs(startNanos)));
        }
    }

    private static Object invoke(RegisteredTool tool, Map<String, Object> arguments,
                                 ToolContext context, long deadlineNanos) throws Exception {
        long waitMs = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
        if (!tool.tryAcquire(waitMs)) {
            throw new ToolExecutionException(ToolErrorType.TIMEOUT, tool.getName(),
                    "Tool '" + tool.getName() + "' is at its concurrency limit of " + tool.getConcurrencyLimit());
        }
        try {
            return tool.getHandler().handle(arguments, context);
        } finally {
            tool.release();
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static final class Invocation {

        private final ToolCall call;
        private final Future<Object> future;
        private final ToolResult immediate;
        private final long startNanos;
        private final long deadlineNanos;

        private Invocation(ToolCall call, Future<Object> future, ToolResult immediate,
                           long startNanos, long deadlineNanos) {
            this.call = call;
            this.future = future;
            this.immediate = immediate;
            this.startNanos = startNanos;
            this.deadlineNanos = deadlineNanos;
        }

        static Invocation done(ToolResult result) {
            return new Invocation(null, CompletableFuture.completedFuture(null), result, 0, 0);
        }

        ToolResult await() {
            if (immediate != null) {
                return immediate;
            }
            String name = call.getName();
            try {
                long remaining = Math.max(deadlineNanos - System.nanoTime(), 0);
                Object result = future.get(remaining, TimeUnit.NANOSECONDS);
                long ms = elapsedMs(startNanos);
                log.debug("Tool [{}] returned in {}ms: {}", name, ms, result);
                return ToolResult.success(call, result, ms);
            } catch (TimeoutException e) {
                future.cancel(true);
                long ms = elapsedMs(startNanos);
                log.warn("Tool [{}] timed out after {}ms", name, ms);
                return ToolResult.failure(call, ToolErrorType.TIMEOUT,
                        "Tool '" + name + "' timed out after " + ms + "ms", ms);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                long ms = elapsedMs(startNanos);
                if (cause instanceof ToolExecutionException tee) {
                    log.warn("Tool [{}] failed with {}: {}", name, tee.getType().code(), tee.getMessage());
                    return ToolResult.failure(call, tee.getType(), tee.getMessage(), ms);
                }
                log.error("Unexpected error in tool [{}]", name, cause);
                return ToolResult.failure(call, ToolErrorType.HANDLER_ERROR,
                        "Tool execution failed: " + cause.getMessage(), ms);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                return ToolResult.failure(call, ToolErrorType.HANDLER_ERROR,
                        "Interrupted while waiting for tool '" + name + "'", elapsedMs(startNanos));
            }
        }
    }
}

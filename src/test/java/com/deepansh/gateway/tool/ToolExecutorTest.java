package com.deepansh.gateway.tool;

import com.deepansh.gateway.exception.ArgumentParseException;
import com.deepansh.gateway.exception.ToolErrorType;
import com.deepansh.gateway.exception.ToolExecutionException;
import com.deepansh.gateway.model.ToolCall;
import com.deepansh.gateway.model.ToolResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ToolExecutorTest {

    private static final Map<String, Object> ID_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of("id", Map.of("type", "string")),
            "required", List.of("id"));

    private ExecutorService pool;
    private ToolRegistry registry;
    private ToolExecutor executor;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(8);
        registry = new ToolRegistry(5);
        executor = new ToolExecutor(registry, pool, 300);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void executeAll_oneFailureOneTimeout_resultsInInputOrder() {
        registry.register(definition("fast", Map.of()), (args, ctx) -> "ok-" + args.get("n"));
        registry.register(definition("broken", Map.of()), (args, ctx) -> {
            throw new IllegalStateException("database down");
        });
        registry.register(definition("slow", Map.of()), (args, ctx) -> {
            Thread.sleep(2_000);
            return "late";
        });

        List<ToolCall> calls = List.of(
                call("1", "fast", Map.of("n", 1)),
                call("2", "fast", Map.of("n", 2)),
                call("3", "broken", Map.of()),
                call("4", "fast", Map.of("n", 4)),
                call("5", "slow", Map.of()));

        List<ToolResult> results = executor.executeAll(calls, ToolContext.anonymous());

        assertThat(results).extracting(ToolResult::getToolCallId).containsExactly("1", "2", "3", "4", "5");
        assertThat(results.get(0).getResult()).isEqualTo("ok-1");
        assertThat(results.get(1).getResult()).isEqualTo("ok-2");
        assertThat(results.get(2).getError().type()).isEqualTo(ToolErrorType.HANDLER_ERROR);
        assertThat(results.get(2).getError().message()).contains("database down");
        assertThat(results.get(3).getResult()).isEqualTo("ok-4");
        assertThat(results.get(4).getError().type()).isEqualTo(ToolErrorType.TIMEOUT);
    }

    @Test
    void execute_unknownTool_returnsNotFoundListingAvailableTools() {
        registry.register(definition("fast", Map.of()), (args, ctx) -> "ok");

        ToolResult result = executor.execute(call("1", "missing", Map.of()), ToolContext.anonymous());

        assertThat(result.getError().type()).isEqualTo(ToolErrorType.NOT_FOUND);
        assertThat(result.getError().message()).contains("missing").contains("fast");
    }

    @Test
    void execute_argumentParseError_handlerNotInvoked() {
        AtomicInteger invocations = new AtomicInteger();
        registry.register(definition("lookup", ID_SCHEMA), (args, ctx) -> invocations.incrementAndGet());
        ToolCall call = call("1", "lookup", Map.of());
        call.setArgumentError(new ArgumentParseException("Arguments are not valid JSON", "{\"id\":", null));

        ToolResult result = executor.execute(call, ToolContext.anonymous());

        assertThat(result.getError().type()).isEqualTo(ToolErrorType.ARGUMENT_PARSE_ERROR);
        assertThat(invocations).hasValue(0);
    }

    @Test
    void execute_schemaViolation_returnsValidationFailed() {
        registry.register(definition("lookup", ID_SCHEMA), (args, ctx) -> "never");

        ToolResult result = executor.execute(call("1", "lookup", Map.of("id", 42)), ToolContext.anonymous());

        assertThat(result.getError().type()).isEqualTo(ToolErrorType.VALIDATION_FAILED);
        assertThat(result.getError().message()).contains("$.id");
    }

    @Test
    void execute_providerHandled_returnsSentinelWithoutRunning() {
        registry.registerProviderHandled("google_search", "Built-in web search");

        ToolResult result = executor.execute(call("1", "google_search", Map.of()), ToolContext.anonymous());

        assertThat(result.isProviderHandled()).isTrue();
        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    void execute_handlerThrowsToolExecutionException_keepsItsType() {
        registry.register(definition("strict", Map.of()), (args, ctx) -> {
            throw new ToolExecutionException(ToolErrorType.VALIDATION_FAILED, "strict", "date is in the past");
        });

        ToolResult result = executor.execute(call("1", "strict", Map.of()), ToolContext.anonymous());

        assertThat(result.getError().type()).isEqualTo(ToolErrorType.VALIDATION_FAILED);
        assertThat(result.getError().message()).isEqualTo("date is in the past");
    }

    @Test
    void executeAll_concurrencyLimitOne_neverRunsTwoAtOnce() {
        ToolExecutor patient = new ToolExecutor(registry, pool, 5_000);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        registry.register(definition("serial", Map.of()), (args, ctx) -> {
            int now = running.incrementAndGet();
            maxRunning.accumulateAndGet(now, Math::max);
            Thread.sleep(50);
            running.decrementAndGet();
            return "done";
        }, 1);

        List<ToolResult> results = patient.executeAll(List.of(
                call("1", "serial", Map.of()), call("2", "serial", Map.of()), call("3", "serial", Map.of())),
                ToolContext.anonymous());

        assertThat(results).allMatch(ToolResult::isSuccess);
        assertThat(maxRunning).hasValue(1);
    }

    @Test
    void execute_handlerSeesCallerContext() {
        registry.register(definition("whoami", Map.of()), (args, ctx) -> ctx.getCallerId());
        ToolContext context = ToolContext.builder().callerId("user-7").build();

        ToolResult result = executor.execute(call("1", "whoami", Map.of()), context);

        assertThat(result.getResult()).isEqualTo("user-7");
    }

    private static ToolDefinition definition(String name, Map<String, Object> schema) {
        ToolDefinition.ToolDefinitionBuilder builder = ToolDefinition.builder().name(name).description(name + " tool");
        if (!schema.isEmpty()) {
            builder.parametersSchema(schema);
        }
        return builder.build();
    }

    private static ToolCall call(String id, String name, Map<String, Object> arguments) {
        return ToolCall.builder().id(id).name(name).arguments(arguments).build();
    }
}

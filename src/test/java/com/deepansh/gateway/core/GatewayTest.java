package com.deepansh.gateway.core;

import com.deepansh.gateway.exception.CancelledException;
import com.deepansh.gateway.exception.ConfigurationException;
import com.deepansh.gateway.exception.ErrorClassification;
import com.deepansh.gateway.exception.MaxToolIterationsExceededException;
import com.deepansh.gateway.exception.TransportException;
import com.deepansh.gateway.model.FinishReason;
import com.deepansh.gateway.model.GenerationOptions;
import com.deepansh.gateway.model.Message;
import com.deepansh.gateway.model.ResponseChunk;
import com.deepansh.gateway.provider.OpenAiAdapter;
import com.deepansh.gateway.provider.ProviderAdapterRegistry;
import com.deepansh.gateway.provider.ProviderRequest;
import com.deepansh.gateway.provider.ProviderSettings;
import com.deepansh.gateway.tool.CancellationToken;
import com.deepansh.gateway.tool.ToolContext;
import com.deepansh.gateway.tool.ToolDefinition;
import com.deepansh.gateway.tool.ToolExecutor;
import com.deepansh.gateway.tool.ToolRegistry;
import com.deepansh.gateway.transport.ProviderStream;
import com.deepansh.gateway.transport.ProviderTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayTest {

    private static final String ANSWER_FOUR = """
            data: {"choices":[{"index":0,"delta":{"content":"4"}}]}

            data: {"choices":[{"index":0,"delta":{"content":""}}]}

            data: {"choices":[{"index":0,"delta":{},"finish_reason":"stop"}]}

            data: [DONE]

            """;

    private static final String LOOKUP_CALL = """
            data: {"choices":[{"index":0,"delta":{"role":"assistant","content":null,"tool_calls":[{"index":0,"id":"call_1","type":"function","function":{"name":"lookup","arguments":""}}]}}]}

            data: {"choices":[{"index":0,"delta":{"tool_calls":[{"index":0,"function":{"arguments":"{\\"id\\":"}}]}}]}

            data: {"choices":[{"index":0,"delta":{"tool_calls":[{"index":0,"function":{"arguments":"\\"42\\"}"}}]}}]}

            data: {"choices":[{"index":0,"delta":{},"finish_reason":"tool_calls"}]}

            data: [DONE]

            """;

    private static final String FOUND_IT = """
            data: {"choices":[{"index":0,"delta":{"content":"Found it."}}]}

            data: {"choices":[{"index":0,"delta":{},"finish_reason":"stop"}]}

            data: [DONE]

            """;

    private static final String LOOKUP_AND_SEARCH = """
            data: {"choices":[{"index":0,"delta":{"tool_calls":[{"index":0,"id":"c1","type":"function","function":{"name":"lookup","arguments":"{\\"id\\":\\"42\\"}"}}]}}]}

            data: {"choices":[{"index":0,"delta":{"tool_calls":[{"index":1,"id":"c2","type":"function","function":{"name":"web_search","arguments":"{\\"q\\":\\"record 42\\"}"}}]}}]}

            data: {"choices":[{"index":0,"delta":{},"finish_reason":"tool_calls"}]}

            data: [DONE]

            """;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ExecutorService pool;
    private ToolRegistry toolRegistry;
    private ScriptedTransport transport;
    private AtomicInteger lookups;
    private final AtomicBoolean cancelOnLookup = new AtomicBoolean();

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
        toolRegistry = new ToolRegistry(5);
        transport = new ScriptedTransport();
        lookups = new AtomicInteger();
        toolRegistry.register(ToolDefinition.builder()
                .name("lookup")
                .description("Looks up a record by id")
                .parametersSchema(Map.of(
                        "type", "object",
                        "properties", Map.of("id", Map.of("type", "string")),
                        "required", List.of("id")))
                .build(), (args, ctx) -> {
            lookups.incrementAndGet();
            if (cancelOnLookup.get()) {
                ctx.getCancellationToken().cancel();
            }
            return Map.of("value", 1);
        });
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void run_plainAnswer_forwardsDeltasAndCompletes() {
        transport.respond(ANSWER_FOUR);

        GatewayExchange exchange = gateway(10).run(List.of(Message.user("2+2?")), "openai:gpt-4o-mini",
                List.of(), GenerationOptions.defaults());
        List<ResponseChunk> chunks = drain(exchange);

        assertThat(chunks).extracting(ResponseChunk::getContentDelta).containsExactly("4", "", "");
        assertThat(chunks.get(chunks.size() - 1).getFinishReason()).isEqualTo(FinishReason.STOP);
        assertThat(exchange.getState()).isEqualTo(ExchangeState.COMPLETE);
        assertThat(exchange.getConversation().getExecutedToolCalls()).isEmpty();
        assertThat(exchange.getMessages()).last()
                .satisfies(m -> assertThat(m.getContent()).isEqualTo("4"));
        assertThat(transport.requests).singleElement()
                .satisfies(r -> assertThat(r.getUrl()).isEqualTo("https://api.openai.com/v1/chat/completions"));
    }

    @Test
    void run_nothingConsumed_sendsNothing() {
        transport.respond(ANSWER_FOUR);

        gateway(10).run(List.of(Message.user("hi")), "openai:gpt-4o-mini", List.of(), GenerationOptions.defaults());

        assertThat(transport.requests).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void run_splitToolCall_executesToolAndSendsResultBack() {
        transport.respond(LOOKUP_CALL);
        transport.respond(FOUND_IT);

        GatewayExchange exchange = gateway(10).runWithRegisteredTools(List.of(Message.user("find record 42")),
                "openai:gpt-4o-mini", GenerationOptions.defaults(), ToolContext.anonymous());
        List<ResponseChunk> chunks = drain(exchange);

        assertThat(exchange.getState()).isEqualTo(ExchangeState.COMPLETE);
        assertThat(chunks.get(chunks.size() - 1).getFinishReason()).isEqualTo(FinishReason.STOP);
        assertThat(lookups).hasValue(1);
        assertThat(transport.requests).hasSize(2);

        List<Map<String, Object>> secondTurn = (List<Map<String, Object>>) transport.requests.get(1).getBody().get("messages");
        assertThat(secondTurn).extracting(m -> m.get("role")).containsExactly("user", "assistant", "tool");
        assertThat(secondTurn.get(2))
                .containsEntry("tool_call_id", "call_1")
                .containsEntry("content", "{\"value\":1}");
        Map<String, Object> echoedCall = ((List<Map<String, Object>>) secondTurn.get(1).get("tool_calls")).get(0);
        assertThat(echoedCall).containsEntry("id", "call_1");
        assertThat(exchange.getConversation().getExecutedToolCalls()).singleElement()
                .satisfies(call -> assertThat(call.getArguments()).isEqualTo(Map.of("id", "42")));
    }

    @Test
    void run_modelKeepsCallingTools_failsAfterMaxIterations() {
        for (int i = 0; i < 5; i++) {
            transport.respond(LOOKUP_CALL);
        }

        GatewayExchange exchange = gateway(2).runWithRegisteredTools(List.of(Message.user("loop")),
                "openai:gpt-4o-mini", GenerationOptions.defaults(), ToolContext.anonymous());
        List<ResponseChunk> chunks = drain(exchange);

        ResponseChunk last = chunks.get(chunks.size() - 1);
        assertThat(last.getFinishReason()).isEqualTo(FinishReason.ERROR);
        assertThat(last.getError()).isInstanceOf(MaxToolIterationsExceededException.class);
        assertThat(exchange.getState()).isEqualTo(ExchangeState.FAILED);
        assertThat(transport.requests).hasSize(3);
        assertThat(lookups).hasValue(2);
    }

    @Test
    void run_transportFailure_endsWithClassifiedErrorChunk() {
        transport.fail(new TransportException("Connection refused", new ConnectException("refused")));

        GatewayExchange exchange = gateway(10).run(List.of(Message.user("hi")), "openai:gpt-4o-mini",
                List.of(), GenerationOptions.defaults());
        List<ResponseChunk> chunks = drain(exchange);

        assertThat(chunks).singleElement().satisfies(chunk -> {
            assertThat(chunk.getFinishReason()).isEqualTo(FinishReason.ERROR);
            assertThat(chunk.getError().getClassification()).isEqualTo(ErrorClassification.TRANSPORT_ERROR);
        });
        assertThat(exchange.getFailure()).isInstanceOf(TransportException.class);
    }

    @Test
    void run_unknownProvider_returnsConfigurationError() {
        GatewayExchange exchange = gateway(10).run(List.of(Message.user("hi")), "cohere:command-r",
                List.of(), GenerationOptions.defaults());
        List<ResponseChunk> chunks = drain(exchange);

        assertThat(chunks).singleElement()
                .satisfies(chunk -> assertThat(chunk.getError()).isInstanceOf(ConfigurationException.class));
        assertThat(exchange.getState()).isEqualTo(ExchangeState.FAILED);
        assertThat(transport.requests).isEmpty();
    }

    @Test
    void run_malformedModel_returnsConfigurationError() {
        GatewayExchange exchange = gateway(10).run(List.of(Message.user("hi")), "gpt-4o",
                List.of(), GenerationOptions.defaults());

        assertThat(drain(exchange)).singleElement()
                .satisfies(chunk -> assertThat(chunk.getError().getCode()).isEqualTo("ConfigurationError"));
    }

    @Test
    void cancel_beforeConsuming_endsCancelledWithoutRequest() {
        transport.respond(ANSWER_FOUR);
        GatewayExchange exchange = gateway(10).run(List.of(Message.user("hi")), "openai:gpt-4o-mini",
                List.of(), GenerationOptions.defaults());

        exchange.cancel();
        List<ResponseChunk> chunks = drain(exchange);

        assertThat(chunks).singleElement()
                .satisfies(chunk -> assertThat(chunk.getError()).isInstanceOf(CancelledException.class));
        assertThat(exchange.getState()).isEqualTo(ExchangeState.CANCELLED);
        assertThat(transport.requests).isEmpty();
    }

    @Test
    void cancel_whileToolsRun_discardsResultsAndStops() {
        cancelOnLookup.set(true);
        transport.respond(LOOKUP_CALL);
        transport.respond(FOUND_IT);

        GatewayExchange exchange = gateway(10).runWithRegisteredTools(List.of(Message.user("find record 42")),
                "openai:gpt-4o-mini", GenerationOptions.defaults(), ToolContext.anonymous());
        drain(exchange);

        assertThat(exchange.getState()).isEqualTo(ExchangeState.CANCELLED);
        assertThat(transport.requests).hasSize(1);
        assertThat(exchange.getMessages()).extracting(Message::getRole).containsExactly(Message.Role.user);
    }

    @Test
    @SuppressWarnings("unchecked")
    void run_mixedProviderHandledAndLocalCalls_everyEchoedCallHasAResult() {
        toolRegistry.registerProviderHandled("web_search", "Provider web search");
        transport.respond(LOOKUP_AND_SEARCH);
        transport.respond(FOUND_IT);

        GatewayExchange exchange = gateway(10).runWithRegisteredTools(List.of(Message.user("find record 42")),
                "openai:gpt-4o-mini", GenerationOptions.defaults(), ToolContext.anonymous());
        drain(exchange);

        assertThat(exchange.getState()).isEqualTo(ExchangeState.COMPLETE);
        List<Map<String, Object>> secondTurn = (List<Map<String, Object>>) transport.requests.get(1).getBody().get("messages");
        List<Map<String, Object>> echoedCalls = (List<Map<String, Object>>) secondTurn.get(1).get("tool_calls");
        assertThat(echoedCalls).extracting(c -> c.get("id")).containsExactly("c1");
        assertThat(secondTurn).filteredOn(m -> "tool".equals(m.get("role")))
                .extracting(m -> m.get("tool_call_id")).containsExactly("c1");
        assertThat(lookups).hasValue(1);
    }

    @Test
    void cancel_whileStreaming_closesUpstreamAndRunsNoTools() {
        AtomicBoolean upstreamClosed = new AtomicBoolean();
        transport.respond(LOOKUP_CALL, () -> upstreamClosed.set(true));

        GatewayExchange exchange = gateway(10).runWithRegisteredTools(List.of(Message.user("find record 42")),
                "openai:gpt-4o-mini", GenerationOptions.defaults(), ToolContext.anonymous());
        assertThat(exchange.hasNext()).isTrue();
        ResponseChunk first = exchange.next();
        exchange.cancel();
        List<ResponseChunk> rest = drain(exchange);

        assertThat(first.hasToolCallDeltas()).isTrue();
        assertThat(upstreamClosed).isTrue();
        assertThat(rest).singleElement()
                .satisfies(chunk -> assertThat(chunk.getError()).isInstanceOf(CancelledException.class));
        assertThat(exchange.getState()).isEqualTo(ExchangeState.CANCELLED);
        assertThat(lookups).hasValue(0);
        assertThat(transport.requests).hasSize(1);
    }

    @Test
    void run_sharedContext_listenersReleasedWhenExchangesEnd() {
        CountingToken token = new CountingToken();
        ToolContext shared = ToolContext.builder().callerId("user-7").cancellationToken(token).build();
        transport.respond(ANSWER_FOUR);
        transport.respond(ANSWER_FOUR);

        Gateway gateway = gateway(10);
        drain(gateway.run(List.of(Message.user("2+2?")), "openai:gpt-4o-mini", List.of(), GenerationOptions.defaults(), shared));
        drain(gateway.run(List.of(Message.user("2+2?")), "openai:gpt-4o-mini", List.of(), GenerationOptions.defaults(), shared));

        assertThat(token.registered).isZero();
    }

    private Gateway gateway(int maxToolIterations) {
        ProviderSettings settings = new ProviderSettings();
        settings.setApiKey("sk-test");
        ProviderAdapterRegistry adapters = new ProviderAdapterRegistry(
                Map.of("openai", new OpenAiAdapter("openai", settings, objectMapper)));
        ToolExecutor executor = new ToolExecutor(toolRegistry, pool, 2_000);
        return new Gateway(adapters, transport, toolRegistry, executor, objectMapper, maxToolIterations);
    }

    private static List<ResponseChunk> drain(GatewayExchange exchange) {
        List<ResponseChunk> chunks = new ArrayList<>();
        exchange.forEachRemaining(chunks::add);
        return chunks;
    }

    private static class CountingToken extends CancellationToken {

        private int registered;

        @Override
        public void onCancel(Runnable listener) {
            registered++;
            super.onCancel(listener);
        }

        @Override
        public void removeListener(Runnable listener) {
            registered--;
            super.removeListener(listener);
        }
    }

    private static class ScriptedTransport implements ProviderTransport {

        private final Deque<Object> script = new ArrayDeque<>();
        private final Deque<Closeable> closers = new ArrayDeque<>();
        private final List<ProviderRequest> requests = new ArrayList<>();

        void respond(String sse) {
            respond(sse, () -> { });
        }

        void respond(String sse, Closeable onClose) {
            script.add(sse);
            closers.add(onClose);
        }

        void fail(RuntimeException error) {
            script.add(error);
        }

        @Override
        public byte[] send(ProviderRequest request) {
            closers.poll();
            return next(request).getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public ProviderStream openStream(ProviderRequest request) {
            byte[] body = next(request).getBytes(StandardCharsets.UTF_8);
            return new ProviderStream(new ByteArrayInputStream(body), closers.poll());
        }

        private String next(ProviderRequest request) {
            requests.add(request);
            Object step = script.poll();
            if (step instanceof RuntimeException e) {
                throw e;
            }
            if (step == null) {
                throw new IllegalStateException("No scripted response for request " + requests.size());
            }
            return (String) step;
        }
    }
}

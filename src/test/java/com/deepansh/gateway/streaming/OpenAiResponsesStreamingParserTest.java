package com.deepansh.gateway.streaming;

import com.deepansh.gateway.exception.IncompleteStreamException;
import com.deepansh.gateway.exception.ProviderProtocolException;
import com.deepansh.gateway.model.FinishReason;
import com.deepansh.gateway.model.ResponseChunk;
import com.deepansh.gateway.model.ToolCallDelta;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OpenAiResponsesStreamingParserTest {

    private OpenAiResponsesStreamingParser parser;

    @BeforeEach
    void setUp() {
        parser = new OpenAiResponsesStreamingParser("openai-responses", new ObjectMapper(), false);
    }

    @Test
    void textDeltas_thenCompleted_stopWithUsage() {
        List<ResponseChunk> chunks = feed(
                event("response.created", "{\"type\":\"response.created\",\"response\":{\"status\":\"in_progress\"}}"),
                event("response.output_text.delta", "{\"type\":\"response.output_text.delta\",\"output_index\":0,\"delta\":\"Hel\"}"),
                event("response.output_text.delta", "{\"type\":\"response.output_text.delta\",\"output_index\":0,\"delta\":\"lo\"}"),
                event("response.completed", "{\"type\":\"response.completed\",\"response\":{\"status\":\"completed\","
                        + "\"usage\":{\"input_tokens\":12,\"output_tokens\":3,\"total_tokens\":15}}}"));

        assertThat(chunks).extracting(ResponseChunk::getContentDelta).containsSequence("Hel", "lo");
        ResponseChunk terminal = chunks.get(chunks.size() - 1);
        assertThat(terminal.getFinishReason()).isEqualTo(FinishReason.STOP);
        assertThat(terminal.getUsage().promptTokens()).isEqualTo(12);
        assertThat(terminal.getUsage().totalTokens()).isEqualTo(15);
    }

    @Test
    void functionCall_keyedByCallIdAndArgumentsFollowItemId() {
        List<ResponseChunk> chunks = feed(
                event("response.output_item.added", "{\"type\":\"response.output_item.added\",\"output_index\":1,"
                        + "\"item\":{\"type\":\"function_call\",\"id\":\"fc_1\",\"call_id\":\"call_abc\",\"name\":\"lookup\",\"arguments\":\"\"}}"),
                event("response.function_call_arguments.delta", "{\"type\":\"response.function_call_arguments.delta\","
                        + "\"item_id\":\"fc_1\",\"output_index\":1,\"delta\":\"{\\\"id\\\":\"}"),
                event("response.function_call_arguments.delta", "{\"type\":\"response.function_call_arguments.delta\","
                        + "\"output_index\":1,\"delta\":\"\\\"42\\\"}\"}"),
                event("response.completed", "{\"type\":\"response.completed\",\"response\":{\"status\":\"completed\"}}"));

        List<ToolCallDelta> deltas = new ArrayList<>();
        chunks.forEach(c -> deltas.addAll(c.getToolCallDeltas()));
        assertThat(deltas).extracting(ToolCallDelta::index).containsOnly(0);
        assertThat(deltas.get(0).id()).isEqualTo("call_abc");
        assertThat(deltas.get(0).name()).isEqualTo("lookup");
        assertThat(deltas.get(1).argumentsFragment() + deltas.get(2).argumentsFragment()).isEqualTo("{\"id\":\"42\"}");
        assertThat(chunks.get(chunks.size() - 1).getFinishReason()).isEqualTo(FinishReason.TOOL_CALLS);
    }

    @Test
    void incompleteForMaxOutputTokens_mapsToLength() {
        List<ResponseChunk> chunks = feed(
                event("response.incomplete", "{\"type\":\"response.incomplete\",\"response\":{\"status\":\"incomplete\","
                        + "\"incomplete_details\":{\"reason\":\"max_output_tokens\"}}}"));

        assertThat(chunks).singleElement()
                .extracting(ResponseChunk::getFinishReason).isEqualTo(FinishReason.LENGTH);
    }

    @Test
    void responseFailed_failsWithErrorCode() {
        List<ResponseChunk> chunks = feed(
                event("response.failed", "{\"type\":\"response.failed\",\"response\":{\"status\":\"failed\","
                        + "\"error\":{\"code\":\"server_error\",\"message\":\"boom\"}}}"));

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).getError()).isInstanceOfSatisfying(ProviderProtocolException.class, e -> {
            assertThat(e.getProviderErrorCode()).isEqualTo("server_error");
            assertThat(e.getMessage()).contains("boom");
        });
    }

    @Test
    void reasoningAndBookkeepingEvents_ignored() {
        List<ResponseChunk> chunks = feed(
                event("response.output_item.added", "{\"type\":\"response.output_item.added\",\"output_index\":0,"
                        + "\"item\":{\"type\":\"reasoning\",\"id\":\"rs_1\"}}"),
                event("response.content_part.added", "{\"type\":\"response.content_part.added\"}"),
                event("response.output_text.done", "{\"type\":\"response.output_text.done\",\"text\":\"all\"}"));

        assertThat(chunks).isEmpty();
    }

    @Test
    void streamCutBeforeCompletion_failsWithIncompleteStream() {
        List<ResponseChunk> chunks = feed(
                event("response.output_text.delta", "{\"type\":\"response.output_text.delta\",\"delta\":\"partial\"}"));
        chunks.addAll(parser.finish());

        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(1).getError()).isInstanceOf(IncompleteStreamException.class);
    }

    private static String event(String name, String json) {
        return "event: " + name + "\ndata: " + json + "\n\n";
    }

    private List<ResponseChunk> feed(String... events) {
        List<ResponseChunk> out = new ArrayList<>();
        for (String event : events) {
            byte[] bytes = event.getBytes(StandardCharsets.UTF_8);
            out.addAll(parser.feed(bytes, 0, bytes.length));
        }
        return out;
    }
}

package com.deepansh.gateway.provider;

import com.deepansh.gateway.model.ContentPart;
import com.deepansh.gateway.model.FinishReason;
import com.deepansh.gateway.model.GenerationOptions;
import com.deepansh.gateway.model.Message;
import com.deepansh.gateway.model.ResponseChunk;
import com.deepansh.gateway.model.ToolCall;
import com.deepansh.gateway.model.ToolResult;
import com.deepansh.gateway.tool.ToolDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OpenAiResponsesAdapterTest {

    private static final ToolDefinition LOOKUP = ToolDefinition.builder()
            .name("lookup")
            .description("Looks up a record by id")
            .parametersSchema(Map.of(
                    "type", "object",
                    "properties", Map.of("id", Map.of("type", "string")),
                    "required", List.of("id")))
            .build();

    private ProviderSettings settings;
    private OpenAiResponsesAdapter adapter;

    @BeforeEach
    void setUp() {
        settings = new ProviderSettings();
        settings.setApiKey("sk-test");
        adapter = new OpenAiResponsesAdapter("openai-responses", settings, new ObjectMapper());
    }

    @Test
    @SuppressWarnings("unchecked")
    void buildRequest_systemBecomesInstructionsAndSamplingOmitted() {
        settings.setMaxTokensCeiling(1000);

        ProviderRequest request = adapter.buildRequest("gpt-5",
                List.of(Message.system("be brief"), Message.system("use metric"), Message.user("hi")),
                List.of(LOOKUP),
                GenerationOptions.builder().maxTokens(5000).temperature(0.7).build());

        Map<String, Object> body = request.getBody();
        assertThat(request.getUrl()).isEqualTo("https://api.openai.com/v1/responses");
        assertThat(request.getHeaders()).containsEntry("Authorization", "Bearer sk-test");
        assertThat(body).containsEntry("instructions", "be brief\nuse metric")
                .containsEntry("max_output_tokens", 1000)
                .containsEntry("tool_choice", "auto")
                .doesNotContainKeys("temperature", "messages", "max_tokens");
        assertThat((List<Map<String, Object>>) body.get("input"))
                .containsExactly(Map.of("role", "user", "content", "hi"));
    }

    @Test
    void formatTools_flatShape_roundTrips() {
        List<Map<String, Object>> formatted = adapter.formatTools(List.of(LOOKUP));

        assertThat(formatted.get(0)).containsEntry("type", "function")
                .containsEntry("name", "lookup")
                .doesNotContainKey("function");
        assertThat(adapter.parseTools(formatted)).containsExactly(LOOKUP);
    }

    @Test
    @SuppressWarnings("unchecked")
    void buildRequest_toolTurnExpandsToFunctionCallItems() {
        ToolCall call = ToolCall.builder()
                .id("call_abc").name("lookup").arguments(Map.of("id", "42"))
                .providerMetadata(Map.of(ToolCall.ECHO_NAME, "lookup_lookup"))
                .build();
        List<Message> conversation = List.of(
                Message.user("find 42"),
                Message.assistantToolCalls("checking", List.of(call)),
                Message.toolResult(ToolResult.success(call, "found", 3), "found"));

        List<Map<String, Object>> input = (List<Map<String, Object>>) adapter.buildRequest("gpt-5", conversation,
                List.of(LOOKUP), GenerationOptions.defaults()).getBody().get("input");

        assertThat(input).hasSize(4);
        assertThat(input.get(1)).containsEntry("role", "assistant").containsEntry("content", "checking");
        assertThat(input.get(2)).containsEntry("type", "function_call")
                .containsEntry("call_id", "call_abc")
                .containsEntry("name", "lookup_lookup")
                .containsEntry("arguments", "{\"id\":\"42\"}");
        assertThat(input.get(3)).isEqualTo(Map.of(
                "type", "function_call_output", "call_id", "call_abc", "output", "found"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void buildRequest_imagePart_becomesInputImage() {
        Message message = Message.builder().role(Message.Role.user)
                .parts(List.of(ContentPart.text("what is this?"), ContentPart.inlineImage("image/png", "AAAA")))
                .build();

        List<Map<String, Object>> input = (List<Map<String, Object>>) adapter.buildRequest("gpt-5", List.of(message),
                List.of(), GenerationOptions.defaults()).getBody().get("input");

        List<Map<String, Object>> content = (List<Map<String, Object>>) input.get(0).get("content");
        assertThat(content.get(0)).containsEntry("type", "input_text");
        assertThat(content.get(1)).containsEntry("type", "input_image")
                .containsEntry("image_url", "data:image/png;base64,AAAA");
    }

    @Test
    @SuppressWarnings("unchecked")
    void buildRequest_responseSchema_strictTextFormatWithClosedObjects() {
        Map<String, Object> schema = Map.of("type", "object", "properties",
                Map.of("address", Map.of("type", "object", "properties", Map.of("city", Map.of("type", "string")))));

        Map<String, Object> body = adapter.buildRequest("gpt-5", List.of(Message.user("hi")), List.of(),
                GenerationOptions.builder().responseSchema(schema).stream(false).build()).getBody();

        Map<String, Object> format = (Map<String, Object>) ((Map<String, Object>) body.get("text")).get("format");
        assertThat(format).containsEntry("type", "json_schema").containsEntry("strict", true);
        Map<String, Object> sent = (Map<String, Object>) format.get("schema");
        assertThat(sent).containsEntry("additionalProperties", false);
        Map<String, Object> address = (Map<String, Object>) ((Map<String, Object>) sent.get("properties")).get("address");
        assertThat(address).containsEntry("additionalProperties", false);
    }

    @Test
    void formatToolResult_thenParse_keepsCallIdAndOutput() {
        ToolCall call = ToolCall.builder().id("call_1").name("lookup").build();

        Message parsed = adapter.parseToolResult(adapter.formatToolResult(ToolResult.success(call, Map.of("v", 1), 2)));

        assertThat(parsed.getToolCallId()).isEqualTo("call_1");
        assertThat(parsed.getContent()).isEqualTo("{\"v\":1}");
    }

    @Test
    void nonStreamingParser_outputItemsBecomeContentAndCalls() {
        String body = "{\"status\":\"completed\",\"error\":null,\"output\":["
                + "{\"type\":\"reasoning\",\"id\":\"rs_1\",\"summary\":[]},"
                + "{\"type\":\"message\",\"role\":\"assistant\",\"content\":[{\"type\":\"output_text\",\"text\":\"Looking.\"}]},"
                + "{\"type\":\"function_call\",\"id\":\"fc_1\",\"call_id\":\"call_9\",\"name\":\"lookup\",\"arguments\":\"{\\\"id\\\":\\\"9\\\"}\"}],"
                + "\"usage\":{\"input_tokens\":20,\"output_tokens\":8,\"total_tokens\":28}}";

        List<ResponseChunk> chunks = adapter.createNonStreamingParser().parse(body.getBytes(StandardCharsets.UTF_8));

        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(0).getContentDelta()).isEqualTo("Looking.");
        assertThat(chunks.get(0).getToolCallDeltas()).singleElement()
                .satisfies(delta -> {
                    assertThat(delta.id()).isEqualTo("call_9");
                    assertThat(delta.argumentsFragment()).isEqualTo("{\"id\":\"9\"}");
                });
        assertThat(chunks.get(1).getFinishReason()).isEqualTo(FinishReason.TOOL_CALLS);
        assertThat(chunks.get(1).getUsage().totalTokens()).isEqualTo(28);
    }

    @Test
    void nonStreamingParser_failedResponse_becomesErrorChunk() {
        String body = "{\"status\":\"failed\",\"error\":{\"code\":\"rate_limit_exceeded\",\"message\":\"slow down\"},\"output\":[]}";

        List<ResponseChunk> chunks = adapter.createNonStreamingParser().parse(body.getBytes(StandardCharsets.UTF_8));

        assertThat(chunks).singleElement()
                .extracting(ResponseChunk::getFinishReason).isEqualTo(FinishReason.ERROR);
    }
}

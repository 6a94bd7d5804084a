package com.deepansh.gateway.provider;

import com.deepansh.gateway.exception.ConfigurationException;
import com.deepansh.gateway.model.GenerationOptions;
import com.deepansh.gateway.model.Message;
import com.deepansh.gateway.streaming.BufferedSseParser;
import com.deepansh.gateway.tool.ToolDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IAssistantAdapterTest {

    private ProviderSettings settings;
    private IAssistantAdapter adapter;

    @BeforeEach
    void setUp() {
        settings = new ProviderSettings();
        settings.setApiKey("ia-token");
        settings.setBaseUrl("https://ia.example.com/");
        settings.getOptions().put("profile-id", "support-kb");
        adapter = new IAssistantAdapter("iassistant", settings, new ObjectMapper());
    }

    @Test
    void buildRequest_sendsLastUserMessageAsQuestion() {
        ProviderRequest request = adapter.buildRequest("default", List.of(
                Message.user("first question"),
                Message.assistant("an answer"),
                Message.user("follow-up question")), List.of(), GenerationOptions.defaults());

        assertThat(request.getBody())
                .containsEntry("question", "follow-up question")
                .containsEntry("profileId", "support-kb")
                .containsEntry("metaData", true)
                .containsEntry("telemetry", true);
        assertThat(request.getHeaders())
                .containsEntry("Authorization", "Bearer ia-token")
                .containsEntry("Accept", "text/event-stream");
    }

    @Test
    void buildRequest_urlCarriesSearchParameters() {
        ProviderRequest request = adapter.buildRequest("default", List.of(Message.user("q")), List.of(),
                GenerationOptions.defaults());

        assertThat(request.getUrl())
                .startsWith("https://ia.example.com/internal-api/v2/rag/ask?uuid=")
                .contains("searchFields=%7B%7D")
                .contains("sSearchMode=multiword")
                .contains("sSearchDistance=");
    }

    @Test
    void buildRequest_profileDefaultsToModel() {
        settings.getOptions().clear();

        ProviderRequest request = adapter.buildRequest("hr-policies", List.of(Message.user("q")), List.of(),
                GenerationOptions.defaults());

        assertThat(request.getBody()).containsEntry("profileId", "hr-policies");
    }

    @Test
    void buildRequest_noUserMessage_rejected() {
        assertThatThrownBy(() -> adapter.buildRequest("default", List.of(Message.system("only system")), List.of(),
                GenerationOptions.defaults()))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void formatTools_alwaysEmpty() {
        assertThat(adapter.formatTools(List.of(ToolDefinition.builder().name("x").build()))).isEmpty();
    }

    @Test
    void nonStreamingParser_isBufferedSse() {
        assertThat(adapter.createNonStreamingParser()).isInstanceOf(BufferedSseParser.class);
    }
}

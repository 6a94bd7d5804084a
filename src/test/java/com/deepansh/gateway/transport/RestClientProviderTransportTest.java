package com.deepansh.gateway.transport;

import com.deepansh.gateway.exception.ProviderProtocolException;
import com.deepansh.gateway.exception.TransportException;
import com.deepansh.gateway.provider.ProviderRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withRawStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestClientProviderTransportTest {

    private static final String URL = "https://api.openai.com/v1/chat/completions";

    private MockRestServiceServer server;
    private RestClientProviderTransport transport;
    private ProviderRequest request;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        transport = new RestClientProviderTransport(builder.build(), new ObjectMapper());
        request = ProviderRequest.builder()
                .provider("openai")
                .model("gpt-4o-mini")
                .url(URL)
                .header("Authorization", "Bearer sk-test")
                .body(Map.of("model", "gpt-4o-mini", "stream", true))
                .stream(true)
                .build();
    }

    @Test
    void openStream_success_returnsBodyAndSendsHeaders() throws IOException {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk-test"))
                .andExpect(content().json("{\"model\":\"gpt-4o-mini\",\"stream\":true}"))
                .andRespond(withSuccess("data: [DONE]\n\n", MediaType.TEXT_EVENT_STREAM));

        try (InputStream body = transport.openStream(request)) {
            assertThat(new String(body.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("data: [DONE]\n\n");
        }
        server.verify();
    }

    @Test
    void send_serverError_isTransportException() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE).body("overloaded"));

        assertThatThrownBy(() -> transport.send(request))
                .isInstanceOf(TransportException.class)
                .satisfies(e -> assertThat(((TransportException) e).getStatusCode()).isEqualTo(503));
    }

    @Test
    void openStream_rateLimited_isTransportException() {
        server.expect(requestTo(URL)).andRespond(withRawStatus(429).body("slow down"));

        assertThatThrownBy(() -> transport.openStream(request)).isInstanceOf(TransportException.class);
    }

    @Test
    void send_clientError_keepsProviderErrorCode() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":{\"message\":\"Incorrect API key provided\",\"type\":\"invalid_request_error\",\"code\":\"invalid_api_key\"}}"));

        assertThatThrownBy(() -> transport.send(request))
                .isInstanceOf(ProviderProtocolException.class)
                .hasMessageContaining("Incorrect API key provided")
                .satisfies(e -> {
                    ProviderProtocolException ppe = (ProviderProtocolException) e;
                    assertThat(ppe.getStatusCode()).isEqualTo(401);
                    assertThat(ppe.getProviderErrorCode()).isEqualTo("invalid_api_key");
                });
    }
}

package com.deepansh.gateway.transport;

import com.deepansh.gateway.exception.ProviderProtocolException;
import com.deepansh.gateway.exception.TransportException;
import com.deepansh.gateway.provider.ProviderRequest;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static com.deepansh.gateway.streaming.JsonMaps.map;
import static com.deepansh.gateway.streaming.JsonMaps.string;

/**
 * {@link ProviderTransport} on Spring's RestClient.
 *
 * Error handling strategy:
 *
 * | Error                  | Action                                            |
 * |------------------------|---------------------------------------------------|
 * | network error          | TransportException (retried)                      |
 * | 429 rate limit         | TransportException (retried)                      |
 * | 5xx server error       | TransportException (retried)                      |
 * | other 4xx              | ProviderProtocolException with status and code    |
 */
@Slf4j
public class RestClientProviderTransport implements ProviderTransport {

    private static final int MAX_ERROR_BODY = 4096;
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public RestClientProviderTransport(RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public byte[] send(ProviderRequest request) {
        log.debug("Sending buffered request to {} [model={}]", request.getProvider(), request.getModel());
        try {
            return prepare(request).exchange((req, res) -> {
                checkStatus(request, res);
                try (InputStream body = res.getBody()) {
                    return body.readAllBytes();
                }
            });
        } catch (ResourceAccessException e) {
            throw unreachable(request, e);
        }
    }

    @Override
    public ProviderStream openStream(ProviderRequest request) {
        log.debug("Opening stream to {} [model={}]", request.getProvider(), request.getModel());
        try {
            return prepare(request).exchange((req, res) -> {
                try {
                    checkStatus(request, res);
                    return new ProviderStream(res.getBody(), res);
                } catch (RuntimeException | IOException e) {
                    res.close();
                    throw e;
                }
            }, false);
        } catch (ResourceAccessException e) {
            throw unreachable(request, e);
        }
    }

    private RestClient.RequestHeadersSpec<?> prepare(ProviderRequest request) {
        return restClient.post()
                .uri(URI.create(request.getUrl()))
                .headers(headers -> request.getHeaders().forEach(headers::set))
                .contentType(MediaType.APPLICATION_JSON)
                .body(request.getBody());
    }

    private void checkStatus(ProviderRequest request, ClientHttpResponse response) throws IOException {
        HttpStatusCode status = response.getStatusCode();
        if (status.is2xxSuccessful()) {
            return;
        }
        String body = readErrorBody(response);
        String provider = request.getProvider();
        int code = status.value();

        if (code == 429 || status.is5xxServerError()) {
            log.warn("{} {} [{}]: {}", provider, code == 429 ? "rate limited" : "server error", code, body);
            throw new TransportException(provider + " returned " + code + ": " + body, code);
        }
        log.error("{} 4xx [{}]: {}", provider, code, body);
        throw new ProviderProtocolException(provider, "client error [" + code + "]: " + errorMessage(body),
                code, providerErrorCode(body));
    }

    private static String readErrorBody(ClientHttpResponse response) {
        try (InputStream body = response.getBody()) {
            byte[] bytes = body.readNBytes(MAX_ERROR_BODY);
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "(unreadable body: " + e.getMessage() + ")";
        }
    }

    /** The provider's own error code: OpenAI/Mistral {@code error.code|type}, Anthropic {@code error.type}, Gemini {@code error.status}. */
    private String providerErrorCode(String body) {
        Map<String, Object> error = map(parse(body), "error");
        if (error == null) {
            return null;
        }
        for (String key : new String[]{"code", "type", "status"}) {
            String value = string(error, key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private String errorMessage(String body) {
        String message = string(map(parse(body), "error"), "message");
        return message != null ? message : body;
    }

    private Map<String, Object> parse(String body) {
        try {
            return objectMapper.readValue(body, MAP_TYPE);
        } catch (IOException e) {
            // plain-text error body
            return null;
        }
    }

    private static TransportException unreachable(ProviderRequest request, ResourceAccessException e) {
        log.warn("{} is unreachable: {}", request.getProvider(), e.getMessage());
        return new TransportException(request.getProvider() + " is unreachable: " + e.getMessage(), e);
    }
}

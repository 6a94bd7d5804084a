package com.deepansh.gateway.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.ssl.SSLConnectionSocketFactoryBuilder;
import org.apache.hc.core5.ssl.SSLContexts;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * The pooled Apache HttpClient behind every provider call.
 *
 * The read timeout is a socket timeout, i.e. the longest silence tolerated
 * between two reads. A long SSE stream that keeps producing bytes is never
 * cut off by it.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public RestClient providerRestClient(GatewayProperties properties) {
        GatewayProperties.Http http = properties.getHttp();

        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(http.getConnectTimeoutMs()))
                .setSocketTimeout(Timeout.ofMilliseconds(http.getReadTimeoutMs()))
                .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setSSLSocketFactory(
                                        SSLConnectionSocketFactoryBuilder.create()
                                                .setSslContext(SSLContexts.createSystemDefault())
                                                .build())
                                .setDefaultConnectionConfig(connectionConfig)
                                .setMaxConnTotal(http.getMaxConnections())
                                .setMaxConnPerRoute(http.getMaxConnections())
                                .build())
                .disableAutomaticRetries()
                .build();

        HttpComponentsClientHttpRequestFactory factory = new HttpComponentsClientHttpRequestFactory(httpClient);

        log.info("HttpClient configured [connectTimeout={}ms, readTimeout={}ms, maxConnections={}]",
                http.getConnectTimeoutMs(), http.getReadTimeoutMs(), http.getMaxConnections());
        return RestClient.builder().requestFactory(factory).build();
    }
}

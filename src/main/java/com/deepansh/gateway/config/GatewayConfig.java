package com.deepansh.gateway.config;

import com.deepansh.gateway.core.Gateway;
import com.deepansh.gateway.provider.ProviderAdapterRegistry;
import com.deepansh.gateway.provider.ProviderSettings;
import com.deepansh.gateway.resilience.RetryingProviderTransport;
import com.deepansh.gateway.tool.GatewayTool;
import com.deepansh.gateway.tool.ToolExecutor;
import com.deepansh.gateway.tool.ToolRegistry;
import com.deepansh.gateway.transport.ProviderTransport;
import com.deepansh.gateway.transport.RestClientProviderTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.util.Map;

/**
 * Wires the gateway from {@link GatewayProperties}: one adapter per configured
 * provider, the retrying transport, and the tool registry fed by every
 * {@link GatewayTool} bean in the context.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class GatewayConfig {

    private final GatewayProperties properties;

    @PostConstruct
    public void logConfiguredProviders() {
        log.info("================================================================");
        log.info("  Providers           : {}", properties.getProviders().keySet());
        log.info("  Max tool iterations : {}", properties.getMaxToolIterations());
        log.info("  Tool timeout        : {}ms", properties.getTools().getTimeoutMs());
        for (Map.Entry<String, ProviderSettings> entry : properties.getProviders().entrySet()) {
            logKey(entry.getKey(), entry.getValue());
        }
        log.info("================================================================");
    }

    @Bean
    public ProviderAdapterRegistry providerAdapterRegistry(ObjectMapper objectMapper) {
        return ProviderAdapterRegistry.fromSettings(properties.getProviders(), objectMapper);
    }

    @Bean
    public ProviderTransport providerTransport(RestClient providerRestClient, ObjectMapper objectMapper,
                                               ObjectProvider<RetryRegistry> retryRegistry) {
        GatewayProperties.Retry retry = properties.getRetry();
        return new RetryingProviderTransport(
                new RestClientProviderTransport(providerRestClient, objectMapper),
                RetryingProviderTransport.createRetry(
                        retryRegistry.getIfAvailable(RetryRegistry::ofDefaults),
                        retry.getMaxAttempts(), retry.getInitialIntervalMs(), retry.getMultiplier()));
    }

    @Bean
    public ToolRegistry toolRegistry(ObjectProvider<GatewayTool> tools) {
        return new ToolRegistry(tools.orderedStream().toList(), properties.getTools().getDefaultConcurrencyLimit());
    }

    @Bean
    public ToolExecutor toolExecutor(ToolRegistry toolRegistry,
                                     @Qualifier("toolTaskExecutor") ThreadPoolTaskExecutor toolTaskExecutor) {
        return new ToolExecutor(toolRegistry, toolTaskExecutor.getThreadPoolExecutor(),
                properties.getTools().getTimeoutMs());
    }

    @Bean
    public Gateway gateway(ProviderAdapterRegistry adapters, ProviderTransport providerTransport,
                           ToolRegistry toolRegistry, ToolExecutor toolExecutor, ObjectMapper objectMapper) {
        return new Gateway(adapters, providerTransport, toolRegistry, toolExecutor, objectMapper,
                properties.getMaxToolIterations());
    }

    private void logKey(String providerId, ProviderSettings settings) {
        String key = settings.getApiKey();
        if (!settings.hasApiKey()) {
            log.warn("  {} API key not set", providerId);
        } else {
            log.info("  {} key: {}...{}", providerId, key.substring(0, Math.min(4, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}

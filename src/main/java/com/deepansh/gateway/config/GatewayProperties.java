package com.deepansh.gateway.config;

import com.deepansh.gateway.provider.ProviderSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Strongly-typed configuration for the gateway.
 * Bound from application.yml under the "gateway" prefix.
 */
@ConfigurationProperties(prefix = "gateway")
@Validated
@Data
public class GatewayProperties {

    /** Model turns that may end in tool calls before the exchange fails. */
    @Positive
    private int maxToolIterations = 10;

    @Valid
    @NotNull
    private Tools tools = new Tools();

    @Valid
    @NotNull
    private Retry retry = new Retry();

    @Valid
    @NotNull
    private Http http = new Http();

    /** Keyed by provider id, the part before ':' in "provider:model". */
    @NotNull
    private Map<String, ProviderSettings> providers = new LinkedHashMap<>();

    @Data
    public static class Tools {
        @Positive
        private long timeoutMs = 30_000;
        @Positive
        private int defaultConcurrencyLimit = 5;
        @Valid
        @NotNull
        private Pool pool = new Pool();

        @Data
        public static class Pool {
            @Positive
            private int coreSize = 4;
            @Positive
            private int maxSize = 16;
            @PositiveOrZero
            private int queueCapacity = 100;
        }
    }

    @Data
    public static class Retry {
        /** Total attempts including the first call. */
        @Min(1)
        private int maxAttempts = 3;
        @Positive
        private long initialIntervalMs = 500;
        @DecimalMin("1.0")
        private double multiplier = 2.0;
    }

    @Data
    public static class Http {
        @Positive
        private int connectTimeoutMs = 5_000;
        /** Max silence between bytes; streams may run far longer in total. */
        @Positive
        private int readTimeoutMs = 120_000;
        @Positive
        private int maxConnections = 50;
    }
}

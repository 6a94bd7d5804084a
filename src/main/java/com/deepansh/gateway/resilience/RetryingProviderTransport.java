package com.deepansh.gateway.resilience;

import com.deepansh.gateway.exception.GatewayException;
import com.deepansh.gateway.provider.ProviderRequest;
import com.deepansh.gateway.transport.ProviderStream;
import com.deepansh.gateway.transport.ProviderTransport;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Decorator around a {@link ProviderTransport} that retries retryable failures
 * (transport errors: network, 429, 5xx) with exponential backoff.
 *
 * Only the opening of a call is wrapped. Once a stream is handed out, partial
 * content may already have reached the caller, so a failure after that point
 * is never retried here.
 */
@Slf4j
public class RetryingProviderTransport implements ProviderTransport {

    public static final String RETRY_NAME = "providerTransport";

    private final ProviderTransport delegate;
    private final Retry retry;

    public RetryingProviderTransport(ProviderTransport delegate, Retry retry) {
        this.delegate = delegate;
        this.retry = retry;
        this.retry.getEventPublisher()
                .onRetry(event -> log.warn("Provider call attempt {} failed, retrying in {}ms: {}",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"))
                .onError(event -> log.error("Provider call failed after {} attempt(s): {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    /** Registers (or reuses) the named retry with the given policy. */
    public static Retry createRetry(RetryRegistry registry, int maxAttempts, long initialIntervalMs, double multiplier) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(initialIntervalMs), multiplier))
                .retryOnException(RetryingProviderTransport::isRetryable)
                .build();
        return registry.retry(RETRY_NAME, config);
    }

    static boolean isRetryable(Throwable throwable) {
        return throwable instanceof GatewayException ge && ge.getClassification().isRetryable();
    }

    @Override
    public byte[] send(ProviderRequest request) {
        return retry.executeSupplier(() -> delegate.send(request));
    }

    @Override
    public ProviderStream openStream(ProviderRequest request) {
        return retry.executeSupplier(() -> delegate.openStream(request));
    }
}

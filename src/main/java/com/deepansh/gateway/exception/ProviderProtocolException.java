package com.deepansh.gateway.exception;

import lombok.Getter;

/**
 * The provider answered with something we cannot use: an error payload, an
 * unexpected shape, a non-retryable 4xx. Keeps the provider's own status and
 * error code so callers can tell "invalid_api_key" from "context_length_exceeded".
 */
@Getter
public class ProviderProtocolException extends GatewayException {

    private final String provider;
    private final int statusCode;
    private final String providerErrorCode;

    public ProviderProtocolException(String provider, String message) {
        this(provider, message, 0, null, null);
    }

    public ProviderProtocolException(String provider, String message, Throwable cause) {
        this(provider, message, 0, null, cause);
    }

    public ProviderProtocolException(String provider, String message, int statusCode, String providerErrorCode) {
        this(provider, message, statusCode, providerErrorCode, null);
    }

    public ProviderProtocolException(String provider, String message, int statusCode,
                                     String providerErrorCode, Throwable cause) {
        super(provider + ": " + message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
        this.providerErrorCode = providerErrorCode;
    }

    @Override
    public ErrorClassification getClassification() {
        return ErrorClassification.PROVIDER_PROTOCOL_ERROR;
    }
}

package com.deepansh.gateway.exception;

/** Bad request options, invalid conversation or bad registration. Fatal, never retried. */
public class ConfigurationException extends GatewayException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorClassification getClassification() {
        return ErrorClassification.CONFIGURATION_ERROR;
    }
}

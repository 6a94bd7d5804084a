package com.deepansh.gateway.model;

import com.deepansh.gateway.exception.ConfigurationException;

/** Which provider adapter to use and which of its models to ask. */
public record ModelSelection(String provider, String model) {

    /** Parses {@code "provider:model"}, e.g. {@code "anthropic:claude-3-5-sonnet-latest"}. */
    public static ModelSelection parse(String value) {
        if (value == null || !value.contains(":")) {
            throw new ConfigurationException("Model must be given as provider:model, got '" + value + "'");
        }
        int sep = value.indexOf(':');
        String provider = value.substring(0, sep).trim();
        String model = value.substring(sep + 1).trim();
        if (provider.isEmpty() || model.isEmpty()) {
            throw new ConfigurationException("Model must be given as provider:model, got '" + value + "'");
        }
        return new ModelSelection(provider, model);
    }

    @Override
    public String toString() {
        return provider + ":" + model;
    }
}

package com.deepansh.gateway.provider;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/** Immutable, fully-built provider call. Built fresh for every model turn. */
@Value
@Builder
public class ProviderRequest {

    String provider;
    String model;
    String url;

    @Singular
    Map<String, String> headers;

    Map<String, Object> body;

    boolean stream;
}

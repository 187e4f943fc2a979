package com.flagship.prior_auth.integration;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * One outbound wire message and the HTTP envelope it travels in.
 */
@Value
@Builder
public class WireRequest {
    String url;
    String contentType;
    String body;
    @Singular
    Map<String, String> headers;
}

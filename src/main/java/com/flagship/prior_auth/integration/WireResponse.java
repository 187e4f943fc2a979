package com.flagship.prior_auth.integration;

import lombok.Value;

@Value
public class WireResponse {
    int statusCode;
    String body;
}

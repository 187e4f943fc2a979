package com.flagship.prior_auth.integration.idempotency;

import lombok.Value;

import java.util.UUID;

/**
 * Idempotency key handed to a gateway for one submission attempt.
 * {@code reused} is true when an earlier attempt with this key may have reached the remote.
 */
@Value
public class SubmissionKey {
    UUID idempotencyKey;
    UUID authorizationId;
    String upstream;
    int attemptNonce;
    boolean reused;

    public String asHeaderValue() {
        return idempotencyKey.toString();
    }
}

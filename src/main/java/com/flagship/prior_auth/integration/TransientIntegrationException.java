package com.flagship.prior_auth.integration;

/**
 * A failure worth retrying: connection refused, I/O error, remote 5xx or throttling.
 *
 * {@code ambiguous} marks failures where the request may already have reached the
 * remote side (read timeouts), so a later attempt has to carry the same idempotency key.
 */
public class TransientIntegrationException extends RuntimeException {

    private final boolean ambiguous;

    public TransientIntegrationException(String message, boolean ambiguous) {
        super(message);
        this.ambiguous = ambiguous;
    }

    public TransientIntegrationException(String message, boolean ambiguous, Throwable cause) {
        super(message, cause);
        this.ambiguous = ambiguous;
    }

    public boolean isAmbiguous() {
        return ambiguous;
    }
}

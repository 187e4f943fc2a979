package com.flagship.prior_auth.error;

/**
 * The last attempt timed out and the remote side may or may not have applied the
 * request. The next attempt for the same submission reuses the idempotency key.
 */
public class AmbiguousFailureException extends PriorAuthException {

    private final String upstream;

    public AmbiguousFailureException(String upstream, String message, Throwable cause) {
        super(message, RetryGuidance.RETRY_LATER, cause);
        this.upstream = upstream;
    }

    public String getUpstream() {
        return upstream;
    }
}

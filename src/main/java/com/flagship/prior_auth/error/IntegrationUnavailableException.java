package com.flagship.prior_auth.error;

import java.time.Duration;

/**
 * An upstream could not be reached: circuit open, worker pool saturated, retries
 * exhausted, deadline elapsed or the caller cancelled. Retry later.
 */
public class IntegrationUnavailableException extends PriorAuthException {

    private final String upstream;
    private final Duration retryAfter;

    public IntegrationUnavailableException(String upstream, String message, Duration retryAfter) {
        super(message, RetryGuidance.RETRY_LATER);
        this.upstream = upstream;
        this.retryAfter = retryAfter;
    }

    public IntegrationUnavailableException(String upstream, String message, Duration retryAfter, Throwable cause) {
        super(message, RetryGuidance.RETRY_LATER, cause);
        this.upstream = upstream;
        this.retryAfter = retryAfter;
    }

    public String getUpstream() {
        return upstream;
    }

    /**
     * Suggested wait before retrying, or null when there is no better guess than "later".
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}

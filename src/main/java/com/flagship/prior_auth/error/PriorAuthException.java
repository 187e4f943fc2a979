package com.flagship.prior_auth.error;

import com.flagship.prior_auth.authorization.AuthorizationStatus;

/**
 * Base type for every error the prior authorization core surfaces to callers.
 *
 * Each subtype fixes its {@link RetryGuidance}. When the error aborts a transition,
 * the state machine attaches the authorization's unchanged status so the caller can
 * decide what to do without an extra read.
 */
public abstract class PriorAuthException extends RuntimeException {

    private final RetryGuidance retryGuidance;
    private AuthorizationStatus currentStatus;

    protected PriorAuthException(String message, RetryGuidance retryGuidance) {
        super(message);
        this.retryGuidance = retryGuidance;
    }

    protected PriorAuthException(String message, RetryGuidance retryGuidance, Throwable cause) {
        super(message, cause);
        this.retryGuidance = retryGuidance;
    }

    public RetryGuidance getRetryGuidance() {
        return retryGuidance;
    }

    public AuthorizationStatus getCurrentStatus() {
        return currentStatus;
    }

    /**
     * Records the status the authorization still has after the failed operation.
     * The first recorded status wins.
     */
    public PriorAuthException withCurrentStatus(AuthorizationStatus status) {
        if (this.currentStatus == null) {
            this.currentStatus = status;
        }
        return this;
    }
}

package com.flagship.prior_auth.error;

import com.flagship.prior_auth.authorization.AuthorizationStatus;

import java.util.UUID;

/**
 * The caller stopped waiting for a transition before it finished. The gateway call is
 * cancelled, but a save already under way may still commit, so the caller has to
 * re-read the authorization before retrying.
 */
public class TransitionTimeoutException extends PriorAuthException {

    private final UUID authorizationId;
    private final AuthorizationStatus targetStatus;

    public TransitionTimeoutException(UUID authorizationId, AuthorizationStatus targetStatus, String message) {
        super(message, RetryGuidance.REFETCH_AND_RETRY);
        this.authorizationId = authorizationId;
        this.targetStatus = targetStatus;
    }

    public UUID getAuthorizationId() {
        return authorizationId;
    }

    public AuthorizationStatus getTargetStatus() {
        return targetStatus;
    }
}

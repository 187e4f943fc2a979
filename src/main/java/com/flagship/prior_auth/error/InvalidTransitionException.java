package com.flagship.prior_auth.error;

import com.flagship.prior_auth.authorization.AuthorizationStatus;

import java.util.UUID;

/**
 * The requested edge is not in the transition table for the current status.
 */
public class InvalidTransitionException extends PriorAuthException {

    private final UUID authorizationId;
    private final AuthorizationStatus fromStatus;
    private final AuthorizationStatus targetStatus;

    public InvalidTransitionException(UUID authorizationId, AuthorizationStatus fromStatus,
                                      AuthorizationStatus targetStatus) {
        super(String.format("Cannot transition authorization %s from %s to %s",
                authorizationId, fromStatus, targetStatus), RetryGuidance.DO_NOT_RETRY);
        this.authorizationId = authorizationId;
        this.fromStatus = fromStatus;
        this.targetStatus = targetStatus;
        withCurrentStatus(fromStatus);
    }

    public UUID getAuthorizationId() {
        return authorizationId;
    }

    public AuthorizationStatus getFromStatus() {
        return fromStatus;
    }

    public AuthorizationStatus getTargetStatus() {
        return targetStatus;
    }
}

package com.flagship.prior_auth.error;

import java.util.UUID;

/**
 * Another transition on the same authorization is in flight or has already committed
 * from the state this request started from. Re-read the authorization and retry.
 */
public class ConcurrentUpdateException extends PriorAuthException {

    private final UUID authorizationId;

    public ConcurrentUpdateException(UUID authorizationId, String message) {
        super(message, RetryGuidance.REFETCH_AND_RETRY);
        this.authorizationId = authorizationId;
    }

    public ConcurrentUpdateException(UUID authorizationId, String message, Throwable cause) {
        super(message, RetryGuidance.REFETCH_AND_RETRY, cause);
        this.authorizationId = authorizationId;
    }

    public UUID getAuthorizationId() {
        return authorizationId;
    }
}

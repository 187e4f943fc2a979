package com.flagship.prior_auth.error;

import java.util.UUID;

public class AuthorizationNotFoundException extends PriorAuthException {

    private final UUID authorizationId;

    public AuthorizationNotFoundException(UUID authorizationId) {
        super("Authorization not found: " + authorizationId, RetryGuidance.DO_NOT_RETRY);
        this.authorizationId = authorizationId;
    }

    public UUID getAuthorizationId() {
        return authorizationId;
    }
}

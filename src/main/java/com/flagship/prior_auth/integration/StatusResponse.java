package com.flagship.prior_auth.integration;

import com.flagship.prior_auth.authorization.AuthorizationStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Remote view of an authorization's status, mapped onto the local lifecycle.
 * Transient: merged into the authorization's audit data, never persisted on its own.
 */
@Value
@Builder
public class StatusResponse {
    String externalReferenceId;
    String remoteStatusCode;
    AuthorizationStatus mappedStatus;
    boolean recognized;
    String notes;
    String rawEvidence;
}

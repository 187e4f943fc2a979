package com.flagship.prior_auth.integration;

import com.flagship.prior_auth.authorization.AuthorizationStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Acknowledgement of a submitted authorization request.
 *
 * {@code initialDecision} is set only when the remote decided on receipt (approved or
 * denied); a pended request leaves it null and is tracked through status inquiries.
 */
@Value
@Builder
public class SubmissionResponse {
    String externalReferenceId;
    String remoteStatusCode;
    AuthorizationStatus initialDecision;
    String rawEvidence;
}

package com.flagship.prior_auth.integration.pharmacy;

import com.flagship.prior_auth.authorization.Authorization;
import com.flagship.prior_auth.integration.idempotency.SubmissionKey;
import lombok.Value;

@Value
public class PharmacySubmission {
    Authorization authorization;
    SubmissionKey idempotencyKey;
}

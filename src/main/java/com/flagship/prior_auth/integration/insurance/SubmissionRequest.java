package com.flagship.prior_auth.integration.insurance;

import com.flagship.prior_auth.authorization.ClinicalInfo;
import com.flagship.prior_auth.authorization.MedicationInfo;
import com.flagship.prior_auth.authorization.PatientInfo;
import com.flagship.prior_auth.integration.idempotency.SubmissionKey;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class SubmissionRequest {
    UUID authorizationId;
    PatientInfo patient;
    MedicationInfo medication;
    ClinicalInfo clinical;
    SubmissionKey idempotencyKey;
}

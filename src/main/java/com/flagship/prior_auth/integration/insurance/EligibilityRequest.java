package com.flagship.prior_auth.integration.insurance;

import com.flagship.prior_auth.authorization.MedicationInfo;
import com.flagship.prior_auth.authorization.PatientInfo;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class EligibilityRequest {
    UUID authorizationId;
    PatientInfo patient;
    MedicationInfo medication;
}

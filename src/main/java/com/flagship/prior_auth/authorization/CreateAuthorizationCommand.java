package com.flagship.prior_auth.authorization;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Input for creating an authorization. Structural validation happens in
 * {@link AuthorizationStateMachine#createAuthorization}.
 */
@Value
@Builder
public class CreateAuthorizationCommand {
    PatientInfo patient;
    MedicationInfo medication;
    ClinicalInfo clinical;
    List<DocumentReference> documents;
    String assignedTo;
}

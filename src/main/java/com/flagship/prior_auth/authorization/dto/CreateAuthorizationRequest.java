package com.flagship.prior_auth.authorization.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.prior_auth.authorization.ClinicalInfo;
import com.flagship.prior_auth.authorization.CreateAuthorizationCommand;
import com.flagship.prior_auth.authorization.DocumentReference;
import com.flagship.prior_auth.authorization.MedicationInfo;
import com.flagship.prior_auth.authorization.PatientInfo;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Request DTO for creating an authorization.
 */
@Value
@Builder
@Jacksonized
public class CreateAuthorizationRequest {

    @NotNull(message = "Patient is required")
    @JsonProperty("patient")
    PatientInfo patient;

    @NotNull(message = "Medication is required")
    @JsonProperty("medication")
    MedicationInfo medication;

    @JsonProperty("clinical")
    ClinicalInfo clinical;

    @JsonProperty("documents")
    List<DocumentReference> documents;

    @JsonProperty("assigned_to")
    String assignedTo;

    public CreateAuthorizationCommand toCommand() {
        return CreateAuthorizationCommand.builder()
                .patient(patient)
                .medication(medication)
                .clinical(clinical)
                .documents(documents)
                .assignedTo(assignedTo)
                .build();
    }
}

package com.flagship.prior_auth.authorization.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.prior_auth.authorization.Authorization;
import com.flagship.prior_auth.authorization.AuthorizationStatus;
import com.flagship.prior_auth.authorization.ClinicalInfo;
import com.flagship.prior_auth.authorization.DocumentReference;
import com.flagship.prior_auth.authorization.MedicationInfo;
import com.flagship.prior_auth.authorization.PatientInfo;
import com.flagship.prior_auth.authorization.StatusChange;
import com.flagship.prior_auth.authorization.StatusTransitions;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Response DTO for authorization operations.
 */
@Value
@Builder
public class AuthorizationResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("status")
    AuthorizationStatus status;

    @JsonProperty("allowed_transitions")
    Set<AuthorizationStatus> allowedTransitions;

    @JsonProperty("patient")
    PatientInfo patient;

    @JsonProperty("medication")
    MedicationInfo medication;

    @JsonProperty("clinical")
    ClinicalInfo clinical;

    @JsonProperty("documents")
    List<DocumentReference> documents;

    @JsonProperty("status_history")
    List<StatusChange> statusHistory;

    @JsonProperty("workflow_events")
    List<String> workflowEvents;

    @JsonProperty("metadata")
    Map<String, String> metadata;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("assigned_to")
    String assignedTo;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("version")
    Long version;

    public static AuthorizationResponse from(Authorization authorization) {
        return AuthorizationResponse.builder()
            .id(authorization.getId())
            .status(authorization.getStatus())
            .allowedTransitions(StatusTransitions.allowedFrom(authorization.getStatus()))
            .patient(authorization.getPatient())
            .medication(authorization.getMedication())
            .clinical(authorization.getClinical())
            .documents(authorization.getDocuments())
            .statusHistory(authorization.getStatusHistory())
            .workflowEvents(authorization.getAudit().getWorkflowEvents())
            .metadata(authorization.getAudit().getMetadata())
            .createdBy(authorization.getCreatedBy())
            .assignedTo(authorization.getAssignedTo())
            .createdAt(authorization.getCreatedAt())
            .updatedAt(authorization.getUpdatedAt())
            .version(authorization.getVersion())
            .build();
    }
}

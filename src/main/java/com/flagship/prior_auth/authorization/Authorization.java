package com.flagship.prior_auth.authorization;

import com.flagship.prior_auth.error.InvalidTransitionException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Prior authorization domain object.
 *
 * Key principles:
 * - Immutable: every change produces a new instance
 * - {@code status} always equals the {@code toStatus} of the last history entry; the only
 *   way to change it is {@link #transitionTo}, which appends that entry
 * - The creation entry {@code {from: null, to: DRAFT}} makes the rule hold from birth
 * - {@code version} is the persistence version this instance was read at, null until first saved
 */
@Value
@Builder(toBuilder = true)
public class Authorization {
    UUID id;
    PatientInfo patient;
    MedicationInfo medication;
    ClinicalInfo clinical;
    AuthorizationStatus status;
    List<DocumentReference> documents;
    AuthorizationAudit audit;
    String createdBy;
    String assignedTo;
    Instant createdAt;
    Instant updatedAt;
    Long version;

    public static final String CREATION_REASON = "Authorization created";

    /**
     * Creates a new Authorization in DRAFT status with its creation history entry.
     */
    public static Authorization create(UUID id, PatientInfo patient, MedicationInfo medication,
                                       ClinicalInfo clinical, List<DocumentReference> documents,
                                       String createdBy, String assignedTo) {
        Instant now = Instant.now();
        StatusChange creation = StatusChange.builder()
                .sequenceNumber(1)
                .fromStatus(null)
                .toStatus(AuthorizationStatus.DRAFT)
                .changedBy(createdBy)
                .reason(CREATION_REASON)
                .changedAt(now)
                .build();
        AuthorizationAudit audit = new AuthorizationAudit(List.of(creation),
                List.of("Created by " + createdBy), Map.of());
        return new Authorization(
            id,
            patient,
            medication,
            clinical,
            AuthorizationStatus.DRAFT,
            documents == null ? List.of() : List.copyOf(documents),
            audit,
            createdBy,
            assignedTo,
            now,
            now,
            null
        );
    }

    /**
     * Moves to {@code target}, appending the history entry and merging gateway results.
     *
     * @param metadata entries merged into audit metadata (gateway results)
     * @param workflowEvents free-text markers appended to the workflow event log
     * @return New Authorization instance in {@code target} status
     * @throws InvalidTransitionException if the edge is not in {@link StatusTransitions}
     */
    public Authorization transitionTo(AuthorizationStatus target, String actor, String reason,
                                      Map<String, String> metadata, List<String> workflowEvents) {
        if (!StatusTransitions.isAllowed(this.status, target)) {
            throw new InvalidTransitionException(this.id, this.status, target);
        }
        Instant now = Instant.now();
        StatusChange change = StatusChange.builder()
                .sequenceNumber(audit.nextSequenceNumber())
                .fromStatus(this.status)
                .toStatus(target)
                .changedBy(actor)
                .reason(reason)
                .changedAt(now)
                .build();
        return this.toBuilder()
                .status(target)
                .audit(audit.append(change, workflowEvents, metadata))
                .updatedAt(now)
                .build();
    }

    public boolean canTransitionTo(AuthorizationStatus target) {
        return StatusTransitions.isAllowed(this.status, target);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public List<StatusChange> getStatusHistory() {
        return audit.getStatusHistory();
    }

    /**
     * Metadata value merged in by an earlier gateway call, or null.
     */
    public String metadata(String key) {
        return audit.getMetadata().get(key);
    }
}

package com.flagship.prior_auth.authorization;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for authorization persistence.
 *
 * Key design principles:
 * - No setters: state only changes through {@link #updateFromDomain}
 * - Nested request data is stored as JSON documents; the status history is not stored
 *   here but in the append-only status_changes table owned by the audit trail
 * - {@code status} is a denormalized read copy of the last history entry
 * - {@code @Version} turns a concurrent commit into an optimistic locking failure
 */
@Entity
@Table(
    name = "authorizations",
    indexes = {
        @Index(name = "idx_authorizations_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuthorizationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private AuthorizationStatus status;

    @Column(name = "patient_info", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String patientInfo;

    @Column(name = "medication_info", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String medicationInfo;

    @Column(name = "clinical_info", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String clinicalInfo;

    @Column(name = "documents", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String documents;

    @Column(name = "workflow_events", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String workflowEvents;

    @Column(name = "metadata", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String metadata;

    @Column(name = "created_by", nullable = false, updatable = false, length = 128)
    private String createdBy;

    @Column(name = "assigned_to", length = 128)
    private String assignedTo;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Controlled factory. JSON columns are rendered by the caller so the entity stays
     * free of serialization concerns.
     */
    static AuthorizationEntity fromDomain(Authorization authorization, AuthorizationDocuments json) {
        return new AuthorizationEntity(
            authorization.getId(),
            authorization.getStatus(),
            json.getPatientInfo(),
            json.getMedicationInfo(),
            json.getClinicalInfo(),
            json.getDocuments(),
            json.getWorkflowEvents(),
            json.getMetadata(),
            authorization.getCreatedBy(),
            authorization.getAssignedTo(),
            authorization.getCreatedAt(),
            null, // set by @PrePersist
            null  // assigned by JPA on persist
        );
    }

    /**
     * Updates the mutable columns. Identity, creator and creation time never change.
     */
    void updateFromDomain(Authorization authorization, AuthorizationDocuments json) {
        this.status = authorization.getStatus();
        this.clinicalInfo = json.getClinicalInfo();
        this.documents = json.getDocuments();
        this.workflowEvents = json.getWorkflowEvents();
        this.metadata = json.getMetadata();
        this.assignedTo = authorization.getAssignedTo();
    }
}

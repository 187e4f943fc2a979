package com.flagship.prior_auth.integration.idempotency;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One outbound submission attempt series. The key is reused until the upstream
 * confirms the submission; a confirmed record is never handed out again.
 */
@Entity
@Table(
    name = "idempotency_records",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_idempotency_attempt",
        columnNames = {"authorization_id", "upstream", "attempt_nonce"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class IdempotencyRecordEntity {

    @Id
    @Column(name = "idempotency_key", nullable = false, updatable = false)
    private UUID idempotencyKey;

    @Column(name = "authorization_id", nullable = false, updatable = false)
    private UUID authorizationId;

    @Column(name = "upstream", nullable = false, updatable = false, length = 64)
    private String upstream;

    @Column(name = "attempt_nonce", nullable = false, updatable = false)
    private int attemptNonce;

    @Column(name = "last_attempt_at")
    private Instant lastAttemptAt;

    @Column(name = "confirmed_at")
    private Instant confirmedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    static IdempotencyRecordEntity pending(UUID idempotencyKey, UUID authorizationId,
                                           String upstream, int attemptNonce) {
        IdempotencyRecordEntity entity = new IdempotencyRecordEntity();
        entity.idempotencyKey = idempotencyKey;
        entity.authorizationId = authorizationId;
        entity.upstream = upstream;
        entity.attemptNonce = attemptNonce;
        entity.lastAttemptAt = Instant.now();
        return entity;
    }

    void markAttempted() {
        this.lastAttemptAt = Instant.now();
    }

    void markConfirmed() {
        this.confirmedAt = Instant.now();
    }

    public boolean isConfirmed() {
        return confirmedAt != null;
    }
}

package com.flagship.prior_auth.integration.idempotency;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface IdempotencyRecordRepository extends JpaRepository<IdempotencyRecordEntity, UUID> {

    Optional<IdempotencyRecordEntity> findFirstByAuthorizationIdAndUpstreamAndConfirmedAtIsNullOrderByAttemptNonceDesc(
        UUID authorizationId, String upstream);

    @Query("""
        SELECT MAX(r.attemptNonce) FROM IdempotencyRecordEntity r
        WHERE r.authorizationId = :authorizationId AND r.upstream = :upstream
        """)
    Optional<Integer> findHighestNonce(@Param("authorizationId") UUID authorizationId,
                                       @Param("upstream") String upstream);

    /**
     * Stamps a new attempt on a still-pending key.
     *
     * @return 0 if the key is unknown or already confirmed
     */
    @Modifying
    @Query("""
        UPDATE IdempotencyRecordEntity r SET r.lastAttemptAt = :now
        WHERE r.idempotencyKey = :key AND r.confirmedAt IS NULL
        """)
    int touchPending(@Param("key") UUID key, @Param("now") Instant now);
}

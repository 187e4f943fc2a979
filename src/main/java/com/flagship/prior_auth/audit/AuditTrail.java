package com.flagship.prior_auth.audit;

import com.flagship.prior_auth.authorization.AuthorizationStatus;
import com.flagship.prior_auth.authorization.StatusChange;
import com.flagship.prior_auth.error.ConcurrentUpdateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only ledger of status transitions, the record of truth for current status.
 *
 * Invariants:
 * 1. Entries are never updated or deleted (a database trigger rejects both)
 * 2. (authorization_id, sequence_number) is the primary key, so two writers that
 *    started from the same history cannot both append the next entry
 * 3. Appends only happen inside the caller's transaction, together with the
 *    authorization's status field
 *
 * Plain JDBC; the append-only constraints live in the database.
 */
@Service
@Slf4j
public class AuditTrail {

    private final JdbcTemplate jdbcTemplate;

    public AuditTrail(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Appends one entry. Must run inside the transaction that updates the status field.
     *
     * @throws ConcurrentUpdateException if another writer already appended this sequence number
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void append(UUID authorizationId, StatusChange change) {
        try {
            jdbcTemplate.update(
                "INSERT INTO status_changes " +
                "(authorization_id, sequence_number, from_status, to_status, changed_by, reason, changed_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?)",
                authorizationId,
                change.getSequenceNumber(),
                change.getFromStatus() != null ? change.getFromStatus().name() : null,
                change.getToStatus().name(),
                change.getChangedBy(),
                change.getReason(),
                Timestamp.from(change.getChangedAt())
            );
        } catch (DuplicateKeyException e) {
            throw new ConcurrentUpdateException(authorizationId,
                "History entry " + change.getSequenceNumber() + " for authorization " + authorizationId +
                " was written concurrently", e);
        }
        log.debug("Appended status change #{} {} -> {} for authorization {}",
                change.getSequenceNumber(), change.getFromStatus(), change.getToStatus(), authorizationId);
    }

    /**
     * Full history in insertion order.
     */
    @Transactional(readOnly = true)
    public List<StatusChange> history(UUID authorizationId) {
        return jdbcTemplate.query(
            "SELECT sequence_number, from_status, to_status, changed_by, reason, changed_at " +
            "FROM status_changes WHERE authorization_id = ? ORDER BY sequence_number",
            statusChangeRowMapper(),
            authorizationId
        );
    }

    /**
     * Current status derived from the last entry.
     */
    @Transactional(readOnly = true)
    public Optional<AuthorizationStatus> currentStatus(UUID authorizationId) {
        List<String> statuses = jdbcTemplate.queryForList(
            "SELECT to_status FROM status_changes WHERE authorization_id = ? " +
            "ORDER BY sequence_number DESC LIMIT 1",
            String.class,
            authorizationId
        );
        return statuses.stream().findFirst().map(AuthorizationStatus::valueOf);
    }

    /**
     * Highest sequence number written so far, 0 when there is no history.
     */
    @Transactional(readOnly = true)
    public long lastSequenceNumber(UUID authorizationId) {
        Long last = jdbcTemplate.queryForObject(
            "SELECT COALESCE(MAX(sequence_number), 0) FROM status_changes WHERE authorization_id = ?",
            Long.class,
            authorizationId
        );
        return last != null ? last : 0L;
    }

    private RowMapper<StatusChange> statusChangeRowMapper() {
        return (rs, rowNum) -> {
            String from = rs.getString("from_status");
            return StatusChange.builder()
                .sequenceNumber(rs.getLong("sequence_number"))
                .fromStatus(from != null ? AuthorizationStatus.valueOf(from) : null)
                .toStatus(AuthorizationStatus.valueOf(rs.getString("to_status")))
                .changedBy(rs.getString("changed_by"))
                .reason(rs.getString("reason"))
                .changedAt(rs.getTimestamp("changed_at").toInstant())
                .build();
        };
    }
}

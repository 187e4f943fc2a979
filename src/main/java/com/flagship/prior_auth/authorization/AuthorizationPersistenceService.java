package com.flagship.prior_auth.authorization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.prior_auth.audit.AuditTrail;
import com.flagship.prior_auth.error.ConcurrentUpdateException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed {@link AuthorizationStore}.
 *
 * A save is a single transaction that:
 * 1. Checks the caller's version against the stored row
 * 2. Updates the authorization row (JPA {@code @Version} guards the write itself)
 * 3. Appends the history entries the stored ledger does not have yet
 *
 * If any step fails, nothing is written, so the status column and the ledger cannot
 * disagree. On load the status is taken from the ledger; a differing column is logged
 * and ignored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthorizationPersistenceService implements AuthorizationStore {

    private static final TypeReference<List<DocumentReference>> DOCUMENT_LIST = new TypeReference<>() { };
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() { };
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() { };

    private final AuthorizationRepository repository;
    private final AuditTrail auditTrail;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<Authorization> load(UUID id) {
        return repository.findById(id).map(this::toDomain);
    }

    @Override
    @Transactional
    public Authorization save(Authorization authorization) {
        UUID id = authorization.getId();
        List<StatusChange> history = authorization.getStatusHistory();
        if (history.isEmpty() || history.get(history.size() - 1).getToStatus() != authorization.getStatus()) {
            throw new IllegalStateException("Authorization " + id + " status does not match its last history entry");
        }

        AuthorizationDocuments json = toDocuments(authorization);
        AuthorizationEntity entity;
        long persistedSequence;

        if (authorization.getVersion() == null) {
            if (repository.existsById(id)) {
                throw new ConcurrentUpdateException(id, "Authorization " + id + " already exists");
            }
            entity = AuthorizationEntity.fromDomain(authorization, json);
            persistedSequence = 0;
        } else {
            entity = repository.findById(id)
                .orElseThrow(() -> new ConcurrentUpdateException(id, "Authorization " + id + " no longer exists"));
            if (!Objects.equals(entity.getVersion(), authorization.getVersion())) {
                throw new ConcurrentUpdateException(id, String.format(
                    "Authorization %s was modified concurrently (expected version %d, found %d)",
                    id, authorization.getVersion(), entity.getVersion()));
            }
            entity.updateFromDomain(authorization, json);
            persistedSequence = auditTrail.lastSequenceNumber(id);
        }

        AuthorizationEntity saved;
        try {
            saved = repository.saveAndFlush(entity);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new ConcurrentUpdateException(id, "Authorization " + id + " was modified concurrently", e);
        }

        for (StatusChange change : history) {
            if (change.getSequenceNumber() > persistedSequence) {
                auditTrail.append(id, change);
            }
        }

        log.debug("Saved authorization {} status={} version={}", id, saved.getStatus(), saved.getVersion());
        return authorization.toBuilder()
            .version(saved.getVersion())
            .createdAt(saved.getCreatedAt())
            .updatedAt(saved.getUpdatedAt())
            .build();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Authorization> findByStatus(AuthorizationStatus status) {
        return repository.findByStatusOrderByUpdatedAtAsc(status).stream()
            .map(this::toDomain)
            .toList();
    }

    private Authorization toDomain(AuthorizationEntity entity) {
        List<StatusChange> history = auditTrail.history(entity.getId());
        AuthorizationStatus status = entity.getStatus();
        if (!history.isEmpty()) {
            AuthorizationStatus recorded = history.get(history.size() - 1).getToStatus();
            if (recorded != status) {
                log.warn("Status column {} disagrees with audit trail {} for authorization {}; using audit trail",
                        status, recorded, entity.getId());
                status = recorded;
            }
        }
        AuthorizationAudit audit = new AuthorizationAudit(
            history,
            read(entity.getWorkflowEvents(), STRING_LIST),
            read(entity.getMetadata(), STRING_MAP));

        return Authorization.builder()
            .id(entity.getId())
            .patient(read(entity.getPatientInfo(), PatientInfo.class))
            .medication(read(entity.getMedicationInfo(), MedicationInfo.class))
            .clinical(entity.getClinicalInfo() != null ? read(entity.getClinicalInfo(), ClinicalInfo.class) : null)
            .status(status)
            .documents(read(entity.getDocuments(), DOCUMENT_LIST))
            .audit(audit)
            .createdBy(entity.getCreatedBy())
            .assignedTo(entity.getAssignedTo())
            .createdAt(entity.getCreatedAt())
            .updatedAt(entity.getUpdatedAt())
            .version(entity.getVersion())
            .build();
    }

    private AuthorizationDocuments toDocuments(Authorization authorization) {
        return new AuthorizationDocuments(
            write(authorization.getPatient()),
            write(authorization.getMedication()),
            authorization.getClinical() != null ? write(authorization.getClinical()) : null,
            write(authorization.getDocuments()),
            write(authorization.getAudit().getWorkflowEvents()),
            write(authorization.getAudit().getMetadata()));
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize authorization data", e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored authorization data is unreadable as " + type.getSimpleName(), e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored authorization data is unreadable", e);
        }
    }
}

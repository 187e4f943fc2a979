package com.flagship.prior_auth.authorization;

import com.flagship.prior_auth.error.AuthorizationNotFoundException;
import com.flagship.prior_auth.error.ConcurrentUpdateException;
import com.flagship.prior_auth.error.InvalidTransitionException;
import com.flagship.prior_auth.error.PriorAuthException;
import com.flagship.prior_auth.error.ValidationException;
import com.flagship.prior_auth.integration.StatusResponse;
import com.flagship.prior_auth.integration.resilience.CallDeadline;
import com.flagship.prior_auth.observability.CorrelationContext;
import com.flagship.prior_auth.observability.PriorAuthMetrics;
import com.flagship.prior_auth.publish.UpdateListener;
import com.flagship.prior_auth.publish.UpdatePublisher;
import com.flagship.prior_auth.publish.UpdateSubscription;
import com.flagship.prior_auth.publish.UpdateSubscriptionRegistry;
import com.flagship.prior_auth.publish.UpdateType;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Owns the authorization lifecycle.
 *
 * A transition runs in this order:
 * 1. Admission: one transition per authorization in this process
 * 2. Load the current state and check the edge against {@link StatusTransitions}
 * 3. Run the gateway action the target requires, outside any database transaction
 * 4. Append the history entry, set the status and merge gateway results, then save
 *    under the version check; status and history are written in one transaction
 * 5. Retire the submission idempotency key, if the gateway call used one
 * 6. Publish the update after the save has committed
 *
 * Any failure before step 4 completes leaves the stored authorization untouched, and
 * the error carries the status the authorization still has. A submission key stays
 * pending in that case, so the retried transition resubmits under the same key.
 */
@Service
@Slf4j
public class AuthorizationStateMachine {

    public static final String STATUS_POLLER_ACTOR = "system:status-poller";

    private final AuthorizationStore store;
    private final TransitionGatewayCoordinator gateways;
    private final TransitionLocks locks;
    private final UpdatePublisher updatePublisher;
    private final UpdateSubscriptionRegistry subscriptions;
    private final PriorAuthMetrics metrics;
    private final Duration defaultTimeout;

    public AuthorizationStateMachine(AuthorizationStore store,
                                     TransitionGatewayCoordinator gateways,
                                     TransitionLocks locks,
                                     UpdatePublisher updatePublisher,
                                     UpdateSubscriptionRegistry subscriptions,
                                     PriorAuthMetrics metrics,
                                     @Value("${prior-auth.transition.default-timeout:60s}") Duration defaultTimeout) {
        this.store = store;
        this.gateways = gateways;
        this.locks = locks;
        this.updatePublisher = updatePublisher;
        this.subscriptions = subscriptions;
        this.metrics = metrics;
        this.defaultTimeout = defaultTimeout;
    }

    /**
     * Creates an authorization in DRAFT with its creation history entry.
     *
     * @throws ValidationException if required patient or medication data is missing
     */
    public Authorization createAuthorization(CreateAuthorizationCommand command, String actor) {
        validateCreate(command, actor);

        Authorization authorization = Authorization.create(
                UUID.randomUUID(),
                command.getPatient(),
                command.getMedication(),
                command.getClinical(),
                command.getDocuments(),
                actor,
                command.getAssignedTo());

        MDC.put(CorrelationContext.AUTHORIZATION_ID_MDC_KEY, authorization.getId().toString());
        try {
            Authorization saved = store.save(authorization);
            metrics.incrementAuthorizationsCreated();
            log.info("Authorization created by {}", actor);

            updatePublisher.publish(saved.getId(), saved.getStatus(), UpdateType.CREATED,
                    Map.of("actor", actor));
            return saved;
        } finally {
            MDC.remove(CorrelationContext.AUTHORIZATION_ID_MDC_KEY);
        }
    }

    public Authorization getAuthorization(UUID id) {
        return store.load(id).orElseThrow(() -> new AuthorizationNotFoundException(id));
    }

    public List<Authorization> findByStatus(AuthorizationStatus status) {
        return store.findByStatus(status);
    }

    public Authorization requestTransition(UUID id, AuthorizationStatus target, String actor, String reason) {
        return requestTransition(id, target, actor, reason, CallDeadline.after(defaultTimeout));
    }

    /**
     * Moves the authorization to {@code target}, running the gateway action the target
     * requires first.
     *
     * @param deadline bounds the gateway call, retries included; cancelling it aborts the call
     * @throws InvalidTransitionException if the edge is not allowed
     * @throws ConcurrentUpdateException if another transition
     *         on the same authorization is running or committed first
     */
    public Authorization requestTransition(UUID id, AuthorizationStatus target, String actor, String reason,
                                           CallDeadline deadline) {
        return transition(id, target, actor, reason, deadline, Map.of(), List.of());
    }

    /**
     * Polls the remote status of an UNDER_REVIEW authorization and applies it when it
     * maps to a legal next status.
     */
    public StatusRefreshResult refreshExternalStatus(UUID id) {
        return refreshExternalStatus(id, CallDeadline.after(defaultTimeout));
    }

    public StatusRefreshResult refreshExternalStatus(UUID id, CallDeadline deadline) {
        MDC.put(CorrelationContext.AUTHORIZATION_ID_MDC_KEY, id.toString());
        try {
            Authorization current = getAuthorization(id);
            if (current.getStatus() != AuthorizationStatus.UNDER_REVIEW) {
                throw new ValidationException("Only UNDER_REVIEW authorizations have a remote status to poll")
                        .withCurrentStatus(current.getStatus());
            }

            StatusResponse remote;
            try {
                remote = gateways.refreshStatus(current, deadline);
            } catch (PriorAuthException e) {
                throw e.withCurrentStatus(current.getStatus());
            }

            AuthorizationStatus mapped = remote.getMappedStatus();
            if (mapped == current.getStatus() || !current.canTransitionTo(mapped)) {
                log.info("Remote status {} (mapped {}) leaves authorization in {}",
                        remote.getRemoteStatusCode(), mapped, current.getStatus());
                return StatusRefreshResult.builder()
                        .authorization(current)
                        .remoteStatus(remote)
                        .transitioned(false)
                        .build();
            }

            Map<String, String> observed = new LinkedHashMap<>();
            observed.put(TransitionGatewayCoordinator.REMOTE_STATUS_CODE, remote.getRemoteStatusCode());
            if (remote.getNotes() != null) {
                observed.put(TransitionGatewayCoordinator.REMOTE_STATUS_NOTES, remote.getNotes());
            }
            if (remote.getRawEvidence() != null) {
                observed.put(TransitionGatewayCoordinator.REMOTE_STATUS_EVIDENCE, remote.getRawEvidence());
            }
            String reason = "Remote status " + remote.getRemoteStatusCode()
                    + (remote.isRecognized() ? "" : " (unrecognized)");
            Authorization updated = transition(id, mapped, STATUS_POLLER_ACTOR, reason, deadline, observed,
                    List.of("Remote status " + remote.getRemoteStatusCode() + " received"));
            return StatusRefreshResult.builder()
                    .authorization(updated)
                    .remoteStatus(remote)
                    .transitioned(true)
                    .build();
        } finally {
            MDC.remove(CorrelationContext.AUTHORIZATION_ID_MDC_KEY);
        }
    }

    /**
     * Registers a live listener. The subscription ends when the caller closes it or
     * after the update that moves the authorization to APPROVED or CANCELLED.
     *
     * @param statusFilter statuses to deliver; empty or null delivers every update
     */
    public UpdateSubscription subscribeToUpdates(UUID id, Set<AuthorizationStatus> statusFilter,
                                                 UpdateListener listener) {
        getAuthorization(id);
        UpdateSubscription subscription = subscriptions.subscribe(id, statusFilter, listener);
        // Re-read after registering so a terminal update published in between is not missed.
        if (getAuthorization(id).isTerminal()) {
            subscription.close();
        }
        return subscription;
    }

    private Authorization transition(UUID id, AuthorizationStatus target, String actor, String reason,
                                     CallDeadline deadline, Map<String, String> observed,
                                     List<String> observedEvents) {
        if (id == null || target == null) {
            throw new ValidationException("Authorization id and target status are required");
        }
        if (actor == null || actor.isBlank()) {
            throw new ValidationException("Actor is required");
        }

        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.AUTHORIZATION_ID_MDC_KEY, id.toString());
        AuthorizationStatus current = null;

        try (TransitionLocks.Admission ignored = locks.admit(id)) {
            Authorization authorization = getAuthorization(id);
            current = authorization.getStatus();
            if (!authorization.canTransitionTo(target)) {
                throw new InvalidTransitionException(id, current, target);
            }

            log.info("Transition {} -> {} requested by {}", current, target, actor);
            GatewayOutcome outcome = gateways.confirm(authorization, target, deadline);

            Map<String, String> metadata = new LinkedHashMap<>(observed);
            metadata.putAll(outcome.getMetadata());
            List<String> events = new ArrayList<>(observedEvents);
            events.addAll(outcome.getWorkflowEvents());
            events.add(String.format("%s -> %s by %s", current, target, actor));

            Authorization saved = store.save(authorization.transitionTo(target, actor, reason, metadata, events));
            settleSubmission(outcome);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordTransition(current.name(), target.name(), "success");
            metrics.recordTransitionDuration(duration);
            log.info("Transition {} -> {} committed, duration={}ms", current, target, duration);

            publishStatusChanged(saved, current, actor, reason, outcome);
            return saved;

        } catch (PriorAuthException e) {
            long duration = System.currentTimeMillis() - startTime;
            // after a lost race the stored status may differ from the one read at the start
            AuthorizationStatus unchanged = current != null && !(e instanceof ConcurrentUpdateException)
                    ? current
                    : statusOrNull(id);
            metrics.recordTransition(unchanged != null ? unchanged.name() : null, target.name(),
                    e.getClass().getSimpleName());
            metrics.recordTransitionDuration(duration);
            log.warn("Transition to {} failed: error={}, duration={}ms", target, e.getMessage(), duration);
            throw e.withCurrentStatus(unchanged);
        } finally {
            MDC.remove(CorrelationContext.AUTHORIZATION_ID_MDC_KEY);
        }
    }

    private void settleSubmission(GatewayOutcome outcome) {
        try {
            gateways.settle(outcome);
        } catch (RuntimeException e) {
            // the transition is stored; a key left pending is only reused on resubmission
            log.error("Could not retire submission key {}: {}",
                    outcome.getSubmissionKey().getIdempotencyKey(), e.getMessage(), e);
        }
    }

    private void publishStatusChanged(Authorization saved, AuthorizationStatus from, String actor, String reason,
                                      GatewayOutcome outcome) {
        Map<String, String> eventMetadata = new LinkedHashMap<>();
        eventMetadata.put("fromStatus", from.name());
        eventMetadata.put("actor", actor);
        if (reason != null) {
            eventMetadata.put("reason", reason);
        }
        String reference = outcome.getMetadata().get(TransitionGatewayCoordinator.SUBMISSION_REFERENCE);
        if (reference != null) {
            eventMetadata.put("externalReferenceId", reference);
        }
        updatePublisher.publish(saved.getId(), saved.getStatus(), UpdateType.STATUS_CHANGED, eventMetadata);
    }

    private AuthorizationStatus statusOrNull(UUID id) {
        try {
            return store.load(id).map(Authorization::getStatus).orElse(null);
        } catch (RuntimeException e) {
            log.debug("Could not read current status for error report: {}", e.getMessage());
            return null;
        }
    }

    private void validateCreate(CreateAuthorizationCommand command, String actor) {
        List<String> violations = new ArrayList<>();
        if (actor == null || actor.isBlank()) {
            violations.add("actor is required");
        }
        if (command == null) {
            throw new ValidationException("Authorization data is required", violations);
        }
        PatientInfo patient = command.getPatient();
        if (patient == null) {
            violations.add("patient is required");
        } else {
            if (isBlank(patient.getFirstName()) || isBlank(patient.getLastName())) {
                violations.add("patient first and last name are required");
            }
            if (patient.getDateOfBirth() == null) {
                violations.add("patient date of birth is required");
            }
            if (patient.getInsurance() == null) {
                violations.add("patient insurance is required");
            }
        }
        MedicationInfo medication = command.getMedication();
        if (medication == null) {
            violations.add("medication is required");
        } else if (isBlank(medication.getMedicationName()) || isBlank(medication.getNdcCode())) {
            violations.add("medication name and NDC code are required");
        }
        if (!violations.isEmpty()) {
            throw new ValidationException("Invalid authorization", violations);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

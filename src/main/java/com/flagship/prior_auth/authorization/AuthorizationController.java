package com.flagship.prior_auth.authorization;

import com.flagship.prior_auth.authorization.dto.AuthorizationResponse;
import com.flagship.prior_auth.authorization.dto.CreateAuthorizationRequest;
import com.flagship.prior_auth.authorization.dto.StatusRefreshResponse;
import com.flagship.prior_auth.authorization.dto.TransitionRequest;
import com.flagship.prior_auth.error.IntegrationUnavailableException;
import com.flagship.prior_auth.error.TransitionTimeoutException;
import com.flagship.prior_auth.error.ValidationException;
import com.flagship.prior_auth.integration.resilience.CallDeadline;
import com.flagship.prior_auth.publish.AuthorizationUpdateEvent;
import com.flagship.prior_auth.publish.UpdateListener;
import com.flagship.prior_auth.publish.UpdateSubscription;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * REST Controller for authorization operations.
 *
 * Transitions may wait on slow payer and pharmacy systems, so they run on the
 * bounded transition pool and complete a {@link DeferredResult}; the servlet thread
 * is released meanwhile. The caller bounds the wait with {@code X-Request-Timeout-Ms};
 * when the request times out or the client goes away, the deadline is cancelled and
 * the in-flight gateway call is aborted. A timed-out request answers 503 with
 * {@code REFETCH_AND_RETRY}: a save that had already started may still commit, so the
 * client reads the authorization before asking again.
 */
@RestController
@RequestMapping("/api/authorizations")
@Slf4j
public class AuthorizationController {

    static final String ACTOR_HEADER = "X-Actor-Id";
    static final String TIMEOUT_HEADER = "X-Request-Timeout-Ms";

    private static final Duration DEFERRED_GRACE = Duration.ofSeconds(2);
    private static final long SSE_TIMEOUT_MS = Duration.ofMinutes(30).toMillis();

    private final AuthorizationStateMachine stateMachine;
    private final TaskExecutor transitionExecutor;
    private final Duration defaultTimeout;
    private final Duration maxTimeout;

    public AuthorizationController(AuthorizationStateMachine stateMachine,
                                   @Qualifier("transitionExecutor") TaskExecutor transitionExecutor,
                                   @Value("${prior-auth.transition.default-timeout:60s}") Duration defaultTimeout,
                                   @Value("${prior-auth.transition.max-timeout:300s}") Duration maxTimeout) {
        this.stateMachine = stateMachine;
        this.transitionExecutor = transitionExecutor;
        this.defaultTimeout = defaultTimeout;
        this.maxTimeout = maxTimeout;
    }

    @PostMapping
    public ResponseEntity<AuthorizationResponse> createAuthorization(
            @Valid @RequestBody CreateAuthorizationRequest request,
            @RequestHeader(ACTOR_HEADER) String actor) {

        Authorization created = stateMachine.createAuthorization(request.toCommand(), actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(AuthorizationResponse.from(created));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AuthorizationResponse> getAuthorization(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(AuthorizationResponse.from(stateMachine.getAuthorization(id)));
    }

    @GetMapping
    public ResponseEntity<List<AuthorizationResponse>> findByStatus(
            @RequestParam("status") AuthorizationStatus status) {
        return ResponseEntity.ok(stateMachine.findByStatus(status).stream()
                .map(AuthorizationResponse::from)
                .toList());
    }

    /**
     * Requests a status transition. Completes with the updated authorization or the
     * mapped error once the gateway call and the save have finished.
     */
    @PostMapping("/{id}/transitions")
    public DeferredResult<ResponseEntity<AuthorizationResponse>> requestTransition(
            @PathVariable("id") UUID id,
            @Valid @RequestBody TransitionRequest request,
            @RequestHeader(ACTOR_HEADER) String actor,
            @RequestHeader(value = TIMEOUT_HEADER, required = false) Long timeoutMs) {

        Duration timeout = resolveTimeout(timeoutMs);
        CallDeadline deadline = CallDeadline.after(timeout);
        DeferredResult<ResponseEntity<AuthorizationResponse>> result =
                new DeferredResult<>(timeout.plus(DEFERRED_GRACE).toMillis());

        result.onTimeout(() -> {
            deadline.cancel();
            log.warn("Transition of authorization={} to {} timed out after {}ms",
                    id, request.getTargetStatus(), timeout.toMillis());
            result.setErrorResult(new TransitionTimeoutException(id, request.getTargetStatus(),
                    "Transition of authorization " + id + " to " + request.getTargetStatus()
                            + " did not finish within " + timeout.toMillis()
                            + "ms; read the authorization before retrying, the change may still commit"));
        });
        result.onError(error -> deadline.cancel());

        try {
            transitionExecutor.execute(() -> {
                try {
                    Authorization updated = stateMachine.requestTransition(
                            id, request.getTargetStatus(), actor, request.getReason(), deadline);
                    result.setResult(ResponseEntity.ok(AuthorizationResponse.from(updated)));
                } catch (RuntimeException e) {
                    result.setErrorResult(e);
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("Transition pool saturated, rejecting transition of authorization={}", id);
            throw new IntegrationUnavailableException("transition",
                    "Too many transitions in progress", Duration.ofSeconds(1), e);
        }
        return result;
    }

    /**
     * Polls the remote status of an UNDER_REVIEW authorization and applies it.
     */
    @PostMapping("/{id}/status-refresh")
    public ResponseEntity<StatusRefreshResponse> refreshStatus(
            @PathVariable("id") UUID id,
            @RequestHeader(value = TIMEOUT_HEADER, required = false) Long timeoutMs) {
        StatusRefreshResult refreshed = stateMachine.refreshExternalStatus(id, CallDeadline.after(resolveTimeout(timeoutMs)));
        return ResponseEntity.ok(StatusRefreshResponse.from(refreshed));
    }

    /**
     * Streams update events as Server-Sent Events until the authorization reaches
     * APPROVED or CANCELLED or the client disconnects.
     */
    @GetMapping(value = "/{id}/updates", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter subscribeToUpdates(
            @PathVariable("id") UUID id,
            @RequestParam(value = "status", required = false) Set<AuthorizationStatus> statuses) {

        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);
        UpdateSubscription subscription = stateMachine.subscribeToUpdates(id,
                statuses == null ? EnumSet.noneOf(AuthorizationStatus.class) : statuses,
                new UpdateListener() {
                    @Override
                    public void onUpdate(AuthorizationUpdateEvent event) throws IOException {
                        emitter.send(SseEmitter.event()
                                .id(event.getEventId().toString())
                                .name(event.getUpdateType().eventType())
                                .data(event, MediaType.APPLICATION_JSON));
                    }

                    @Override
                    public void onComplete() {
                        emitter.complete();
                    }
                });

        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(error -> subscription.close());
        log.debug("SSE subscriber {} attached to authorization={}", subscription.getId(), id);
        return emitter;
    }

    private Duration resolveTimeout(Long timeoutMs) {
        if (timeoutMs == null) {
            return defaultTimeout;
        }
        if (timeoutMs <= 0) {
            throw new ValidationException(TIMEOUT_HEADER + " must be a positive number of milliseconds");
        }
        Duration requested = Duration.ofMillis(timeoutMs);
        return requested.compareTo(maxTimeout) > 0 ? maxTimeout : requested;
    }
}

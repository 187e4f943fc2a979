package com.flagship.prior_auth.authorization;

import com.flagship.prior_auth.error.PriorAuthException;
import com.flagship.prior_auth.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodically polls the remote status of every UNDER_REVIEW authorization that has an
 * external reference and applies remote decisions.
 *
 * Disabled unless {@code status-polling.enabled=true}. One failing authorization does
 * not stop the sweep.
 */
@Component
@ConditionalOnProperty(name = "status-polling.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class StatusPollingScheduler {

    private final AuthorizationStateMachine stateMachine;

    @Scheduled(fixedDelayString = "${status-polling.interval-ms:60000}")
    public void pollUnderReview() {
        List<Authorization> pending = stateMachine.findByStatus(AuthorizationStatus.UNDER_REVIEW);
        if (pending.isEmpty()) {
            return;
        }
        log.debug("Polling remote status for {} authorizations", pending.size());

        int transitioned = 0;
        for (Authorization authorization : pending) {
            if (authorization.metadata(TransitionGatewayCoordinator.SUBMISSION_REFERENCE) == null) {
                continue;
            }
            String correlationId = CorrelationContext.generateCorrelationId();
            CorrelationContext.setCorrelationId(correlationId);
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
            try {
                if (stateMachine.refreshExternalStatus(authorization.getId()).isTransitioned()) {
                    transitioned++;
                }
            } catch (PriorAuthException e) {
                log.warn("Status poll for authorization={} failed: {}", authorization.getId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Status poll for authorization={} failed unexpectedly", authorization.getId(), e);
            } finally {
                CorrelationContext.clear();
                MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            }
        }
        if (transitioned > 0) {
            log.info("Status poll applied {} remote decisions", transitioned);
        }
    }
}

package com.flagship.prior_auth.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for authorization workflow and upstream integrations.
 *
 * Metrics exposed:
 * - authorization.created: Counter of created authorizations
 * - authorization.transitions: Counter tagged with from/to/outcome
 * - authorization.transition.duration: Timer for requestTransition including gateway calls
 * - integration.attempts: Counter of network attempts per upstream and outcome
 * - integration.call.duration: Timer per upstream for the whole resilient call
 * - integration.breaker.rejected: Calls refused without I/O because a breaker was open
 * - integration.breaker.transitions: Breaker state changes
 * - updates.publish.failures: Update fan-out failures per channel
 */
@Component
public class PriorAuthMetrics {

    private final MeterRegistry registry;

    private final Counter authorizationsCreated;
    private final Timer transitionTimer;

    public PriorAuthMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.authorizationsCreated = Counter.builder("authorization.created")
                .description("Number of authorizations created")
                .register(registry);

        this.transitionTimer = Timer.builder("authorization.transition.duration")
                .description("Time taken by requestTransition, gateway calls included")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Workflow ====================

    public void incrementAuthorizationsCreated() {
        authorizationsCreated.increment();
    }

    /**
     * Records a transition attempt. {@code outcome} is "success" or the simple name of the error.
     */
    public void recordTransition(String fromStatus, String toStatus, String outcome) {
        registry.counter("authorization.transitions",
                "from", sanitizeTag(fromStatus),
                "to", sanitizeTag(toStatus),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordTransitionDuration(long durationMs) {
        transitionTimer.record(Duration.ofMillis(durationMs));
    }

    // ==================== Integrations ====================

    /**
     * Records a single network attempt against an upstream.
     */
    public void recordAttempt(String upstream, String outcome) {
        registry.counter("integration.attempts",
                "upstream", sanitizeTag(upstream),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordCallDuration(String upstream, String outcome, Duration duration) {
        registry.timer("integration.call.duration",
                "upstream", sanitizeTag(upstream),
                "outcome", sanitizeTag(outcome)
        ).record(duration);
    }

    public void recordBreakerRejection(String upstream) {
        registry.counter("integration.breaker.rejected",
                "upstream", sanitizeTag(upstream)
        ).increment();
    }

    public void recordBreakerTransition(String upstream, String fromState, String toState) {
        registry.counter("integration.breaker.transitions",
                "upstream", sanitizeTag(upstream),
                "from", sanitizeTag(fromState),
                "to", sanitizeTag(toState)
        ).increment();
    }

    // ==================== Publication ====================

    public void recordPublishFailure(String channel) {
        registry.counter("updates.publish.failures",
                "channel", sanitizeTag(channel)
        ).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_\\-]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}

package com.flagship.prior_auth.observability;

import com.flagship.prior_auth.integration.resilience.ResiliencePolicy;
import com.flagship.prior_auth.integration.resilience.ResiliencePolicyRegistry;
import com.flagship.prior_auth.outbox.OutboxEventRepository;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Custom health indicators for the prior authorization engine.
 */
public class HealthIndicators {

    /**
     * Unhealthy if too many update events are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        /** UP below the warning threshold, WARNING below the critical one, DOWN beyond it. */
        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Redis backs the idempotency fast path and the shared breaker flag. Both
     * degrade to local behaviour without it, so an outage reports DEGRADED.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return degraded("No connection factory configured");
                }
                String result = connectionFactory.getConnection().ping();
                if ("PONG".equals(result)) {
                    return Health.up().withDetail("response", result).build();
                }
                return Health.down()
                        .withDetail("response", result != null ? result : "null")
                        .build();

            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "Idempotency falls back to the database; breaker state stays per instance")
                    .build();
        }
    }

    /**
     * DOWN until the producer has opened a broker connection.
     */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Reports each upstream breaker. An open breaker means that upstream is failing
     * fast; the service itself still answers, so any open breaker reports DEGRADED.
     */
    @Component("upstreamsHealth")
    public static class UpstreamBreakerHealthIndicator implements HealthIndicator {

        private final ResiliencePolicyRegistry policies;

        public UpstreamBreakerHealthIndicator(ResiliencePolicyRegistry policies) {
            this.policies = policies;
        }

        @Override
        public Health health() {
            Map<String, Object> details = new LinkedHashMap<>();
            boolean anyOpen = false;
            for (ResiliencePolicy policy : policies.all()) {
                CircuitBreaker.State state = policy.getState();
                CircuitBreaker.Metrics metrics = policy.getBreakerMetrics();
                details.put(policy.getUpstream(), Map.of(
                        "state", state.name(),
                        "failureRate", metrics.getFailureRate(),
                        "bufferedCalls", metrics.getNumberOfBufferedCalls()));
                anyOpen |= state == CircuitBreaker.State.OPEN || state == CircuitBreaker.State.HALF_OPEN;
            }
            return (anyOpen ? Health.status("DEGRADED") : Health.up())
                    .withDetails(details)
                    .build();
        }
    }
}

package com.flagship.prior_auth.integration.resilience;

import io.github.resilience4j.core.IntervalFunction;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Circuit breaker, retry and bulkhead settings for one upstream.
 *
 * Backoff before retry {@code n} is {@code baseDelay * 2^(n-1)} capped at
 * {@code maxDelay}, randomized by {@code jitterFactor} in either direction.
 * {@code jitterFactor} must lie in {@code [0, 1)}.
 */
@Value
@Builder(toBuilder = true)
public class ResilienceSettings {

    @Builder.Default
    int slidingWindowSize = 10;

    @Builder.Default
    int minimumNumberOfCalls = 10;

    @Builder.Default
    float failureRateThreshold = 50.0f;

    @Builder.Default
    Duration openDuration = Duration.ofSeconds(30);

    @Builder.Default
    double openDurationMultiplier = 2.0;

    @Builder.Default
    Duration maxOpenDuration = Duration.ofMinutes(5);

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration baseDelay = Duration.ofSeconds(1);

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(8);

    @Builder.Default
    double jitterFactor = 0.2;

    @Builder.Default
    Duration attemptTimeout = Duration.ofSeconds(10);

    @Builder.Default
    int poolSize = 8;

    @Builder.Default
    int queueCapacity = 32;

    public static ResilienceSettings defaults() {
        return ResilienceSettings.builder().build();
    }

    public IntervalFunction retryBackoff() {
        return IntervalFunction.ofExponentialRandomBackoff(baseDelay, 2.0, jitterFactor, maxDelay);
    }
}

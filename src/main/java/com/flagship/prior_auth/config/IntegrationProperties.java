package com.flagship.prior_auth.config;

import com.flagship.prior_auth.integration.resilience.ResilienceSettings;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Endpoints, credentials and resilience settings for the payer and pharmacy integrations.
 *
 * Resilience settings are resolved per upstream key: values under
 * {@code integration.resilience.upstreams.<key>} override {@code integration.resilience.defaults}
 * field by field.
 */
@ConfigurationProperties(prefix = "integration")
@Getter
@Setter
public class IntegrationProperties {

    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(30);

    private Insurance insurance = new Insurance();
    private Pharmacy pharmacy = new Pharmacy();
    private Resilience resilience = new Resilience();

    @Getter
    @Setter
    public static class Insurance {
        private String baseUrl = "http://localhost:9090";
        private String eligibilityPath = "/x12/270";
        private String submissionPath = "/x12/278";
        private String statusPath = "/x12/278/inquiry";
        private String senderId = "EPAENGINE";
        private String receiverId = "PAYER";
        /** Sent as X-API-Key when set. */
        private String apiKey;
    }

    @Getter
    @Setter
    public static class Pharmacy {
        private String baseUrl = "http://localhost:9091";
        private String requestPath = "/script/pa-request";
        private String statusPath = "/script/pa-status";
        private String senderId = "EPAENGINE";
        /** Base64 AES key (16, 24 or 32 bytes). Blank means field encryption is unavailable. */
        private String encryptionKey;
        /** Base64 HMAC-SHA256 key for the plaintext integrity tag. */
        private String integrityKey;
    }

    @Getter
    @Setter
    public static class Resilience {
        private PolicyOverrides defaults = new PolicyOverrides();
        private Map<String, PolicyOverrides> upstreams = new HashMap<>();

        public ResilienceSettings settingsFor(String upstream) {
            ResilienceSettings base = defaults.applyTo(ResilienceSettings.defaults());
            PolicyOverrides overrides = upstreams.get(upstream);
            return overrides != null ? overrides.applyTo(base) : base;
        }
    }

    /**
     * Nullable mirror of {@link ResilienceSettings}; unset fields inherit.
     */
    @Getter
    @Setter
    public static class PolicyOverrides {
        private Integer slidingWindowSize;
        private Integer minimumNumberOfCalls;
        private Float failureRateThreshold;
        private Duration openDuration;
        private Double openDurationMultiplier;
        private Duration maxOpenDuration;
        private Integer maxAttempts;
        private Duration baseDelay;
        private Duration maxDelay;
        private Double jitterFactor;
        private Duration attemptTimeout;
        private Integer poolSize;
        private Integer queueCapacity;

        ResilienceSettings applyTo(ResilienceSettings base) {
            ResilienceSettings.ResilienceSettingsBuilder builder = base.toBuilder();
            if (slidingWindowSize != null) builder.slidingWindowSize(slidingWindowSize);
            if (minimumNumberOfCalls != null) builder.minimumNumberOfCalls(minimumNumberOfCalls);
            if (failureRateThreshold != null) builder.failureRateThreshold(failureRateThreshold);
            if (openDuration != null) builder.openDuration(openDuration);
            if (openDurationMultiplier != null) builder.openDurationMultiplier(openDurationMultiplier);
            if (maxOpenDuration != null) builder.maxOpenDuration(maxOpenDuration);
            if (maxAttempts != null) builder.maxAttempts(maxAttempts);
            if (baseDelay != null) builder.baseDelay(baseDelay);
            if (maxDelay != null) builder.maxDelay(maxDelay);
            if (jitterFactor != null) builder.jitterFactor(jitterFactor);
            if (attemptTimeout != null) builder.attemptTimeout(attemptTimeout);
            if (poolSize != null) builder.poolSize(poolSize);
            if (queueCapacity != null) builder.queueCapacity(queueCapacity);
            return builder.build();
        }
    }
}

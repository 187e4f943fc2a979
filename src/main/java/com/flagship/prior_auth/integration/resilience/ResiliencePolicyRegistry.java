package com.flagship.prior_auth.integration.resilience;

import com.flagship.prior_auth.config.IntegrationProperties;
import com.flagship.prior_auth.integration.Upstream;
import com.flagship.prior_auth.observability.PriorAuthMetrics;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * One {@link ResiliencePolicy} per upstream key, each with its own bounded worker pool
 * so a stuck upstream can only exhaust its own threads.
 */
@Component
@Slf4j
public class ResiliencePolicyRegistry {

    private final Map<Upstream, ResiliencePolicy> policies = new EnumMap<>(Upstream.class);
    private final Map<Upstream, ExecutorService> executors = new EnumMap<>(Upstream.class);

    public ResiliencePolicyRegistry(IntegrationProperties properties,
                                    SharedCircuitState sharedState,
                                    PriorAuthMetrics metrics) {
        for (Upstream upstream : Upstream.values()) {
            ResilienceSettings settings = properties.getResilience().settingsFor(upstream.key());
            ExecutorService executor = boundedExecutor(upstream.key(), settings);
            executors.put(upstream, executor);
            policies.put(upstream, new ResiliencePolicy(upstream.key(), settings, executor, sharedState, metrics));
            log.info("Resilience policy for upstream={}: window={}, minCalls={}, threshold={}%, open={}, "
                            + "maxAttempts={}, attemptTimeout={}, pool={}",
                    upstream.key(), settings.getSlidingWindowSize(), settings.getMinimumNumberOfCalls(),
                    settings.getFailureRateThreshold(), settings.getOpenDuration(), settings.getMaxAttempts(),
                    settings.getAttemptTimeout(), settings.getPoolSize());
        }
    }

    public ResiliencePolicy forUpstream(Upstream upstream) {
        return policies.get(upstream);
    }

    public Collection<ResiliencePolicy> all() {
        return policies.values();
    }

    /**
     * Bounded pool with a bounded queue; a full queue is rejected rather than blocking the caller.
     */
    static ExecutorService boundedExecutor(String name, ResilienceSettings settings) {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                settings.getPoolSize(),
                settings.getPoolSize(),
                60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(settings.getQueueCapacity()),
                new CustomizableThreadFactory(name + "-"),
                new ThreadPoolExecutor.AbortPolicy());
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    @PreDestroy
    public void shutdown() {
        executors.values().forEach(ExecutorService::shutdownNow);
    }
}

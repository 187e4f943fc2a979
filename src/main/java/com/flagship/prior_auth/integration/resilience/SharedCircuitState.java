package com.flagship.prior_auth.integration.resilience;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mirrors OPEN breakers across service instances through Redis.
 *
 * Strategy:
 * 1. When a local breaker opens, write {@code circuit:{upstream}} with the open-until
 *    instant and a TTL equal to the cool-down
 * 2. Before each call, other instances check the key and fail fast while it is live
 * 3. Lookups are cached locally for a short TTL so Redis is not hit per call
 * 4. Redis errors fall back to process-local breaker state
 *
 * The local breaker stays authoritative for half-open probing: each instance still
 * sends its own trial call once its own cool-down has elapsed.
 */
@Component
@Slf4j
public class SharedCircuitState {

    private static final String REDIS_KEY_PREFIX = "circuit:";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final boolean enabled;
    private final Duration localCacheTtl;
    private final Map<String, CachedFlag> cache = new ConcurrentHashMap<>();

    public SharedCircuitState(Optional<StringRedisTemplate> redisTemplate,
                              @Value("${integration.shared-circuit-state.enabled:false}") boolean enabled,
                              @Value("${integration.shared-circuit-state.local-cache-ttl:2s}") Duration localCacheTtl) {
        this.redisTemplate = redisTemplate;
        this.enabled = enabled && redisTemplate.isPresent();
        this.localCacheTtl = localCacheTtl;
    }

    /**
     * Instance that never consults or writes shared state.
     */
    public static SharedCircuitState disabled() {
        return new SharedCircuitState(Optional.empty(), false, Duration.ZERO);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Publishes that {@code upstream} is open for {@code coolDown}.
     */
    public void markOpen(String upstream, Duration coolDown) {
        if (!enabled) {
            return;
        }
        Instant openUntil = Instant.now().plus(coolDown);
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + upstream, openUntil.toString(), coolDown);
            cache.put(upstream, new CachedFlag(openUntil, Instant.now().plus(localCacheTtl)));
            log.info("Published open circuit for upstream={} until {}", upstream, openUntil);
        } catch (Exception e) {
            log.warn("Failed to publish open circuit for upstream={}: {}", upstream, e.getMessage());
        }
    }

    /**
     * Clears the shared flag once a local trial call has closed the breaker again.
     */
    public void markClosed(String upstream) {
        if (!enabled) {
            return;
        }
        cache.remove(upstream);
        try {
            redisTemplate.get().delete(REDIS_KEY_PREFIX + upstream);
        } catch (Exception e) {
            log.warn("Failed to clear shared circuit flag for upstream={}: {}", upstream, e.getMessage());
        }
    }

    /**
     * Returns the instant until which another instance reported the upstream open,
     * or empty when calls may proceed.
     */
    public Optional<Instant> openUntil(String upstream) {
        if (!enabled) {
            return Optional.empty();
        }
        Instant now = Instant.now();
        CachedFlag cached = cache.get(upstream);
        if (cached == null || cached.getRefreshAfter().isBefore(now)) {
            cached = new CachedFlag(readShared(upstream), now.plus(localCacheTtl));
            cache.put(upstream, cached);
        }
        Instant openUntil = cached.getOpenUntil();
        return openUntil != null && openUntil.isAfter(now) ? Optional.of(openUntil) : Optional.empty();
    }

    private Instant readShared(String upstream) {
        try {
            String value = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + upstream);
            return value != null ? Instant.parse(value) : null;
        } catch (Exception e) {
            log.debug("Shared circuit lookup failed for upstream={}, using local state: {}", upstream, e.getMessage());
            return null;
        }
    }

    @lombok.Value
    private static class CachedFlag {
        Instant openUntil;
        Instant refreshAfter;
    }
}

package com.flagship.prior_auth.integration.idempotency;

import com.flagship.prior_auth.error.ConcurrentUpdateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues idempotency keys for outbound submissions.
 *
 * Strategy:
 * 1. A pending (unconfirmed) key for the authorization and upstream is reused, so a
 *    resubmission after a timeout with unknown outcome carries the same key
 * 2. Once the upstream confirms a submission the key is retired; the next submission
 *    gets a new nonce and therefore a new key
 * 3. Redis caches the pending key; the database is the source of truth and a stale
 *    cache entry is detected by the conditional update in {@link #reserve}
 */
@Service
@Slf4j
public class SubmissionIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final IdempotencyRecordRepository repository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public SubmissionIdempotencyService(IdempotencyRecordRepository repository,
                                        Optional<RedisTemplate<String, String>> redisTemplate) {
        this.repository = repository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Deterministic key for an (authorization, upstream, nonce) triple.
     */
    public static UUID deriveKey(UUID authorizationId, String upstream, int attemptNonce) {
        String seed = authorizationId + ":" + upstream + ":" + attemptNonce;
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns the key to send with the next submission attempt, creating one if no
     * pending key exists.
     *
     * @throws ConcurrentUpdateException another instance created a key for the same
     *         authorization at the same moment
     */
    @Transactional
    public SubmissionKey reserve(UUID authorizationId, String upstream) {
        Optional<UUID> cached = cachedPendingKey(authorizationId, upstream);
        if (cached.isPresent()) {
            if (repository.touchPending(cached.get(), Instant.now()) == 1) {
                Optional<IdempotencyRecordEntity> record = repository.findById(cached.get());
                if (record.isPresent()) {
                    log.debug("Reusing pending idempotency key from cache for authorization={} upstream={}",
                            authorizationId, upstream);
                    return toKey(record.get(), true);
                }
            }
            log.debug("Cached idempotency key for authorization={} upstream={} is stale", authorizationId, upstream);
            evict(authorizationId, upstream);
        }

        Optional<IdempotencyRecordEntity> pending = repository
                .findFirstByAuthorizationIdAndUpstreamAndConfirmedAtIsNullOrderByAttemptNonceDesc(
                        authorizationId, upstream);
        if (pending.isPresent()) {
            IdempotencyRecordEntity record = pending.get();
            record.markAttempted();
            repository.save(record);
            cache(authorizationId, upstream, record.getIdempotencyKey());
            log.info("Reusing pending idempotency key {} (nonce {}) for authorization={} upstream={}",
                    record.getIdempotencyKey(), record.getAttemptNonce(), authorizationId, upstream);
            return toKey(record, true);
        }

        int nonce = repository.findHighestNonce(authorizationId, upstream).orElse(0) + 1;
        UUID key = deriveKey(authorizationId, upstream, nonce);
        IdempotencyRecordEntity created;
        try {
            created = repository.saveAndFlush(IdempotencyRecordEntity.pending(key, authorizationId, upstream, nonce));
        } catch (DataIntegrityViolationException e) {
            throw new ConcurrentUpdateException(authorizationId,
                    "Another submission to " + upstream + " started concurrently", e);
        }
        cache(authorizationId, upstream, key);
        log.debug("Issued idempotency key {} (nonce {}) for authorization={} upstream={}",
                key, nonce, authorizationId, upstream);
        return toKey(created, false);
    }

    /**
     * Retires a key after the upstream acknowledged the submission.
     */
    @Transactional
    public void confirm(SubmissionKey key) {
        repository.findById(key.getIdempotencyKey()).ifPresent(record -> {
            if (!record.isConfirmed()) {
                record.markConfirmed();
                repository.save(record);
            }
        });
        evict(key.getAuthorizationId(), key.getUpstream());
    }

    private SubmissionKey toKey(IdempotencyRecordEntity record, boolean reused) {
        return new SubmissionKey(record.getIdempotencyKey(), record.getAuthorizationId(),
                record.getUpstream(), record.getAttemptNonce(), reused);
    }

    private Optional<UUID> cachedPendingKey(UUID authorizationId, String upstream) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(redisKey(authorizationId, upstream));
            return value != null ? Optional.of(UUID.fromString(value)) : Optional.empty();
        } catch (Exception e) {
            log.warn("Redis lookup failed for pending idempotency key, falling back to database: {}",
                    e.getMessage());
            return Optional.empty();
        }
    }

    private void cache(UUID authorizationId, String upstream, UUID key) {
        redisTemplate.ifPresent(redis -> {
            try {
                redis.opsForValue().set(redisKey(authorizationId, upstream), key.toString(), REDIS_TTL);
            } catch (Exception e) {
                log.debug("Failed to cache idempotency key in Redis: {}", e.getMessage());
            }
        });
    }

    private void evict(UUID authorizationId, String upstream) {
        redisTemplate.ifPresent(redis -> {
            try {
                redis.delete(redisKey(authorizationId, upstream));
            } catch (Exception e) {
                log.warn("Failed to evict idempotency key from Redis: {}", e.getMessage());
            }
        });
    }

    private static String redisKey(UUID authorizationId, String upstream) {
        return REDIS_KEY_PREFIX + authorizationId + ":" + upstream;
    }
}

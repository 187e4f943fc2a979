package com.flagship.prior_auth.authorization;

import com.flagship.prior_auth.error.ConcurrentUpdateException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link AuthorizationStore} backed by a map, with the same version check as the
 * database adapter.
 */
class InMemoryAuthorizationStore implements AuthorizationStore {

    private final Map<UUID, Authorization> rows = new ConcurrentHashMap<>();
    final AtomicInteger saves = new AtomicInteger();
    final AtomicReference<RuntimeException> nextSaveFailure = new AtomicReference<>();

    @Override
    public Optional<Authorization> load(UUID id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public synchronized Authorization save(Authorization authorization) {
        RuntimeException failure = nextSaveFailure.getAndSet(null);
        if (failure != null) {
            throw failure;
        }
        Authorization stored = rows.get(authorization.getId());
        Long storedVersion = stored != null ? stored.getVersion() : null;
        if (!Objects.equals(storedVersion, authorization.getVersion())) {
            throw new ConcurrentUpdateException(authorization.getId(), "Version mismatch");
        }
        Authorization saved = authorization.toBuilder()
                .version(storedVersion == null ? 0L : storedVersion + 1)
                .build();
        rows.put(saved.getId(), saved);
        saves.incrementAndGet();
        return saved;
    }

    @Override
    public List<Authorization> findByStatus(AuthorizationStatus status) {
        return rows.values().stream().filter(a -> a.getStatus() == status).toList();
    }
}

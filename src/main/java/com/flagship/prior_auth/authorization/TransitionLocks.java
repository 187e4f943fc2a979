package com.flagship.prior_auth.authorization;

import com.flagship.prior_auth.error.ConcurrentUpdateException;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local admission for transitions: at most one in flight per authorization.
 *
 * A second caller is refused immediately instead of waiting, because the first may
 * hold the slot for the whole duration of a slow gateway call. Across instances the
 * version check on save plays the same role.
 */
@Component
public class TransitionLocks {

    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * @throws ConcurrentUpdateException if a transition on {@code authorizationId} is already running
     */
    public Admission admit(UUID authorizationId) {
        if (!inFlight.add(authorizationId)) {
            throw new ConcurrentUpdateException(authorizationId,
                    "Another transition on authorization " + authorizationId + " is in progress");
        }
        return new Admission(authorizationId);
    }

    public boolean isHeld(UUID authorizationId) {
        return inFlight.contains(authorizationId);
    }

    public final class Admission implements AutoCloseable {

        private final UUID authorizationId;
        private final AtomicBoolean released = new AtomicBoolean();

        private Admission(UUID authorizationId) {
            this.authorizationId = authorizationId;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                inFlight.remove(authorizationId);
            }
        }
    }
}

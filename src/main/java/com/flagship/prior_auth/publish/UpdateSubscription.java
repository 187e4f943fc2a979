package com.flagship.prior_auth.publish;

import com.flagship.prior_auth.authorization.AuthorizationStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A live subscription to one authorization's updates, optionally filtered by status.
 */
@Slf4j
public class UpdateSubscription implements AutoCloseable {

    private final UUID id = UUID.randomUUID();
    private final UUID authorizationId;
    private final Set<AuthorizationStatus> statusFilter;
    private final UpdateListener listener;
    private final Consumer<UpdateSubscription> onClose;
    private final AtomicBoolean open = new AtomicBoolean(true);

    UpdateSubscription(UUID authorizationId, Set<AuthorizationStatus> statusFilter,
                       UpdateListener listener, Consumer<UpdateSubscription> onClose) {
        this.authorizationId = authorizationId;
        this.statusFilter = statusFilter == null ? Set.of() : Set.copyOf(statusFilter);
        this.listener = listener;
        this.onClose = onClose;
    }

    public UUID getId() {
        return id;
    }

    public UUID getAuthorizationId() {
        return authorizationId;
    }

    public boolean isOpen() {
        return open.get();
    }

    boolean accepts(AuthorizationUpdateEvent event) {
        return statusFilter.isEmpty() || statusFilter.contains(event.getStatus());
    }

    /**
     * @return false if the listener failed; the subscription is closed in that case
     */
    boolean deliver(AuthorizationUpdateEvent event) {
        if (!isOpen() || !accepts(event)) {
            return true;
        }
        try {
            listener.onUpdate(event);
            return true;
        } catch (Exception e) {
            log.debug("Subscriber {} for authorization={} failed, closing: {}", id, authorizationId, e.getMessage());
            close();
            return false;
        }
    }

    /**
     * Idempotent.
     */
    @Override
    public void close() {
        if (open.compareAndSet(true, false)) {
            onClose.accept(this);
            try {
                listener.onComplete();
            } catch (RuntimeException e) {
                log.debug("Subscriber {} completion callback failed: {}", id, e.getMessage());
            }
        }
    }
}

package com.flagship.prior_auth.publish;

import com.flagship.prior_auth.authorization.AuthorizationStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process live subscribers, per authorization.
 *
 * Subscriptions end when the subscriber closes them, when delivery to them fails, or
 * after the authorization's terminal update has been delivered.
 */
@Component
@Slf4j
public class UpdateSubscriptionRegistry {

    private final Map<UUID, List<UpdateSubscription>> subscriptions = new ConcurrentHashMap<>();

    public UpdateSubscription subscribe(UUID authorizationId, Set<AuthorizationStatus> statusFilter,
                                        UpdateListener listener) {
        UpdateSubscription subscription = new UpdateSubscription(authorizationId, statusFilter, listener, this::remove);
        subscriptions.computeIfAbsent(authorizationId, id -> new CopyOnWriteArrayList<>()).add(subscription);
        log.debug("Subscriber {} registered for authorization={} filter={}",
                subscription.getId(), authorizationId, statusFilter);
        return subscription;
    }

    /**
     * @return number of subscribers whose delivery failed
     */
    int deliver(AuthorizationUpdateEvent event) {
        List<UpdateSubscription> current = subscriptions.get(event.getAuthorizationId());
        if (current == null) {
            return 0;
        }
        int failures = 0;
        for (UpdateSubscription subscription : current) {
            if (!subscription.deliver(event)) {
                failures++;
            }
        }
        if (event.getStatus() != null && event.getStatus().isTerminal()) {
            closeAll(event.getAuthorizationId());
        }
        return failures;
    }

    public void closeAll(UUID authorizationId) {
        List<UpdateSubscription> current = subscriptions.get(authorizationId);
        if (current != null) {
            current.forEach(UpdateSubscription::close);
        }
    }

    public int subscriberCount(UUID authorizationId) {
        List<UpdateSubscription> current = subscriptions.get(authorizationId);
        return current == null ? 0 : current.size();
    }

    private void remove(UpdateSubscription subscription) {
        subscriptions.computeIfPresent(subscription.getAuthorizationId(), (id, list) -> {
            list.remove(subscription);
            return list.isEmpty() ? null : list;
        });
    }
}

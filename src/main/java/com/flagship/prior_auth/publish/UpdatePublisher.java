package com.flagship.prior_auth.publish;

import com.flagship.prior_auth.authorization.AuthorizationStatus;
import com.flagship.prior_auth.observability.CorrelationContext;
import com.flagship.prior_auth.observability.PriorAuthMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Fans update events out to live subscribers and the outward sinks.
 *
 * Called after the change has committed. Publishing is best effort: a failing
 * channel is logged and counted and never reaches the caller, so a committed
 * transition is never reported as failed because a notification was lost.
 */
@Service
@Slf4j
public class UpdatePublisher {

    static final String SUBSCRIBERS_CHANNEL = "subscribers";

    private final UpdateSubscriptionRegistry subscriptions;
    private final List<UpdateEventSink> sinks;
    private final PriorAuthMetrics metrics;

    public UpdatePublisher(UpdateSubscriptionRegistry subscriptions, List<UpdateEventSink> sinks,
                           PriorAuthMetrics metrics) {
        this.subscriptions = subscriptions;
        this.sinks = List.copyOf(sinks);
        this.metrics = metrics;
    }

    public AuthorizationUpdateEvent publish(UUID authorizationId, AuthorizationStatus status,
                                            UpdateType updateType, Map<String, String> metadata) {
        AuthorizationUpdateEvent event = AuthorizationUpdateEvent.builder()
                .eventId(UUID.randomUUID())
                .authorizationId(authorizationId)
                .status(status)
                .updateType(updateType)
                .metadata(metadata == null ? Map.of() : metadata)
                .correlationId(CorrelationContext.getCorrelationId())
                .occurredAt(Instant.now())
                .build();
        publish(event);
        return event;
    }

    public void publish(AuthorizationUpdateEvent event) {
        try {
            int failed = subscriptions.deliver(event);
            for (int i = 0; i < failed; i++) {
                metrics.recordPublishFailure(SUBSCRIBERS_CHANNEL);
            }
        } catch (RuntimeException e) {
            log.error("Delivering {} for authorization={} to live subscribers failed",
                    event.getUpdateType(), event.getAuthorizationId(), e);
            metrics.recordPublishFailure(SUBSCRIBERS_CHANNEL);
        }

        for (UpdateEventSink sink : sinks) {
            try {
                sink.publish(event);
            } catch (RuntimeException e) {
                log.error("Publishing {} for authorization={} to {} failed: {}",
                        event.getUpdateType(), event.getAuthorizationId(), sink.channel(), e.getMessage(), e);
                metrics.recordPublishFailure(sink.channel());
            }
        }
        log.debug("Published {} for authorization={} status={}",
                event.getUpdateType(), event.getAuthorizationId(), event.getStatus());
    }
}

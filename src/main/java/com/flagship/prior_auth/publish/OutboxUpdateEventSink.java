package com.flagship.prior_auth.publish;

import com.flagship.prior_auth.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Queues update events in the outbox; {@code OutboxPublisher} relays them to Kafka.
 */
@Component
@RequiredArgsConstructor
public class OutboxUpdateEventSink implements UpdateEventSink {

    static final String AGGREGATE_TYPE = "Authorization";

    private final OutboxService outboxService;

    @Override
    public String channel() {
        return "outbox";
    }

    @Override
    public void publish(AuthorizationUpdateEvent event) {
        outboxService.saveEvent(AGGREGATE_TYPE, event.getAuthorizationId(),
                event.getUpdateType().eventType(), event);
    }
}

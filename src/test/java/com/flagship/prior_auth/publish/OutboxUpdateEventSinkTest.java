package com.flagship.prior_auth.publish;

import com.flagship.prior_auth.authorization.AuthorizationStatus;
import com.flagship.prior_auth.outbox.OutboxService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.mockito.Mockito.*;

class OutboxUpdateEventSinkTest {

    @Test
    @DisplayName("Update events are queued in the outbox under the Authorization aggregate")
    void queuesEventInOutbox() {
        OutboxService outboxService = mock(OutboxService.class);
        OutboxUpdateEventSink sink = new OutboxUpdateEventSink(outboxService);
        UUID id = UUID.randomUUID();
        AuthorizationUpdateEvent event = AuthorizationUpdateEvent.builder()
                .eventId(UUID.randomUUID())
                .authorizationId(id)
                .status(AuthorizationStatus.APPROVED)
                .updateType(UpdateType.STATUS_CHANGED)
                .occurredAt(Instant.now())
                .build();

        sink.publish(event);

        verify(outboxService).saveEvent("Authorization", id, "AuthorizationStatusChanged", event);
    }
}

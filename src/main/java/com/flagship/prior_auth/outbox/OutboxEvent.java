package com.flagship.prior_auth.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An authorization update waiting to be relayed to Kafka.
 *
 * Immutable; publishing state changes produce new instances.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Authorization"
    UUID aggregateId;          // authorization ID, also the Kafka key
    String eventType;          // AuthorizationCreated, AuthorizationStatusChanged
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until relayed
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}

package com.flagship.prior_auth.publish;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.prior_auth.authorization.AuthorizationStatus;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Notification that an authorization was created or changed status.
 *
 * Carries the status reached, not the full authorization; consumers that need more
 * read it back through the API.
 */
@Value
@Builder
@Jacksonized
public class AuthorizationUpdateEvent {

    @JsonProperty("event_id")
    UUID eventId;

    @JsonProperty("authorization_id")
    UUID authorizationId;

    @JsonProperty("status")
    AuthorizationStatus status;

    @JsonProperty("update_type")
    UpdateType updateType;

    @Singular("metadataEntry")
    @JsonProperty("metadata")
    Map<String, String> metadata;

    @JsonProperty("correlation_id")
    String correlationId;

    @JsonProperty("occurred_at")
    Instant occurredAt;
}

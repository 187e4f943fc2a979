package com.flagship.prior_auth.authorization;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One entry of the status history. Immutable once appended.
 *
 * Ordered by {@code sequenceNumber}, which follows insertion order and breaks ties
 * between entries with the same {@code changedAt}. {@code fromStatus} is null only for
 * the creation entry.
 */
@Value
@Builder
@Jacksonized
public class StatusChange {

    @JsonProperty("sequence_number")
    long sequenceNumber;

    @JsonProperty("from_status")
    AuthorizationStatus fromStatus;

    @JsonProperty("to_status")
    AuthorizationStatus toStatus;

    @JsonProperty("changed_by")
    String changedBy;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("changed_at")
    Instant changedAt;
}

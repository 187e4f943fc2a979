package com.flagship.prior_auth.integration.pharmacy.script;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class ScriptHeader {

    /** Unique per logical request; retries of the same submission reuse it. */
    @JsonProperty("MessageID")
    String messageId;

    @JsonProperty("RelatesToMessageID")
    String relatesToMessageId;

    @JsonProperty("SentTime")
    Instant sentTime;

    @JsonProperty("From")
    String from;

    @JsonProperty("To")
    String to;
}

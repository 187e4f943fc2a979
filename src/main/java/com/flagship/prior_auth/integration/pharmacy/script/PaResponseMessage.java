package com.flagship.prior_auth.integration.pharmacy.script;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Reply to both a PA request and a status inquiry. Exactly one of
 * {@code responseStatus} and {@code error} is present in a well-formed reply.
 */
@Value
@Builder
@Jacksonized
@JacksonXmlRootElement(localName = "PAResponse")
public class PaResponseMessage {

    @JsonProperty("Header")
    ScriptHeader header;

    @JsonProperty("PAReferenceID")
    String paReferenceId;

    @JsonProperty("ResponseStatus")
    ResponseStatus responseStatus;

    @JsonProperty("Error")
    ScriptError error;

    @Value
    @Builder
    @Jacksonized
    public static class ResponseStatus {
        /** APPROVED, DENIED, PENDED, CLOSED, MORE_INFO, ... */
        @JsonProperty("Code")
        String code;

        @JsonProperty("ReasonCode")
        String reasonCode;

        @JsonProperty("Note")
        String note;
    }

    @Value
    @Builder
    @Jacksonized
    public static class ScriptError {
        @JsonProperty("Code")
        String code;

        @JsonProperty("Description")
        String description;

        /** True when the pharmacy network asks the sender to try again later. */
        @JsonProperty("Retryable")
        boolean retryable;
    }
}

package com.flagship.prior_auth.authorization;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Pointer to a supporting document held by the document service.
 */
@Value
@Builder
@Jacksonized
public class DocumentReference {

    @JsonProperty("document_id")
    String documentId;

    @JsonProperty("document_type")
    String documentType;

    @JsonProperty("uri")
    String uri;

    @JsonProperty("uploaded_at")
    Instant uploadedAt;
}

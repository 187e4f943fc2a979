package com.flagship.prior_auth.authorization;

import com.flagship.prior_auth.integration.idempotency.SubmissionKey;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * What a gateway call contributes to the transition it confirmed.
 *
 * {@code submissionKey} is set when the call submitted the authorization upstream; it
 * stays pending until the transition has been stored.
 */
@Value
class GatewayOutcome {
    Map<String, String> metadata;
    List<String> workflowEvents;
    SubmissionKey submissionKey;

    GatewayOutcome(Map<String, String> metadata, List<String> workflowEvents) {
        this(metadata, workflowEvents, null);
    }

    GatewayOutcome(Map<String, String> metadata, List<String> workflowEvents, SubmissionKey submissionKey) {
        this.metadata = metadata;
        this.workflowEvents = workflowEvents;
        this.submissionKey = submissionKey;
    }

    static GatewayOutcome none() {
        return new GatewayOutcome(Map.of(), List.of());
    }
}

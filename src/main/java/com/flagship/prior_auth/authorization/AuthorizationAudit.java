package com.flagship.prior_auth.authorization;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Audit block of an authorization: append-only status history, free-text workflow
 * events, and metadata merged in from gateway results.
 *
 * Every mutator returns a new instance.
 */
@Value
public class AuthorizationAudit {

    @JsonProperty("status_history")
    List<StatusChange> statusHistory;

    @JsonProperty("workflow_events")
    List<String> workflowEvents;

    @JsonProperty("metadata")
    Map<String, String> metadata;

    public AuthorizationAudit(List<StatusChange> statusHistory, List<String> workflowEvents,
                              Map<String, String> metadata) {
        this.statusHistory = List.copyOf(statusHistory);
        this.workflowEvents = List.copyOf(workflowEvents);
        this.metadata = Map.copyOf(metadata);
    }

    public static AuthorizationAudit empty() {
        return new AuthorizationAudit(List.of(), List.of(), Map.of());
    }

    public StatusChange lastStatusChange() {
        if (statusHistory.isEmpty()) {
            throw new IllegalStateException("Status history is empty");
        }
        return statusHistory.get(statusHistory.size() - 1);
    }

    public long nextSequenceNumber() {
        return statusHistory.isEmpty() ? 1 : lastStatusChange().getSequenceNumber() + 1;
    }

    AuthorizationAudit append(StatusChange change, List<String> events, Map<String, String> mergedMetadata) {
        List<StatusChange> history = new ArrayList<>(statusHistory);
        history.add(change);
        List<String> allEvents = new ArrayList<>(workflowEvents);
        allEvents.addAll(events);
        Map<String, String> allMetadata = new LinkedHashMap<>(metadata);
        allMetadata.putAll(mergedMetadata);
        return new AuthorizationAudit(history, allEvents, allMetadata);
    }
}

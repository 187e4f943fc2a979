package com.flagship.prior_auth.authorization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.flagship.prior_auth.authorization.AuthorizationStatus.*;
import static org.junit.jupiter.api.Assertions.*;

class StatusTransitionsTest {

    @Test
    @DisplayName("Only the listed edges are allowed")
    void allowedEdges() {
        assertEquals(EnumSet.of(SUBMITTED, CANCELLED), StatusTransitions.allowedFrom(DRAFT));
        assertEquals(EnumSet.of(PENDING_DOCUMENTS, UNDER_REVIEW, CANCELLED), StatusTransitions.allowedFrom(SUBMITTED));
        assertEquals(EnumSet.of(UNDER_REVIEW, CANCELLED), StatusTransitions.allowedFrom(PENDING_DOCUMENTS));
        assertEquals(EnumSet.of(APPROVED, DENIED, NEEDS_INFO), StatusTransitions.allowedFrom(UNDER_REVIEW));
        assertEquals(EnumSet.of(UNDER_REVIEW, CANCELLED), StatusTransitions.allowedFrom(NEEDS_INFO));
        assertEquals(EnumSet.of(APPEALED), StatusTransitions.allowedFrom(DENIED));
        assertEquals(EnumSet.of(UNDER_REVIEW), StatusTransitions.allowedFrom(APPEALED));
    }

    @Test
    @DisplayName("Terminal statuses have no outgoing edges")
    void terminalStatuses() {
        for (AuthorizationStatus status : AuthorizationStatus.values()) {
            Set<AuthorizationStatus> targets = StatusTransitions.allowedFrom(status);
            assertEquals(status.isTerminal(), targets.isEmpty(), status.name());
        }
        assertTrue(APPROVED.isTerminal());
        assertTrue(CANCELLED.isTerminal());
        assertFalse(DENIED.isTerminal());
    }

    @Test
    @DisplayName("Every pair outside the table is rejected")
    void disallowedPairs() {
        int allowed = 0;
        for (AuthorizationStatus from : AuthorizationStatus.values()) {
            for (AuthorizationStatus to : AuthorizationStatus.values()) {
                boolean expected = StatusTransitions.allowedFrom(from).contains(to);
                assertEquals(expected, StatusTransitions.isAllowed(from, to), from + " -> " + to);
                if (expected) {
                    allowed++;
                }
            }
        }
        assertEquals(14, allowed);
        assertFalse(StatusTransitions.isAllowed(DRAFT, APPROVED));
        assertFalse(StatusTransitions.isAllowed(null, DRAFT));
    }

    @Test
    @DisplayName("Gateway actions are attached to SUBMITTED and UNDER_REVIEW only")
    void requiredActions() {
        assertEquals(StatusTransitions.GatewayAction.ELIGIBILITY_CHECK, StatusTransitions.requiredAction(SUBMITTED));
        assertEquals(StatusTransitions.GatewayAction.SUBMISSION, StatusTransitions.requiredAction(UNDER_REVIEW));
        for (AuthorizationStatus status : EnumSet.complementOf(EnumSet.of(SUBMITTED, UNDER_REVIEW))) {
            assertEquals(StatusTransitions.GatewayAction.NONE, StatusTransitions.requiredAction(status));
        }
    }

    @Test
    @DisplayName("transitionTo appends history and keeps status equal to the last entry")
    void transitionAppendsHistory() {
        Authorization draft = AuthorizationFixtures.draft();
        assertEquals(1, draft.getStatusHistory().size());
        assertNull(draft.getStatusHistory().get(0).getFromStatus());
        assertEquals(DRAFT, draft.getStatusHistory().get(0).getToStatus());

        Authorization submitted = draft.transitionTo(SUBMITTED, "dr.smith", "ready",
                Map.of("coverage.covered", "true"), List.of("eligibility ok"));

        assertEquals(DRAFT, draft.getStatus());
        assertEquals(SUBMITTED, submitted.getStatus());
        assertEquals(2, submitted.getStatusHistory().size());
        StatusChange last = submitted.getAudit().lastStatusChange();
        assertEquals(2, last.getSequenceNumber());
        assertEquals(DRAFT, last.getFromStatus());
        assertEquals(SUBMITTED, last.getToStatus());
        assertEquals("true", submitted.metadata("coverage.covered"));
    }
}

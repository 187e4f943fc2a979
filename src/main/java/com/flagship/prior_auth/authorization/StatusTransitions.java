package com.flagship.prior_auth.authorization;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.flagship.prior_auth.authorization.AuthorizationStatus.*;

/**
 * The authorization lifecycle as data.
 *
 * Two tables, both loaded once:
 * - allowed edges: current status to the set of statuses it may move to
 * - external confirmation: the gateway action a target status requires before the
 *   transition may be recorded
 *
 * Adding an edge or a confirmation requirement is a change to these tables only.
 */
public final class StatusTransitions {

    /**
     * Gateway work that must succeed before a transition into a status is recorded.
     */
    public enum GatewayAction {
        NONE,
        /** Payer eligibility inquiry; coverage is merged into audit metadata. */
        ELIGIBILITY_CHECK,
        /** Submission to the payer, or to the pharmacy network for pharmacy-benefit plans. */
        SUBMISSION
    }

    private static final Map<AuthorizationStatus, Set<AuthorizationStatus>> ALLOWED_EDGES;
    private static final Map<AuthorizationStatus, GatewayAction> ON_ENTRY;

    static {
        Map<AuthorizationStatus, Set<AuthorizationStatus>> edges = new EnumMap<>(AuthorizationStatus.class);
        edges.put(DRAFT, EnumSet.of(SUBMITTED, CANCELLED));
        edges.put(SUBMITTED, EnumSet.of(PENDING_DOCUMENTS, UNDER_REVIEW, CANCELLED));
        edges.put(PENDING_DOCUMENTS, EnumSet.of(UNDER_REVIEW, CANCELLED));
        edges.put(UNDER_REVIEW, EnumSet.of(APPROVED, DENIED, NEEDS_INFO));
        edges.put(NEEDS_INFO, EnumSet.of(UNDER_REVIEW, CANCELLED));
        edges.put(DENIED, EnumSet.of(APPEALED));
        edges.put(APPEALED, EnumSet.of(UNDER_REVIEW));
        edges.put(APPROVED, EnumSet.noneOf(AuthorizationStatus.class));
        edges.put(CANCELLED, EnumSet.noneOf(AuthorizationStatus.class));
        edges.replaceAll((status, targets) -> Collections.unmodifiableSet(targets));
        ALLOWED_EDGES = Collections.unmodifiableMap(edges);

        Map<AuthorizationStatus, GatewayAction> onEntry = new EnumMap<>(AuthorizationStatus.class);
        for (AuthorizationStatus status : AuthorizationStatus.values()) {
            onEntry.put(status, GatewayAction.NONE);
        }
        onEntry.put(SUBMITTED, GatewayAction.ELIGIBILITY_CHECK);
        onEntry.put(UNDER_REVIEW, GatewayAction.SUBMISSION);
        ON_ENTRY = Collections.unmodifiableMap(onEntry);
    }

    private StatusTransitions() {
        // Utility class
    }

    public static boolean isAllowed(AuthorizationStatus from, AuthorizationStatus to) {
        return from != null && to != null && ALLOWED_EDGES.get(from).contains(to);
    }

    public static Set<AuthorizationStatus> allowedFrom(AuthorizationStatus from) {
        return ALLOWED_EDGES.get(from);
    }

    public static GatewayAction requiredAction(AuthorizationStatus target) {
        return ON_ENTRY.get(target);
    }
}

package com.flagship.prior_auth.authorization;

/**
 * Lifecycle status of a prior authorization request.
 *
 * Allowed edges between statuses live in {@link StatusTransitions}; this enum only
 * names the states and knows which of them are final.
 */
public enum AuthorizationStatus {
    /**
     * Request is being assembled. Initial state for all authorizations.
     */
    DRAFT,

    /**
     * Request has been accepted for processing and eligibility has been verified.
     */
    SUBMITTED,

    /**
     * Waiting on supporting documentation before the payer can review.
     */
    PENDING_DOCUMENTS,

    /**
     * Submitted to the payer or pharmacy network and awaiting a decision.
     */
    UNDER_REVIEW,

    /**
     * Reviewer asked for additional information.
     */
    NEEDS_INFO,

    /**
     * Approved. Terminal state.
     */
    APPROVED,

    /**
     * Denied. Final except for an appeal.
     */
    DENIED,

    /**
     * Withdrawn. Terminal state.
     */
    CANCELLED,

    /**
     * Denial is being appealed.
     */
    APPEALED;

    /**
     * Terminal states have no outgoing edges. DENIED is not terminal because it can be appealed.
     */
    public boolean isTerminal() {
        return this == APPROVED || this == CANCELLED;
    }
}

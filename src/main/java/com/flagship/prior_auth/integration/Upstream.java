package com.flagship.prior_auth.integration;

/**
 * Logical upstream keys. Each key owns one circuit breaker and one worker pool.
 */
public enum Upstream {
    INSURANCE_ELIGIBILITY("insurance-eligibility"),
    INSURANCE_SUBMISSION("insurance-submission"),
    INSURANCE_STATUS("insurance-status"),
    PHARMACY("pharmacy"),
    PHARMACY_STATUS("pharmacy-status");

    private final String key;

    Upstream(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    @Override
    public String toString() {
        return key;
    }
}

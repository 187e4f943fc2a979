package com.flagship.prior_auth.publish;

public enum UpdateType {
    CREATED("AuthorizationCreated"),
    STATUS_CHANGED("AuthorizationStatusChanged");

    private final String eventType;

    UpdateType(String eventType) {
        this.eventType = eventType;
    }

    /**
     * Event type name used in the outbox and on the Kafka topic.
     */
    public String eventType() {
        return eventType;
    }
}

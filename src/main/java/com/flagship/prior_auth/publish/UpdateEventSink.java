package com.flagship.prior_auth.publish;

/**
 * Outward channel for update events. Implementations may fail; the publisher logs
 * and counts the failure and carries on.
 */
public interface UpdateEventSink {

    /**
     * Short name used in logs and metric tags.
     */
    String channel();

    void publish(AuthorizationUpdateEvent event);
}

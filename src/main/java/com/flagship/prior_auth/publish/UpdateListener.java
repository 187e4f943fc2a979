package com.flagship.prior_auth.publish;

/**
 * Receives live updates for one authorization.
 */
public interface UpdateListener {

    /**
     * Throwing from here closes the subscription.
     */
    void onUpdate(AuthorizationUpdateEvent event) throws Exception;

    /**
     * Called once when the subscription ends for any reason.
     */
    default void onComplete() {
    }
}

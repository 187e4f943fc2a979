package com.flagship.prior_auth.error;

/**
 * A key or credential needed for the call is missing. The call fails closed.
 */
public class ConfigurationException extends PriorAuthException {

    public ConfigurationException(String message) {
        super(message, RetryGuidance.DO_NOT_RETRY);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, RetryGuidance.DO_NOT_RETRY, cause);
    }
}

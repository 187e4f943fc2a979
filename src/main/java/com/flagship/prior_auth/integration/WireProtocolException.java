package com.flagship.prior_auth.integration;

/**
 * The remote answered with something that cannot be decoded. Not retried, but it
 * still counts as a breaker failure because a well-behaved remote never sends it.
 */
public class WireProtocolException extends RuntimeException {

    public WireProtocolException(String message) {
        super(message);
    }

    public WireProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}

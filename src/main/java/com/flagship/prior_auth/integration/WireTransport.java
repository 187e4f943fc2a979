package com.flagship.prior_auth.integration;

/**
 * Moves wire messages to and from an upstream.
 *
 * Implementations map transport failures onto {@link TransientIntegrationException}
 * (retryable) or {@link com.flagship.prior_auth.error.RemoteRejectionException}
 * (refused by the remote) and must abort promptly when the calling thread is interrupted.
 */
public interface WireTransport {

    WireResponse exchange(String upstream, WireRequest request);
}

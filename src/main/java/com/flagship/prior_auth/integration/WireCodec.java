package com.flagship.prior_auth.integration;

/**
 * Translation between a domain request and one upstream's wire message.
 *
 * Implemented per upstream message; grammars are independent and share no base class.
 *
 * @param <D> domain-side request
 * @param <R> decoded domain-side result
 */
public interface WireCodec<D, R> {

    /**
     * Renders the request in the upstream's wire format.
     */
    String encode(D request);

    /**
     * Parses a wire response.
     *
     * @throws WireProtocolException if the payload is malformed
     */
    R decode(String wireMessage);

    /**
     * Content type sent with encoded requests.
     */
    String contentType();
}

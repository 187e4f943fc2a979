package com.flagship.prior_auth.integration;

import com.flagship.prior_auth.error.RemoteRejectionException;
import com.flagship.prior_auth.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

/**
 * HTTP transport over Spring's {@link RestTemplate}.
 *
 * Failure mapping:
 * - I/O errors and remote 5xx: transient (read timeouts flagged ambiguous)
 * - 429 Too Many Requests: transient
 * - Other 4xx: remote rejection
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RestTemplateWireTransport implements WireTransport {

    private final RestTemplate integrationRestTemplate;

    @Override
    public WireResponse exchange(String upstream, WireRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType(request.getContentType()));
        headers.set(CorrelationContext.CORRELATION_ID_HEADER, CorrelationContext.getCorrelationId());
        request.getHeaders().forEach(headers::set);

        try {
            ResponseEntity<String> response = integrationRestTemplate.exchange(
                    request.getUrl(), HttpMethod.POST, new HttpEntity<>(request.getBody(), headers), String.class);
            log.debug("Upstream={} answered {} for {}", upstream, response.getStatusCode().value(), request.getUrl());
            return new WireResponse(response.getStatusCode().value(), response.getBody());

        } catch (HttpServerErrorException e) {
            throw new TransientIntegrationException(
                    "Upstream " + upstream + " returned " + e.getStatusCode().value(), false, e);

        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw new TransientIntegrationException("Upstream " + upstream + " is throttling requests", false, e);
            }
            throw new RemoteRejectionException(upstream, String.valueOf(e.getStatusCode().value()),
                    "Upstream " + upstream + " rejected the request: " + e.getResponseBodyAsString());

        } catch (ResourceAccessException e) {
            throw new TransientIntegrationException(
                    "I/O failure talking to " + upstream + ": " + e.getMessage(), isReadTimeout(e), e);

        } catch (RestClientException e) {
            throw new WireProtocolException("Unreadable response from " + upstream + ": " + e.getMessage(), e);
        }
    }

    private boolean isReadTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException
                    || t instanceof InterruptedIOException) {
                return true;
            }
        }
        return false;
    }
}

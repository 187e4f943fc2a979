package com.flagship.prior_auth.integration.pharmacy.script;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.prior_auth.authorization.AuthorizationStatus;
import com.flagship.prior_auth.error.RemoteRejectionException;
import com.flagship.prior_auth.integration.RemoteStatusTable;
import com.flagship.prior_auth.integration.TransientIntegrationException;
import com.flagship.prior_auth.integration.WireProtocolException;

import java.io.IOException;
import java.util.Map;

/**
 * Decoding shared by the SCRIPT reply messages.
 */
final class ScriptReplies {

    static final RemoteStatusTable PA_STATUS = new RemoteStatusTable("SCRIPT PA", Map.of(
            "APPROVED", AuthorizationStatus.APPROVED,
            "DENIED", AuthorizationStatus.DENIED,
            "PENDED", AuthorizationStatus.UNDER_REVIEW,
            "CLOSED", AuthorizationStatus.CANCELLED,
            "CANCELLED", AuthorizationStatus.CANCELLED,
            "MORE_INFO", AuthorizationStatus.NEEDS_INFO
    ));

    private ScriptReplies() {
    }

    /**
     * Parses a reply and raises its Error element, if any.
     *
     * @throws WireProtocolException unparsable XML or neither status nor error present
     * @throws TransientIntegrationException the network asked for a later retry
     * @throws RemoteRejectionException the request was refused
     */
    static PaResponseMessage read(ObjectMapper xmlMapper, String wireMessage, String upstream) {
        PaResponseMessage reply;
        try {
            reply = xmlMapper.readValue(wireMessage, PaResponseMessage.class);
        } catch (IOException e) {
            throw new WireProtocolException("Unreadable SCRIPT reply from " + upstream + ": " + e.getMessage(), e);
        }

        PaResponseMessage.ScriptError error = reply.getError();
        if (error != null) {
            if (error.isRetryable()) {
                throw new TransientIntegrationException(
                        "Pharmacy network asked to retry later (" + error.getCode() + ")", false);
            }
            throw new RemoteRejectionException(upstream, error.getCode(),
                    "Pharmacy rejected the request: " + error.getDescription());
        }
        if (reply.getResponseStatus() == null || reply.getResponseStatus().getCode() == null) {
            throw new WireProtocolException("SCRIPT reply from " + upstream + " has no ResponseStatus");
        }
        if (reply.getPaReferenceId() == null || reply.getPaReferenceId().isBlank()) {
            throw new WireProtocolException("SCRIPT reply from " + upstream + " has no PAReferenceID");
        }
        return reply;
    }
}

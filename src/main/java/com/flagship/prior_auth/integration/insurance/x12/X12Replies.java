package com.flagship.prior_auth.integration.insurance.x12;

import com.flagship.prior_auth.authorization.AuthorizationStatus;
import com.flagship.prior_auth.error.RemoteRejectionException;
import com.flagship.prior_auth.integration.RemoteStatusTable;
import com.flagship.prior_auth.integration.TransientIntegrationException;

import java.util.Map;

/**
 * Reply handling shared by the payer transaction sets.
 */
public final class X12Replies {

    /** AAA03 reject reason: authorized source unable to respond at this time. */
    static final String UNABLE_TO_RESPOND = "42";

    /**
     * HCR01 review action codes.
     */
    public static final RemoteStatusTable HCR_ACTIONS = new RemoteStatusTable("X12 HCR", Map.of(
            "A1", AuthorizationStatus.APPROVED,      // certified in total
            "A2", AuthorizationStatus.APPROVED,      // certified, partial
            "A3", AuthorizationStatus.DENIED,        // not certified
            "A4", AuthorizationStatus.UNDER_REVIEW,  // pended
            "A6", AuthorizationStatus.APPROVED,      // modified
            "C", AuthorizationStatus.CANCELLED,
            "CT", AuthorizationStatus.NEEDS_INFO,    // contact payer
            "NA", AuthorizationStatus.APPROVED       // no action required
    ));

    private X12Replies() {
    }

    /**
     * Raises the first AAA (request validation) segment in the reply.
     *
     * @throws TransientIntegrationException the payer is temporarily unable to respond
     * @throws RemoteRejectionException the payer rejected the request
     */
    static void raiseRejections(X12Document reply, String upstream) {
        reply.first("AAA").ifPresent(aaa -> {
            String reason = aaa.element(3);
            if (UNABLE_TO_RESPOND.equals(reason)) {
                throw new TransientIntegrationException(
                        "Payer unable to respond at this time (AAA " + reason + ")", false);
            }
            throw new RemoteRejectionException(upstream, reason,
                    "Payer rejected the request with AAA reason " + reason
                            + (aaa.hasElement(4) ? ", follow-up " + aaa.element(4) : ""));
        });
    }
}

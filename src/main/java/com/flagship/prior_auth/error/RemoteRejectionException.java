package com.flagship.prior_auth.error;

/**
 * The remote side answered and refused the request on business grounds
 * (unknown member, invalid plan, rejected transaction). The remote is healthy,
 * so this never counts against its circuit breaker and is never retried.
 */
public class RemoteRejectionException extends PriorAuthException {

    private final String upstream;
    private final String rejectCode;

    public RemoteRejectionException(String upstream, String rejectCode, String message) {
        super(message, RetryGuidance.DO_NOT_RETRY);
        this.upstream = upstream;
        this.rejectCode = rejectCode;
    }

    public String getUpstream() {
        return upstream;
    }

    public String getRejectCode() {
        return rejectCode;
    }
}

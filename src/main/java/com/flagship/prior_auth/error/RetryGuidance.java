package com.flagship.prior_auth.error;

/**
 * What a caller should do after receiving an error.
 */
public enum RetryGuidance {
    RETRY_LATER,
    REFETCH_AND_RETRY,
    DO_NOT_RETRY
}

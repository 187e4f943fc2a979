package com.flagship.prior_auth.integration.insurance;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Decoded eligibility reply. {@code copayAmount} and {@code formularyTier} are null
 * when the payer did not report them.
 */
@Value
@Builder
public class CoverageResponse {
    boolean covered;
    BigDecimal copayAmount;
    boolean priorAuthRequired;
    String formularyTier;
    String rawEvidence;
}

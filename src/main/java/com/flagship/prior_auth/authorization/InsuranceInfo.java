package com.flagship.prior_auth.authorization;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Coverage identifiers. A non-blank BIN routes submissions to the pharmacy network.
 */
@Value
@Builder
@Jacksonized
public class InsuranceInfo {

    @JsonProperty("payer_id")
    String payerId;

    @JsonProperty("payer_name")
    String payerName;

    @JsonProperty("plan_id")
    String planId;

    @JsonProperty("group_number")
    String groupNumber;

    @JsonProperty("member_id")
    String memberId;

    @JsonProperty("bin")
    String bin;

    @JsonProperty("pcn")
    String pcn;

    @JsonIgnore
    public boolean isPharmacyBenefit() {
        return bin != null && !bin.isBlank();
    }
}

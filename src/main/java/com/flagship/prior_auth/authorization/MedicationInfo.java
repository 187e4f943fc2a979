package com.flagship.prior_auth.authorization;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
@Jacksonized
public class MedicationInfo {

    @JsonProperty("medication_name")
    String medicationName;

    /** National Drug Code, 11 digits, hyphens optional. */
    @JsonProperty("ndc_code")
    String ndcCode;

    @JsonProperty("strength")
    String strength;

    @JsonProperty("form")
    String form;

    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("days_supply")
    Integer daysSupply;

    @JsonProperty("directions")
    String directions;

    @JsonProperty("generic_ok")
    boolean genericOk;

    @Singular
    @JsonProperty("previous_medications")
    List<String> previousMedications;
}

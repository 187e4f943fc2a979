package com.flagship.prior_auth.authorization;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class LabResult {

    @JsonProperty("test_name")
    String testName;

    @JsonProperty("test_code")
    String testCode;

    @JsonProperty("result_value")
    String resultValue;

    @JsonProperty("unit")
    String unit;

    @JsonProperty("test_date")
    LocalDate testDate;
}

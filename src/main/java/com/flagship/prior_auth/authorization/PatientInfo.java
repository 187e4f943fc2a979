package com.flagship.prior_auth.authorization;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class PatientInfo {

    @JsonProperty("patient_id")
    String patientId;

    @JsonProperty("first_name")
    String firstName;

    @JsonProperty("last_name")
    String lastName;

    @JsonProperty("date_of_birth")
    LocalDate dateOfBirth;

    @JsonProperty("gender")
    String gender;

    @JsonProperty("insurance")
    InsuranceInfo insurance;
}

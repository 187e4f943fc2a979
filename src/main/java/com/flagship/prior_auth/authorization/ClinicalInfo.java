package com.flagship.prior_auth.authorization;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Structured clinical justification, already extracted from source documents.
 */
@Value
@Builder
@Jacksonized
public class ClinicalInfo {

    /** ICD-10 codes, primary diagnosis first. */
    @Singular
    @JsonProperty("diagnosis_codes")
    List<String> diagnosisCodes;

    @JsonProperty("clinical_rationale")
    String clinicalRationale;

    @Singular
    @JsonProperty("lab_results")
    List<LabResult> labResults;

    @Singular
    @JsonProperty("contraindications")
    List<String> contraindications;

    @Singular
    @JsonProperty("custom_fields")
    Map<String, String> customFields;
}

package com.flagship.prior_auth.integration.pharmacy.script;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.flagship.prior_auth.integration.pharmacy.EncryptedField;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * SCRIPT-style prior authorization request.
 *
 * Patient identity, drug identity and clinical content travel encrypted. Benefit
 * routing identifiers (BIN, PCN, group) stay readable because intermediaries route on them.
 */
@Value
@Builder
@Jacksonized
@JacksonXmlRootElement(localName = "PARequest")
public class PaRequestMessage {

    @JsonProperty("Header")
    ScriptHeader header;

    @JsonProperty("Patient")
    Patient patient;

    @JsonProperty("BenefitsCoordination")
    Benefits benefits;

    @JsonProperty("MedicationPrescribed")
    Medication medication;

    @JsonProperty("ClinicalInfo")
    Clinical clinical;

    @Value
    @Builder
    @Jacksonized
    public static class Patient {
        @JsonProperty("Name")
        EncryptedField name;

        @JsonProperty("DateOfBirth")
        EncryptedField dateOfBirth;

        @JsonProperty("Gender")
        String gender;
    }

    @Value
    @Builder
    @Jacksonized
    public static class Benefits {
        @JsonProperty("PayerID")
        String payerId;

        @JsonProperty("BIN")
        String bin;

        @JsonProperty("PCN")
        String pcn;

        @JsonProperty("GroupID")
        String groupId;

        @JsonProperty("CardholderID")
        EncryptedField cardholderId;
    }

    @Value
    @Builder
    @Jacksonized
    public static class Medication {
        @JsonProperty("DrugDescription")
        EncryptedField drugDescription;

        @JsonProperty("ProductCode")
        EncryptedField productCode;

        @JsonProperty("Quantity")
        BigDecimal quantity;

        @JsonProperty("DaysSupply")
        Integer daysSupply;

        @JsonProperty("SubstitutionAllowed")
        boolean substitutionAllowed;
    }

    @Value
    @Builder
    @Jacksonized
    public static class Clinical {
        /** ICD-10 codes, comma separated, primary first. */
        @JsonProperty("Diagnoses")
        EncryptedField diagnoses;

        @JsonProperty("Rationale")
        EncryptedField rationale;
    }
}

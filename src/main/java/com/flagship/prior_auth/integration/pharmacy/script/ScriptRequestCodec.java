package com.flagship.prior_auth.integration.pharmacy.script;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.prior_auth.authorization.Authorization;
import com.flagship.prior_auth.authorization.ClinicalInfo;
import com.flagship.prior_auth.authorization.InsuranceInfo;
import com.flagship.prior_auth.authorization.MedicationInfo;
import com.flagship.prior_auth.authorization.PatientInfo;
import com.flagship.prior_auth.authorization.AuthorizationStatus;
import com.flagship.prior_auth.integration.SubmissionResponse;
import com.flagship.prior_auth.integration.WireCodec;
import com.flagship.prior_auth.integration.pharmacy.FieldEncryptor;
import com.flagship.prior_auth.integration.pharmacy.PharmacySubmission;

import java.time.Clock;
import java.time.Instant;

/**
 * Maps an authorization onto a PA request message, encrypting the protected fields.
 * Encoding fails with a configuration error before anything is sent when no key is set.
 */
public class ScriptRequestCodec implements WireCodec<PharmacySubmission, SubmissionResponse> {

    private final ObjectMapper xmlMapper;
    private final FieldEncryptor encryptor;
    private final String senderId;
    private final String upstream;
    private final Clock clock;

    public ScriptRequestCodec(ObjectMapper xmlMapper, FieldEncryptor encryptor, String senderId,
                              String upstream, Clock clock) {
        this.xmlMapper = xmlMapper;
        this.encryptor = encryptor;
        this.senderId = senderId;
        this.upstream = upstream;
        this.clock = clock;
    }

    @Override
    public String encode(PharmacySubmission submission) {
        Authorization authorization = submission.getAuthorization();
        PatientInfo patient = authorization.getPatient();
        InsuranceInfo insurance = patient.getInsurance();
        MedicationInfo medication = authorization.getMedication();
        ClinicalInfo clinical = authorization.getClinical();

        PaRequestMessage.PaRequestMessageBuilder message = PaRequestMessage.builder()
                .header(ScriptHeader.builder()
                        .messageId(submission.getIdempotencyKey().asHeaderValue())
                        .sentTime(Instant.now(clock))
                        .from(senderId)
                        .to(insurance.getBin())
                        .build())
                .patient(PaRequestMessage.Patient.builder()
                        .name(encryptor.encrypt(patient.getLastName() + ", " + patient.getFirstName()))
                        .dateOfBirth(encryptor.encrypt(
                                patient.getDateOfBirth() != null ? patient.getDateOfBirth().toString() : ""))
                        .gender(patient.getGender())
                        .build())
                .benefits(PaRequestMessage.Benefits.builder()
                        .payerId(insurance.getPayerId())
                        .bin(insurance.getBin())
                        .pcn(insurance.getPcn())
                        .groupId(insurance.getGroupNumber())
                        .cardholderId(encryptor.encrypt(insurance.getMemberId()))
                        .build())
                .medication(PaRequestMessage.Medication.builder()
                        .drugDescription(encryptor.encrypt(describe(medication)))
                        .productCode(encryptor.encrypt(medication.getNdcCode()))
                        .quantity(medication.getQuantity())
                        .daysSupply(medication.getDaysSupply())
                        .substitutionAllowed(medication.isGenericOk())
                        .build());

        if (clinical != null) {
            message.clinical(PaRequestMessage.Clinical.builder()
                    .diagnoses(encryptor.encrypt(String.join(",", clinical.getDiagnosisCodes())))
                    .rationale(encryptor.encrypt(clinical.getClinicalRationale()))
                    .build());
        }

        try {
            return xmlMapper.writeValueAsString(message.build());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render SCRIPT PA request", e);
        }
    }

    @Override
    public SubmissionResponse decode(String wireMessage) {
        PaResponseMessage reply = ScriptReplies.read(xmlMapper, wireMessage, upstream);
        String code = reply.getResponseStatus().getCode();
        AuthorizationStatus decision = ScriptReplies.PA_STATUS.lookup(code)
                .filter(status -> status == AuthorizationStatus.APPROVED || status == AuthorizationStatus.DENIED)
                .orElse(null);
        return SubmissionResponse.builder()
                .externalReferenceId(reply.getPaReferenceId())
                .remoteStatusCode(code)
                .initialDecision(decision)
                .rawEvidence(wireMessage)
                .build();
    }

    @Override
    public String contentType() {
        return "application/xml";
    }

    private static String describe(MedicationInfo medication) {
        StringBuilder out = new StringBuilder(medication.getMedicationName());
        if (medication.getStrength() != null) {
            out.append(' ').append(medication.getStrength());
        }
        if (medication.getForm() != null) {
            out.append(' ').append(medication.getForm());
        }
        return out.toString();
    }
}

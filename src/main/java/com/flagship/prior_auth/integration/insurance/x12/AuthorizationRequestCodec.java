package com.flagship.prior_auth.integration.insurance.x12;

import com.flagship.prior_auth.authorization.AuthorizationStatus;
import com.flagship.prior_auth.authorization.ClinicalInfo;
import com.flagship.prior_auth.authorization.InsuranceInfo;
import com.flagship.prior_auth.authorization.MedicationInfo;
import com.flagship.prior_auth.authorization.PatientInfo;
import com.flagship.prior_auth.integration.SubmissionResponse;
import com.flagship.prior_auth.integration.WireCodec;
import com.flagship.prior_auth.integration.WireProtocolException;
import com.flagship.prior_auth.integration.insurance.SubmissionRequest;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * 278 services review request and its reply.
 *
 * The idempotency key travels as the BHT reference and the TRN trace number so a
 * payer that deduplicates on either sees a resubmission as the same request.
 */
public class AuthorizationRequestCodec implements WireCodec<SubmissionRequest, SubmissionResponse> {

    static final String IMPLEMENTATION_GUIDE = "005010X217";
    private static final DateTimeFormatter DOB = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final int MSG_LIMIT = 264;

    private final X12Envelope envelope;
    private final String upstream;

    public AuthorizationRequestCodec(X12Envelope envelope, String upstream) {
        this.envelope = envelope;
        this.upstream = upstream;
    }

    @Override
    public String encode(SubmissionRequest request) {
        PatientInfo patient = request.getPatient();
        InsuranceInfo insurance = patient.getInsurance();
        MedicationInfo medication = request.getMedication();
        ClinicalInfo clinical = request.getClinical();
        String key = request.getIdempotencyKey().asHeaderValue();
        LocalDateTime now = envelope.now();

        List<X12Segment> body = new ArrayList<>();
        // 0007 = original request, 13 = request
        body.add(X12Segment.of("BHT", "0007", "13", key, X12Envelope.date(now), X12Envelope.time(now)));
        body.add(X12Segment.of("HL", "1", "", "20", "1"));
        body.add(X12Segment.of("NM1", "X3", "2", insurance.getPayerName(), "", "", "", "", "PI", insurance.getPayerId()));
        body.add(X12Segment.of("HL", "2", "1", "21", "1"));
        body.add(X12Segment.of("NM1", "1P", "2", envelope.getSenderId(), "", "", "", "", "XX", envelope.getSenderId()));
        body.add(X12Segment.of("HL", "3", "2", "22", "1"));
        body.add(X12Segment.of("NM1", "IL", "1", patient.getLastName(), patient.getFirstName(),
                "", "", "", "MI", insurance.getMemberId()));
        if (patient.getDateOfBirth() != null) {
            body.add(X12Segment.of("DMG", "D8", DOB.format(patient.getDateOfBirth()), patient.getGender()));
        }
        body.add(X12Segment.of("HL", "4", "3", "EV", "0"));
        // HS = health services review, I = initial
        body.add(X12Segment.of("UM", "HS", "I"));
        body.add(X12Segment.of("TRN", "1", key, envelope.getSenderId()));

        if (clinical != null && !clinical.getDiagnosisCodes().isEmpty()) {
            List<String> codes = clinical.getDiagnosisCodes();
            String[] elements = new String[Math.min(codes.size(), 12)];
            for (int i = 0; i < elements.length; i++) {
                // ABK = principal ICD-10 diagnosis, ABF = additional
                elements[i] = X12Segment.composite(i == 0 ? "ABK" : "ABF", codes.get(i).replace(".", ""));
            }
            body.add(X12Segment.of("HI", elements));
        }

        body.add(X12Segment.of("LIN", "", "N4", medication.getNdcCode().replace("-", "")));
        if (medication.getQuantity() != null) {
            body.add(X12Segment.of("QTY", "FL", medication.getQuantity().toPlainString()));
        }
        if (medication.getDaysSupply() != null) {
            body.add(X12Segment.of("QTY", "DY", medication.getDaysSupply().toString()));
        }
        if (clinical != null && clinical.getClinicalRationale() != null) {
            String rationale = clinical.getClinicalRationale();
            body.add(X12Segment.of("MSG", rationale.length() > MSG_LIMIT ? rationale.substring(0, MSG_LIMIT) : rationale));
        }
        return envelope.wrap("HI", "278", IMPLEMENTATION_GUIDE, body);
    }

    @Override
    public SubmissionResponse decode(String wireMessage) {
        X12Document reply = X12Document.parse(wireMessage).requireTransactionSet("278");
        X12Replies.raiseRejections(reply, upstream);

        X12Segment hcr = reply.first("HCR")
                .orElseThrow(() -> new WireProtocolException("278 reply carries no HCR review outcome"));
        String actionCode = hcr.element(1);
        String reference = hcr.hasElement(2)
                ? hcr.element(2)
                : reply.reference("BB").orElseThrow(() ->
                        new WireProtocolException("278 reply carries no certification or authorization number"));

        AuthorizationStatus decision = X12Replies.HCR_ACTIONS.lookup(actionCode)
                .filter(status -> status == AuthorizationStatus.APPROVED || status == AuthorizationStatus.DENIED)
                .orElse(null);

        return SubmissionResponse.builder()
                .externalReferenceId(reference)
                .remoteStatusCode(actionCode)
                .initialDecision(decision)
                .rawEvidence(wireMessage)
                .build();
    }

    @Override
    public String contentType() {
        return "application/edi-x12";
    }
}

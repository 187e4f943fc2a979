package com.flagship.prior_auth.integration.insurance.x12;

import com.flagship.prior_auth.authorization.InsuranceInfo;
import com.flagship.prior_auth.authorization.PatientInfo;
import com.flagship.prior_auth.integration.WireCodec;
import com.flagship.prior_auth.integration.WireProtocolException;
import com.flagship.prior_auth.integration.insurance.CoverageResponse;
import com.flagship.prior_auth.integration.insurance.EligibilityRequest;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * 270 eligibility inquiry and 271 reply.
 *
 * 271 interpretation:
 * - EB01 {@code 1} (active coverage) marks the drug as covered
 * - EB01 {@code B} carries the co-payment amount in EB07
 * - EB11 {@code Y} on any benefit means prior authorization is required
 * - {@code REF*FT} carries the formulary tier
 */
public class EligibilityCodec implements WireCodec<EligibilityRequest, CoverageResponse> {

    static final String IMPLEMENTATION_GUIDE = "005010X279A1";
    private static final String ACTIVE_COVERAGE = "1";
    private static final String CO_PAYMENT = "B";
    private static final String YES = "Y";
    private static final DateTimeFormatter DOB = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final X12Envelope envelope;
    private final String upstream;

    public EligibilityCodec(X12Envelope envelope, String upstream) {
        this.envelope = envelope;
        this.upstream = upstream;
    }

    @Override
    public String encode(EligibilityRequest request) {
        PatientInfo patient = request.getPatient();
        InsuranceInfo insurance = patient.getInsurance();
        LocalDateTime now = envelope.now();
        String trace = request.getAuthorizationId().toString();

        List<X12Segment> body = new ArrayList<>();
        body.add(X12Segment.of("BHT", "0022", "13", trace, X12Envelope.date(now), X12Envelope.time(now)));
        body.add(X12Segment.of("HL", "1", "", "20", "1"));
        body.add(X12Segment.of("NM1", "PR", "2", insurance.getPayerName(), "", "", "", "", "PI", insurance.getPayerId()));
        body.add(X12Segment.of("HL", "2", "1", "21", "1"));
        body.add(X12Segment.of("NM1", "1P", "2", envelope.getSenderId(), "", "", "", "", "XX", envelope.getSenderId()));
        body.add(X12Segment.of("HL", "3", "2", "22", "0"));
        body.add(X12Segment.of("TRN", "1", trace, envelope.getSenderId()));
        body.add(X12Segment.of("NM1", "IL", "1", patient.getLastName(), patient.getFirstName(),
                "", "", "", "MI", insurance.getMemberId()));
        if (insurance.getGroupNumber() != null) {
            body.add(X12Segment.of("REF", "6P", insurance.getGroupNumber()));
        }
        if (insurance.getPlanId() != null) {
            body.add(X12Segment.of("REF", "18", insurance.getPlanId()));
        }
        if (patient.getDateOfBirth() != null) {
            body.add(X12Segment.of("DMG", "D8", DOB.format(patient.getDateOfBirth()), patient.getGender()));
        }
        body.add(X12Segment.of("DTP", "291", "D8", X12Envelope.date(now)));
        // 88 = pharmacy
        body.add(X12Segment.of("EQ", "88"));
        if (request.getMedication() != null && request.getMedication().getNdcCode() != null) {
            body.add(X12Segment.of("LIN", "", "N4", request.getMedication().getNdcCode().replace("-", "")));
        }
        return envelope.wrap("HS", "270", IMPLEMENTATION_GUIDE, body);
    }

    @Override
    public CoverageResponse decode(String wireMessage) {
        X12Document reply = X12Document.parse(wireMessage).requireTransactionSet("271");
        X12Replies.raiseRejections(reply, upstream);

        List<X12Segment> benefits = reply.all("EB");
        if (benefits.isEmpty()) {
            throw new WireProtocolException("271 reply carries no EB benefit segments");
        }

        boolean covered = false;
        boolean priorAuthRequired = false;
        BigDecimal copay = null;
        for (X12Segment eb : benefits) {
            String code = eb.element(1);
            if (ACTIVE_COVERAGE.equals(code)) {
                covered = true;
            }
            if (CO_PAYMENT.equals(code) && eb.hasElement(7)) {
                copay = parseAmount(eb.element(7));
            }
            if (YES.equals(eb.element(11))) {
                priorAuthRequired = true;
            }
        }

        return CoverageResponse.builder()
                .covered(covered)
                .copayAmount(copay)
                .priorAuthRequired(priorAuthRequired)
                .formularyTier(reply.reference("FT").orElse(null))
                .rawEvidence(wireMessage)
                .build();
    }

    @Override
    public String contentType() {
        return "application/edi-x12";
    }

    private static BigDecimal parseAmount(String value) {
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new WireProtocolException("Unreadable co-payment amount '" + value + "'", e);
        }
    }
}

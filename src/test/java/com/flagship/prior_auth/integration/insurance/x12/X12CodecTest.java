package com.flagship.prior_auth.integration.insurance.x12;

import com.flagship.prior_auth.authorization.AuthorizationFixtures;
import com.flagship.prior_auth.authorization.AuthorizationStatus;
import com.flagship.prior_auth.authorization.PatientInfo;
import com.flagship.prior_auth.error.RemoteRejectionException;
import com.flagship.prior_auth.integration.StatusResponse;
import com.flagship.prior_auth.integration.SubmissionResponse;
import com.flagship.prior_auth.integration.TransientIntegrationException;
import com.flagship.prior_auth.integration.WireProtocolException;
import com.flagship.prior_auth.integration.idempotency.SubmissionKey;
import com.flagship.prior_auth.integration.insurance.CoverageResponse;
import com.flagship.prior_auth.integration.insurance.EligibilityRequest;
import com.flagship.prior_auth.integration.insurance.SubmissionRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class X12CodecTest {

    private static final String UPSTREAM = "insurance-submission";

    private X12Envelope envelope;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-02T14:30:00Z"), ZoneOffset.UTC);
        envelope = new X12Envelope("EPAENGINE", "PAYER", clock);
    }

    private static SubmissionKey key() {
        return new SubmissionKey(UUID.fromString("7d9f3c1e-2b4a-4c8e-9f10-5a6b7c8d9e0f"),
                UUID.randomUUID(), UPSTREAM, 1, false);
    }

    private static SubmissionRequest submission() {
        return SubmissionRequest.builder()
                .authorizationId(UUID.randomUUID())
                .patient(AuthorizationFixtures.patient(AuthorizationFixtures.medicalInsurance()))
                .medication(AuthorizationFixtures.medication())
                .clinical(AuthorizationFixtures.clinical())
                .idempotencyKey(key())
                .build();
    }

    private static String reply(String transactionSet, String... body) {
        StringBuilder out = new StringBuilder()
                .append("ISA*00*          *00*          *ZZ*PAYER          *ZZ*EPAENGINE      ")
                .append("*260302*1430*^*00501*000000001*0*P*:~\n")
                .append("GS*HB*PAYER*EPAENGINE*20260302*1430*1*X*005010~\n")
                .append("ST*").append(transactionSet).append("*0001~\n");
        for (String segment : body) {
            out.append(segment).append("~\n");
        }
        return out.append("SE*").append(body.length + 2).append("*0001~\nGE*1*1~\nIEA*1*000000001~\n").toString();
    }

    @Test
    @DisplayName("278 request carries the idempotency key as BHT reference and TRN trace")
    void encodesSubmission() {
        AuthorizationRequestCodec codec = new AuthorizationRequestCodec(envelope, UPSTREAM);

        String wire = codec.encode(submission());
        X12Document document = X12Document.parse(wire);

        X12Segment bht = document.first("BHT").orElseThrow();
        assertEquals("0007", bht.element(1));
        assertEquals("13", bht.element(2));
        assertEquals("7d9f3c1e-2b4a-4c8e-9f10-5a6b7c8d9e0f", bht.element(3));
        assertEquals("20260302", bht.element(4));

        X12Segment trn = document.first("TRN").orElseThrow();
        assertEquals("7d9f3c1e-2b4a-4c8e-9f10-5a6b7c8d9e0f", trn.element(2));

        X12Segment hi = document.first("HI").orElseThrow();
        assertEquals("ABK:E119", hi.element(1));
        assertEquals("ABF:E6601", hi.element(2));

        assertEquals("0169413212", document.first("LIN").orElseThrow().element(3));
        assertTrue(wire.contains("QTY*FL*3~"));
        assertTrue(wire.contains("QTY*DY*28~"));
        assertTrue(wire.contains("NM1*IL*1*Rivera*Jordan****MI*W123456789~"));
        assertTrue(wire.contains("DMG*D8*19750314*F~"));
        assertEquals(AuthorizationRequestCodec.IMPLEMENTATION_GUIDE, document.first("ST").orElseThrow().element(3));
    }

    @Test
    @DisplayName("SE01 counts every segment from ST to SE inclusive")
    void transactionSegmentCount() {
        String wire = new AuthorizationRequestCodec(envelope, UPSTREAM).encode(submission());
        List<X12Segment> segments = X12Document.parse(wire).segments();

        int st = -1;
        int se = -1;
        for (int i = 0; i < segments.size(); i++) {
            if (segments.get(i).getId().equals("ST")) st = i;
            if (segments.get(i).getId().equals("SE")) se = i;
        }

        assertEquals(se - st + 1, Integer.parseInt(segments.get(se).element(1)));
        assertEquals(segments.get(st).element(2), segments.get(se).element(2));
    }

    @Test
    @DisplayName("Delimiters inside free-text values are neutralised")
    void sanitizesDelimiters() {
        PatientInfo patient = PatientInfo.builder()
                .firstName("Jordan")
                .lastName("O*Brien~")
                .insurance(AuthorizationFixtures.medicalInsurance())
                .build();
        SubmissionRequest request = SubmissionRequest.builder()
                .authorizationId(UUID.randomUUID())
                .patient(patient)
                .medication(AuthorizationFixtures.medication())
                .clinical(AuthorizationFixtures.clinical())
                .idempotencyKey(key())
                .build();

        String wire = new AuthorizationRequestCodec(envelope, UPSTREAM).encode(request);

        X12Segment subscriber = X12Document.parse(wire).all("NM1").stream()
                .filter(nm1 -> nm1.element(1).equals("IL"))
                .findFirst().orElseThrow();
        assertEquals("O Brien ", subscriber.element(3));
        assertEquals("W123456789", subscriber.element(9));
    }

    @Test
    @DisplayName("271 reply decodes coverage, co-payment, prior auth flag and formulary tier")
    void decodesEligibility() {
        EligibilityCodec codec = new EligibilityCodec(envelope, "insurance-eligibility");
        String wire = reply("271",
                "BHT*0022*11*TRACE*20260302*1430",
                "EB*1*IND**88",
                "EB*B*IND**88***25.00****Y",
                "REF*FT*2");

        CoverageResponse coverage = codec.decode(wire);

        assertTrue(coverage.isCovered());
        assertEquals(new BigDecimal("25.00"), coverage.getCopayAmount());
        assertTrue(coverage.isPriorAuthRequired());
        assertEquals("2", coverage.getFormularyTier());
        assertEquals(wire, coverage.getRawEvidence());
    }

    @Test
    @DisplayName("271 reply with inactive coverage and no tier")
    void decodesInactiveCoverage() {
        CoverageResponse coverage = new EligibilityCodec(envelope, "insurance-eligibility")
                .decode(reply("271", "EB*6*IND**88"));

        assertFalse(coverage.isCovered());
        assertFalse(coverage.isPriorAuthRequired());
        assertNull(coverage.getCopayAmount());
        assertNull(coverage.getFormularyTier());
    }

    @Test
    @DisplayName("270 inquiry names the member, plan and drug")
    void encodesEligibility() {
        EligibilityRequest request = EligibilityRequest.builder()
                .authorizationId(UUID.randomUUID())
                .patient(AuthorizationFixtures.patient(AuthorizationFixtures.medicalInsurance()))
                .medication(AuthorizationFixtures.medication())
                .build();

        String wire = new EligibilityCodec(envelope, "insurance-eligibility").encode(request);
        X12Document document = X12Document.parse(wire);

        assertEquals("270", document.first("ST").orElseThrow().element(1));
        assertEquals("HS", document.first("GS").orElseThrow().element(1));
        assertEquals("GRP-778", document.reference("6P").orElseThrow());
        assertEquals("PPO-100", document.reference("18").orElseThrow());
        assertEquals("88", document.first("EQ").orElseThrow().element(1));
        assertEquals("0169413212", document.first("LIN").orElseThrow().element(3));
    }

    @Test
    @DisplayName("278 reply with A1 is an approval carrying the certification number")
    void decodesApprovedSubmission() {
        SubmissionResponse response = new AuthorizationRequestCodec(envelope, UPSTREAM)
                .decode(reply("278", "HCR*A1*AUTH-55821"));

        assertEquals("AUTH-55821", response.getExternalReferenceId());
        assertEquals("A1", response.getRemoteStatusCode());
        assertEquals(AuthorizationStatus.APPROVED, response.getInitialDecision());
    }

    @Test
    @DisplayName("A pended 278 reply has no initial decision and takes its reference from REF*BB")
    void decodesPendedSubmission() {
        SubmissionResponse response = new AuthorizationRequestCodec(envelope, UPSTREAM)
                .decode(reply("278", "HCR*A4", "REF*BB*PEND-0042"));

        assertEquals("PEND-0042", response.getExternalReferenceId());
        assertNull(response.getInitialDecision());
    }

    @Test
    @DisplayName("A 278 reply without any reference is malformed")
    void submissionWithoutReference() {
        AuthorizationRequestCodec codec = new AuthorizationRequestCodec(envelope, UPSTREAM);

        assertThrows(WireProtocolException.class, () -> codec.decode(reply("278", "HCR*A4")));
    }

    @Test
    @DisplayName("AAA reason 42 is transient, any other reason is a business rejection")
    void validationSegments() {
        AuthorizationRequestCodec codec = new AuthorizationRequestCodec(envelope, UPSTREAM);

        assertThrows(TransientIntegrationException.class,
                () -> codec.decode(reply("278", "AAA*N**42*R")));

        RemoteRejectionException rejection = assertThrows(RemoteRejectionException.class,
                () -> codec.decode(reply("278", "AAA*N**72*C")));
        assertEquals("72", rejection.getRejectCode());
        assertEquals(UPSTREAM, rejection.getUpstream());
        assertTrue(rejection.getMessage().contains("follow-up C"));
    }

    @Test
    @DisplayName("A reply for a different transaction set or garbage text is rejected")
    void wrongTransactionSet() {
        EligibilityCodec codec = new EligibilityCodec(envelope, "insurance-eligibility");

        assertThrows(WireProtocolException.class, () -> codec.decode(reply("278", "HCR*A1*X")));
        assertThrows(WireProtocolException.class, () -> codec.decode("<html>502 Bad Gateway</html>"));
        assertThrows(WireProtocolException.class, () -> codec.decode("  "));
    }

    @Test
    @DisplayName("Status inquiry maps HCR codes and collects MSG notes")
    void decodesStatusInquiry() {
        StatusInquiryCodec codec = new StatusInquiryCodec(envelope, "insurance-status");

        StatusResponse denied = codec.decode(reply("278", "HCR*A3*AUTH-1", "MSG*Step therapy not met", "MSG*Resubmit with chart notes"));
        assertEquals(AuthorizationStatus.DENIED, denied.getMappedStatus());
        assertTrue(denied.isRecognized());
        assertEquals("Step therapy not met Resubmit with chart notes", denied.getNotes());

        StatusResponse pended = codec.decode(reply("278", "HCR*A4", "REF*BB*AUTH-1"));
        assertEquals(AuthorizationStatus.UNDER_REVIEW, pended.getMappedStatus());
        assertEquals("AUTH-1", pended.getExternalReferenceId());
        assertNull(pended.getNotes());
    }

    @Test
    @DisplayName("An unmapped HCR code becomes NEEDS_INFO and keeps the raw code in the evidence")
    void unmappedStatusCode() {
        StatusResponse response = new StatusInquiryCodec(envelope, "insurance-status")
                .decode(reply("278", "HCR*ZZ*AUTH-9"));

        assertEquals(AuthorizationStatus.NEEDS_INFO, response.getMappedStatus());
        assertFalse(response.isRecognized());
        assertEquals("ZZ", response.getRemoteStatusCode());
        assertTrue(response.getRawEvidence().contains("Unmapped X12 HCR status code 'ZZ'"));
    }

    @Test
    @DisplayName("Status inquiry carries the payer reference as REF*BB")
    void encodesStatusInquiry() {
        String wire = new StatusInquiryCodec(envelope, "insurance-status").encode("AUTH-55821");

        X12Document document = X12Document.parse(wire);
        assertEquals("AUTH-55821", document.reference("BB").orElseThrow());
        assertEquals(StatusInquiryCodec.IMPLEMENTATION_GUIDE, document.first("GS").orElseThrow().element(8));
    }

    @Test
    @DisplayName("Control numbers increase between interchanges")
    void controlNumbersIncrease() {
        StatusInquiryCodec codec = new StatusInquiryCodec(envelope, "insurance-status");

        long first = Long.parseLong(X12Document.parse(codec.encode("A")).first("ISA").orElseThrow().element(13));
        long second = Long.parseLong(X12Document.parse(codec.encode("B")).first("ISA").orElseThrow().element(13));

        assertEquals(first + 1, second);
    }
}

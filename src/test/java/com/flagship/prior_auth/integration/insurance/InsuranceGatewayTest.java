package com.flagship.prior_auth.integration.insurance;

import com.flagship.prior_auth.authorization.AuthorizationFixtures;
import com.flagship.prior_auth.authorization.AuthorizationStatus;
import com.flagship.prior_auth.authorization.InsuranceInfo;
import com.flagship.prior_auth.authorization.PatientInfo;
import com.flagship.prior_auth.config.IntegrationProperties;
import com.flagship.prior_auth.error.IntegrationUnavailableException;
import com.flagship.prior_auth.error.RemoteRejectionException;
import com.flagship.prior_auth.error.ValidationException;
import com.flagship.prior_auth.integration.RecordingWireTransport;
import com.flagship.prior_auth.integration.StatusResponse;
import com.flagship.prior_auth.integration.SubmissionResponse;
import com.flagship.prior_auth.integration.TransientIntegrationException;
import com.flagship.prior_auth.integration.idempotency.SubmissionKey;
import com.flagship.prior_auth.integration.resilience.CallDeadline;
import com.flagship.prior_auth.integration.resilience.ResiliencePolicyRegistry;
import com.flagship.prior_auth.integration.resilience.TestPolicies;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InsuranceGatewayTest {

    private RecordingWireTransport transport;
    private ResiliencePolicyRegistry policies;
    private InsuranceGateway gateway;

    @BeforeEach
    void setUp() {
        IntegrationProperties properties = TestPolicies.fastProperties();
        properties.getInsurance().setBaseUrl("https://payer.test");
        properties.getInsurance().setApiKey("payer-secret");
        transport = new RecordingWireTransport();
        policies = TestPolicies.fastRegistry(properties);
        gateway = new InsuranceGateway(properties.getInsurance(), transport, policies,
                Clock.fixed(Instant.parse("2026-03-02T14:30:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        policies.shutdown();
    }

    private static CallDeadline deadline() {
        return CallDeadline.after(Duration.ofSeconds(10));
    }

    private static String reply(String transactionSet, String... body) {
        StringBuilder out = new StringBuilder("ISA*00*          *00*          *ZZ*PAYER          *ZZ*EPAENGINE      "
                + "*260302*1430*^*00501*000000001*0*P*:~\nST*" + transactionSet + "*0001~\n");
        for (String segment : body) {
            out.append(segment).append("~\n");
        }
        return out.append("SE*").append(body.length + 2).append("*0001~\nIEA*1*000000001~\n").toString();
    }

    private static SubmissionRequest submission(SubmissionKey key) {
        return SubmissionRequest.builder()
                .authorizationId(key.getAuthorizationId())
                .patient(AuthorizationFixtures.patient(AuthorizationFixtures.medicalInsurance()))
                .medication(AuthorizationFixtures.medication())
                .clinical(AuthorizationFixtures.clinical())
                .idempotencyKey(key)
                .build();
    }

    private static SubmissionKey key(boolean reused) {
        return new SubmissionKey(UUID.randomUUID(), UUID.randomUUID(), "insurance-submission", 1, reused);
    }

    @Test
    @DisplayName("Eligibility with a missing member id fails validation with zero network calls")
    void eligibilityValidation() {
        PatientInfo patient = PatientInfo.builder()
                .firstName("Jordan")
                .lastName("Rivera")
                .insurance(InsuranceInfo.builder().payerId("60054").payerName("Aetna").memberId(" ").build())
                .build();
        EligibilityRequest request = EligibilityRequest.builder()
                .authorizationId(UUID.randomUUID())
                .patient(patient)
                .build();

        ValidationException e = assertThrows(ValidationException.class,
                () -> gateway.checkEligibility(request, deadline()));

        assertTrue(e.getViolations().contains("member id is required"));
        assertTrue(e.getViolations().contains("medication NDC code is required"));
        assertEquals(0, transport.calls());
    }

    @Test
    @DisplayName("Eligibility decodes the 271 reply from the eligibility upstream")
    void eligibility() {
        transport.reply(reply("271", "EB*1*IND**88", "EB*B*IND**88***40.00****Y", "REF*FT*3"));
        EligibilityRequest request = EligibilityRequest.builder()
                .authorizationId(UUID.randomUUID())
                .patient(AuthorizationFixtures.patient(AuthorizationFixtures.medicalInsurance()))
                .medication(AuthorizationFixtures.medication())
                .build();

        CoverageResponse coverage = gateway.checkEligibility(request, deadline());

        assertTrue(coverage.isCovered());
        assertTrue(coverage.isPriorAuthRequired());
        assertEquals(new BigDecimal("40.00"), coverage.getCopayAmount());
        assertEquals("3", coverage.getFormularyTier());
        assertEquals(List.of("insurance-eligibility"), transport.upstreams());
        assertEquals("https://payer.test/x12/270", transport.lastRequest().getUrl());
        assertEquals("payer-secret", transport.lastRequest().getHeaders().get("X-API-Key"));
        assertNull(transport.lastRequest().getHeaders().get(InsuranceGateway.IDEMPOTENCY_KEY_HEADER));
    }

    @Test
    @DisplayName("Submission without diagnosis codes is rejected before any I/O")
    void submissionValidation() {
        SubmissionKey key = key(false);
        SubmissionRequest request = SubmissionRequest.builder()
                .authorizationId(key.getAuthorizationId())
                .patient(AuthorizationFixtures.patient(AuthorizationFixtures.medicalInsurance()))
                .medication(AuthorizationFixtures.medication())
                .idempotencyKey(key)
                .build();

        ValidationException e = assertThrows(ValidationException.class,
                () -> gateway.submitAuthorization(request, deadline()));

        assertEquals(List.of("at least one diagnosis code is required"), e.getViolations());
        assertEquals(0, transport.calls());
    }

    @Test
    @DisplayName("Every retry of a submission carries the same idempotency key")
    void retriesReuseIdempotencyKey() {
        SubmissionKey key = key(false);
        transport.fail(new TransientIntegrationException("HTTP 503", false))
                .fail(new TransientIntegrationException("read timed out", true))
                .reply(reply("278", "HCR*A4", "REF*BB*PEND-77"));

        SubmissionResponse response = gateway.submitAuthorization(submission(key), deadline());

        assertEquals("PEND-77", response.getExternalReferenceId());
        assertNull(response.getInitialDecision());
        assertEquals(3, transport.calls());
        transport.requests().forEach(request -> {
            assertEquals(key.asHeaderValue(), request.getHeaders().get(InsuranceGateway.IDEMPOTENCY_KEY_HEADER));
            assertTrue(request.getBody().contains("TRN*1*" + key.asHeaderValue()));
        });
    }

    @Test
    @DisplayName("A payer rejection is surfaced once and not retried")
    void rejectionNotRetried() {
        transport.reply(reply("278", "AAA*N**75*C"));

        RemoteRejectionException e = assertThrows(RemoteRejectionException.class,
                () -> gateway.submitAuthorization(submission(key(false)), deadline()));

        assertEquals("75", e.getRejectCode());
        assertEquals(1, transport.calls());
    }

    @Test
    @DisplayName("Status inquiry maps A1 to APPROVED and A4 to UNDER_REVIEW")
    void statusMapping() {
        transport.reply(reply("278", "HCR*A1*AUTH-1"));
        StatusResponse approved = gateway.checkStatus("AUTH-1", deadline());
        assertEquals(AuthorizationStatus.APPROVED, approved.getMappedStatus());

        transport.reply(reply("278", "HCR*A4*AUTH-1"));
        StatusResponse pended = gateway.checkStatus("AUTH-1", deadline());
        assertEquals(AuthorizationStatus.UNDER_REVIEW, pended.getMappedStatus());
        assertEquals("https://payer.test/x12/278/inquiry", transport.lastRequest().getUrl());
    }

    @Test
    @DisplayName("An unknown payer code maps to NEEDS_INFO with the code kept as evidence")
    void unknownStatusCode() {
        transport.reply(reply("278", "HCR*Q9*AUTH-1"));

        StatusResponse status = gateway.checkStatus("AUTH-1", deadline());

        assertEquals(AuthorizationStatus.NEEDS_INFO, status.getMappedStatus());
        assertFalse(status.isRecognized());
        assertTrue(status.getRawEvidence().contains("'Q9'"));
    }

    @Test
    @DisplayName("Status inquiry needs a reference id")
    void statusNeedsReference() {
        assertThrows(ValidationException.class, () -> gateway.checkStatus(" ", deadline()));
        assertEquals(0, transport.calls());
    }

    @Test
    @DisplayName("Persistent transient failures exhaust the budget and report the upstream")
    void exhaustedRetries() {
        transport.fail(new TransientIntegrationException("HTTP 502", false));

        IntegrationUnavailableException e = assertThrows(IntegrationUnavailableException.class,
                () -> gateway.checkStatus("AUTH-1", deadline()));

        assertEquals("insurance-status", e.getUpstream());
        assertEquals(3, transport.calls());
    }
}

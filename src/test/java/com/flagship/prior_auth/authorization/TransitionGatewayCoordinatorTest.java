package com.flagship.prior_auth.authorization;

import com.flagship.prior_auth.error.RemoteRejectionException;
import com.flagship.prior_auth.error.ValidationException;
import com.flagship.prior_auth.integration.StatusResponse;
import com.flagship.prior_auth.integration.SubmissionResponse;
import com.flagship.prior_auth.integration.Upstream;
import com.flagship.prior_auth.integration.idempotency.SubmissionIdempotencyService;
import com.flagship.prior_auth.integration.idempotency.SubmissionKey;
import com.flagship.prior_auth.integration.insurance.CoverageResponse;
import com.flagship.prior_auth.integration.insurance.EligibilityRequest;
import com.flagship.prior_auth.integration.insurance.InsuranceGateway;
import com.flagship.prior_auth.integration.insurance.SubmissionRequest;
import com.flagship.prior_auth.integration.pharmacy.PharmacyGateway;
import com.flagship.prior_auth.integration.resilience.CallDeadline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransitionGatewayCoordinatorTest {

    @Mock
    private InsuranceGateway insuranceGateway;

    @Mock
    private PharmacyGateway pharmacyGateway;

    @Mock
    private SubmissionIdempotencyService idempotencyService;

    private TransitionGatewayCoordinator coordinator;
    private CallDeadline deadline;

    @BeforeEach
    void setUp() {
        coordinator = new TransitionGatewayCoordinator(insuranceGateway, pharmacyGateway, idempotencyService);
        deadline = CallDeadline.after(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Transitions without a gateway action make no calls")
    void noActionMakesNoCalls() {
        GatewayOutcome outcome = coordinator.confirm(AuthorizationFixtures.draft(), AuthorizationStatus.CANCELLED, deadline);

        assertTrue(outcome.getMetadata().isEmpty());
        assertTrue(outcome.getWorkflowEvents().isEmpty());
        verifyNoInteractions(insuranceGateway, pharmacyGateway, idempotencyService);
    }

    @Test
    @DisplayName("Submitting checks eligibility and records the coverage result")
    void eligibilityRecordedAsMetadata() {
        when(insuranceGateway.checkEligibility(any(EligibilityRequest.class), eq(deadline)))
                .thenReturn(CoverageResponse.builder()
                        .covered(true)
                        .priorAuthRequired(true)
                        .copayAmount(new BigDecimal("25.00"))
                        .formularyTier("2")
                        .rawEvidence("EB*1*IND**88")
                        .build());

        GatewayOutcome outcome = coordinator.confirm(AuthorizationFixtures.draft(), AuthorizationStatus.SUBMITTED, deadline);

        Map<String, String> metadata = outcome.getMetadata();
        assertEquals("true", metadata.get(TransitionGatewayCoordinator.COVERAGE_COVERED));
        assertEquals("true", metadata.get(TransitionGatewayCoordinator.COVERAGE_PA_REQUIRED));
        assertEquals("25.00", metadata.get(TransitionGatewayCoordinator.COVERAGE_COPAY));
        assertEquals("2", metadata.get(TransitionGatewayCoordinator.COVERAGE_TIER));
        assertEquals(1, outcome.getWorkflowEvents().size());
        assertTrue(outcome.getWorkflowEvents().get(0).startsWith("Eligibility verified"));
    }

    @Test
    @DisplayName("Medical benefit submissions go to the payer with a reserved key that stays pending")
    void medicalSubmissionGoesToPayer() {
        Authorization authorization = submitted(AuthorizationFixtures.medicalInsurance(), Map.of());
        SubmissionKey key = key(authorization.getId(), Upstream.INSURANCE_SUBMISSION, false);
        when(idempotencyService.reserve(authorization.getId(), Upstream.INSURANCE_SUBMISSION.key())).thenReturn(key);
        when(insuranceGateway.submitAuthorization(any(SubmissionRequest.class), eq(deadline)))
                .thenReturn(SubmissionResponse.builder()
                        .externalReferenceId("PAY-REF-1")
                        .remoteStatusCode("A4")
                        .build());

        GatewayOutcome outcome = coordinator.confirm(authorization, AuthorizationStatus.UNDER_REVIEW, deadline);

        ArgumentCaptor<SubmissionRequest> request = ArgumentCaptor.forClass(SubmissionRequest.class);
        verify(insuranceGateway).submitAuthorization(request.capture(), eq(deadline));
        assertSame(key, request.getValue().getIdempotencyKey());
        assertSame(key, outcome.getSubmissionKey());
        verify(idempotencyService, never()).confirm(any());
        verifyNoInteractions(pharmacyGateway);

        Map<String, String> metadata = outcome.getMetadata();
        assertEquals(TransitionGatewayCoordinator.ROUTE_INSURANCE, metadata.get(TransitionGatewayCoordinator.SUBMISSION_ROUTE));
        assertEquals("PAY-REF-1", metadata.get(TransitionGatewayCoordinator.SUBMISSION_REFERENCE));
        assertEquals("A4", metadata.get(TransitionGatewayCoordinator.SUBMISSION_REMOTE_STATUS));
        assertEquals(key.asHeaderValue(), metadata.get(TransitionGatewayCoordinator.SUBMISSION_IDEMPOTENCY_KEY));
        assertFalse(metadata.containsKey(TransitionGatewayCoordinator.SUBMISSION_INITIAL_DECISION));
    }

    @Test
    @DisplayName("Pharmacy benefit submissions go to the pharmacy network and keep an initial decision as metadata")
    void pharmacySubmissionRoutedByBin() {
        Authorization authorization = submitted(AuthorizationFixtures.pharmacyInsurance(), Map.of());
        SubmissionKey key = key(authorization.getId(), Upstream.PHARMACY, true);
        when(idempotencyService.reserve(authorization.getId(), Upstream.PHARMACY.key())).thenReturn(key);
        when(pharmacyGateway.sendPriorAuthorizationRequest(authorization, key, deadline))
                .thenReturn(SubmissionResponse.builder()
                        .externalReferenceId("PA-77")
                        .remoteStatusCode("APPROVED")
                        .initialDecision(AuthorizationStatus.APPROVED)
                        .build());

        GatewayOutcome outcome = coordinator.confirm(authorization, AuthorizationStatus.UNDER_REVIEW, deadline);

        assertEquals(TransitionGatewayCoordinator.ROUTE_PHARMACY,
                outcome.getMetadata().get(TransitionGatewayCoordinator.SUBMISSION_ROUTE));
        assertEquals("APPROVED", outcome.getMetadata().get(TransitionGatewayCoordinator.SUBMISSION_INITIAL_DECISION));
        assertSame(key, outcome.getSubmissionKey());
        verifyNoInteractions(insuranceGateway);
    }

    @Test
    @DisplayName("A failed submission leaves the idempotency key pending")
    void failedSubmissionKeepsKeyPending() {
        Authorization authorization = submitted(AuthorizationFixtures.medicalInsurance(), Map.of());
        SubmissionKey key = key(authorization.getId(), Upstream.INSURANCE_SUBMISSION, false);
        when(idempotencyService.reserve(authorization.getId(), Upstream.INSURANCE_SUBMISSION.key())).thenReturn(key);
        when(insuranceGateway.submitAuthorization(any(SubmissionRequest.class), eq(deadline)))
                .thenThrow(new RemoteRejectionException(Upstream.INSURANCE_SUBMISSION.key(), "72", "Invalid member ID"));

        assertThrows(RemoteRejectionException.class,
                () -> coordinator.confirm(authorization, AuthorizationStatus.UNDER_REVIEW, deadline));

        verify(idempotencyService, never()).confirm(any());
    }

    @Test
    @DisplayName("Settling an outcome retires its submission key; outcomes without one are ignored")
    void settleRetiresSubmissionKey() {
        UUID authorizationId = UUID.randomUUID();
        SubmissionKey key = key(authorizationId, Upstream.INSURANCE_SUBMISSION, false);

        coordinator.settle(GatewayOutcome.none());
        verifyNoInteractions(idempotencyService);

        coordinator.settle(new GatewayOutcome(Map.of(), List.of(), key));
        verify(idempotencyService).confirm(key);
    }

    @Test
    @DisplayName("Status refresh follows the route the authorization was submitted on")
    void refreshFollowsSubmissionRoute() {
        StatusResponse pharmacyStatus = StatusResponse.builder()
                .externalReferenceId("PA-77")
                .remoteStatusCode("APPROVED")
                .mappedStatus(AuthorizationStatus.APPROVED)
                .recognized(true)
                .build();
        when(pharmacyGateway.checkAuthorizationStatus("PA-77", deadline)).thenReturn(pharmacyStatus);

        Authorization viaPharmacy = submitted(AuthorizationFixtures.pharmacyInsurance(), Map.of(
                TransitionGatewayCoordinator.SUBMISSION_ROUTE, TransitionGatewayCoordinator.ROUTE_PHARMACY,
                TransitionGatewayCoordinator.SUBMISSION_REFERENCE, "PA-77"));

        assertSame(pharmacyStatus, coordinator.refreshStatus(viaPharmacy, deadline));
        verifyNoInteractions(insuranceGateway);
    }

    @Test
    @DisplayName("Status refresh without an external reference is a validation error")
    void refreshWithoutReferenceFails() {
        Authorization neverSubmitted = AuthorizationFixtures.draft();

        assertThrows(ValidationException.class, () -> coordinator.refreshStatus(neverSubmitted, deadline));
        verifyNoInteractions(insuranceGateway, pharmacyGateway);
    }

    @Test
    @DisplayName("Route is derived from the presence of a pharmacy BIN")
    void routeDerivedFromBin() {
        assertEquals(TransitionGatewayCoordinator.ROUTE_PHARMACY,
                TransitionGatewayCoordinator.routeFor(AuthorizationFixtures.draft(AuthorizationFixtures.pharmacyInsurance())));
        assertEquals(TransitionGatewayCoordinator.ROUTE_INSURANCE,
                TransitionGatewayCoordinator.routeFor(AuthorizationFixtures.draft(AuthorizationFixtures.medicalInsurance())));
    }

    private Authorization submitted(InsuranceInfo insurance, Map<String, String> metadata) {
        return AuthorizationFixtures.draft(insurance)
                .transitionTo(AuthorizationStatus.SUBMITTED, "dr.smith", "submit", metadata, List.of());
    }

    private SubmissionKey key(UUID authorizationId, Upstream upstream, boolean reused) {
        return new SubmissionKey(
                SubmissionIdempotencyService.deriveKey(authorizationId, upstream.key(), 1),
                authorizationId, upstream.key(), 1, reused);
    }
}

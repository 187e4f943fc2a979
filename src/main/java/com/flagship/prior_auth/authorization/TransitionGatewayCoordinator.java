package com.flagship.prior_auth.authorization;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the gateway action a target status requires and turns the reply into audit
 * metadata and workflow events.
 *
 * Never called inside a database transaction: a gateway call can take as long as the
 * caller's deadline allows.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransitionGatewayCoordinator {

    public static final String ROUTE_INSURANCE = "insurance";
    public static final String ROUTE_PHARMACY = "pharmacy";

    public static final String COVERAGE_COVERED = "coverage.covered";
    public static final String COVERAGE_COPAY = "coverage.copayAmount";
    public static final String COVERAGE_PA_REQUIRED = "coverage.priorAuthRequired";
    public static final String COVERAGE_TIER = "coverage.formularyTier";
    public static final String COVERAGE_EVIDENCE = "coverage.rawEvidence";

    public static final String SUBMISSION_ROUTE = "submission.route";
    public static final String SUBMISSION_REFERENCE = "submission.externalReferenceId";
    public static final String SUBMISSION_REMOTE_STATUS = "submission.remoteStatus";
    public static final String SUBMISSION_INITIAL_DECISION = "submission.initialDecision";
    public static final String SUBMISSION_IDEMPOTENCY_KEY = "submission.idempotencyKey";
    public static final String SUBMISSION_EVIDENCE = "submission.rawEvidence";

    public static final String REMOTE_STATUS_CODE = "remote.statusCode";
    public static final String REMOTE_STATUS_NOTES = "remote.notes";
    public static final String REMOTE_STATUS_EVIDENCE = "remote.rawEvidence";

    private final InsuranceGateway insuranceGateway;
    private final PharmacyGateway pharmacyGateway;
    private final SubmissionIdempotencyService idempotencyService;

    GatewayOutcome confirm(Authorization authorization, AuthorizationStatus target, CallDeadline deadline) {
        return switch (StatusTransitions.requiredAction(target)) {
            case NONE -> GatewayOutcome.none();
            case ELIGIBILITY_CHECK -> checkEligibility(authorization, deadline);
            case SUBMISSION -> submit(authorization, deadline);
        };
    }

    /**
     * Asks whichever network the authorization was submitted to for its current status.
     *
     * @throws ValidationException if the authorization was never submitted
     */
    StatusResponse refreshStatus(Authorization authorization, CallDeadline deadline) {
        String reference = authorization.metadata(SUBMISSION_REFERENCE);
        if (reference == null || reference.isBlank()) {
            throw new ValidationException("Authorization " + authorization.getId()
                    + " has no external reference to poll");
        }
        if (ROUTE_PHARMACY.equals(authorization.metadata(SUBMISSION_ROUTE))) {
            return pharmacyGateway.checkAuthorizationStatus(reference, deadline);
        }
        return insuranceGateway.checkStatus(reference, deadline);
    }

    static String routeFor(Authorization authorization) {
        InsuranceInfo insurance = authorization.getPatient() != null
                ? authorization.getPatient().getInsurance()
                : null;
        return insurance != null && insurance.isPharmacyBenefit() ? ROUTE_PHARMACY : ROUTE_INSURANCE;
    }

    private GatewayOutcome checkEligibility(Authorization authorization, CallDeadline deadline) {
        CoverageResponse coverage = insuranceGateway.checkEligibility(EligibilityRequest.builder()
                .authorizationId(authorization.getId())
                .patient(authorization.getPatient())
                .medication(authorization.getMedication())
                .build(), deadline);

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(COVERAGE_COVERED, String.valueOf(coverage.isCovered()));
        metadata.put(COVERAGE_PA_REQUIRED, String.valueOf(coverage.isPriorAuthRequired()));
        if (coverage.getCopayAmount() != null) {
            metadata.put(COVERAGE_COPAY, coverage.getCopayAmount().toPlainString());
        }
        if (coverage.getFormularyTier() != null) {
            metadata.put(COVERAGE_TIER, coverage.getFormularyTier());
        }
        if (coverage.getRawEvidence() != null) {
            metadata.put(COVERAGE_EVIDENCE, coverage.getRawEvidence());
        }
        log.info("Eligibility verified: covered={}, priorAuthRequired={}",
                coverage.isCovered(), coverage.isPriorAuthRequired());
        return new GatewayOutcome(metadata, List.of(String.format(
                "Eligibility verified: covered=%s, priorAuthRequired=%s",
                coverage.isCovered(), coverage.isPriorAuthRequired())));
    }

    private GatewayOutcome submit(Authorization authorization, CallDeadline deadline) {
        String route = routeFor(authorization);
        Upstream upstream = ROUTE_PHARMACY.equals(route) ? Upstream.PHARMACY : Upstream.INSURANCE_SUBMISSION;
        SubmissionKey key = idempotencyService.reserve(authorization.getId(), upstream.key());
        if (key.isReused()) {
            log.info("Resubmitting to {} with pending idempotency key {}", upstream, key.getIdempotencyKey());
        }

        SubmissionResponse response = ROUTE_PHARMACY.equals(route)
                ? pharmacyGateway.sendPriorAuthorizationRequest(authorization, key, deadline)
                : insuranceGateway.submitAuthorization(SubmissionRequest.builder()
                        .authorizationId(authorization.getId())
                        .patient(authorization.getPatient())
                        .medication(authorization.getMedication())
                        .clinical(authorization.getClinical())
                        .idempotencyKey(key)
                        .build(), deadline);

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(SUBMISSION_ROUTE, route);
        metadata.put(SUBMISSION_REFERENCE, response.getExternalReferenceId());
        metadata.put(SUBMISSION_IDEMPOTENCY_KEY, key.asHeaderValue());
        if (response.getRemoteStatusCode() != null) {
            metadata.put(SUBMISSION_REMOTE_STATUS, response.getRemoteStatusCode());
        }
        if (response.getInitialDecision() != null) {
            metadata.put(SUBMISSION_INITIAL_DECISION, response.getInitialDecision().name());
        }
        if (response.getRawEvidence() != null) {
            metadata.put(SUBMISSION_EVIDENCE, response.getRawEvidence());
        }
        log.info("Submitted to {}: reference={}, remoteStatus={}",
                route, response.getExternalReferenceId(), response.getRemoteStatusCode());
        return new GatewayOutcome(metadata, List.of(String.format("Submitted to %s: reference=%s, remoteStatus=%s",
                route, response.getExternalReferenceId(), response.getRemoteStatusCode())), key);
    }

    /**
     * Retires the submission key carried by {@code outcome}. Only called once the
     * transition the submission confirmed is stored; until then a retry reuses the key.
     */
    void settle(GatewayOutcome outcome) {
        if (outcome.getSubmissionKey() != null) {
            idempotencyService.confirm(outcome.getSubmissionKey());
        }
    }
}

package com.flagship.prior_auth.integration.insurance;

import com.flagship.prior_auth.authorization.InsuranceInfo;
import com.flagship.prior_auth.authorization.MedicationInfo;
import com.flagship.prior_auth.authorization.PatientInfo;
import com.flagship.prior_auth.config.IntegrationProperties;
import com.flagship.prior_auth.error.ValidationException;
import com.flagship.prior_auth.integration.StatusResponse;
import com.flagship.prior_auth.integration.SubmissionResponse;
import com.flagship.prior_auth.integration.Upstream;
import com.flagship.prior_auth.integration.WireCodec;
import com.flagship.prior_auth.integration.WireProtocolException;
import com.flagship.prior_auth.integration.WireRequest;
import com.flagship.prior_auth.integration.WireResponse;
import com.flagship.prior_auth.integration.WireTransport;
import com.flagship.prior_auth.integration.insurance.x12.AuthorizationRequestCodec;
import com.flagship.prior_auth.integration.insurance.x12.EligibilityCodec;
import com.flagship.prior_auth.integration.insurance.x12.StatusInquiryCodec;
import com.flagship.prior_auth.integration.insurance.x12.X12Envelope;
import com.flagship.prior_auth.integration.resilience.CallDeadline;
import com.flagship.prior_auth.integration.resilience.ResiliencePolicyRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Payer integration over X12 transaction sets.
 *
 * Every operation validates its input before any I/O, then runs encode, exchange and
 * decode under the resilience policy of its upstream key. Decoding happens inside the
 * attempt so a malformed reply counts against the breaker.
 */
@Component
@Slf4j
public class InsuranceGateway {

    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    private static final String API_KEY_HEADER = "X-API-Key";

    private final IntegrationProperties.Insurance properties;
    private final WireTransport transport;
    private final ResiliencePolicyRegistry policies;
    private final EligibilityCodec eligibilityCodec;
    private final AuthorizationRequestCodec submissionCodec;
    private final StatusInquiryCodec statusCodec;

    @Autowired
    public InsuranceGateway(IntegrationProperties properties, WireTransport transport,
                            ResiliencePolicyRegistry policies) {
        this(properties.getInsurance(), transport, policies, Clock.systemUTC());
    }

    InsuranceGateway(IntegrationProperties.Insurance properties, WireTransport transport,
                     ResiliencePolicyRegistry policies, Clock clock) {
        this.properties = properties;
        this.transport = transport;
        this.policies = policies;
        X12Envelope envelope = new X12Envelope(properties.getSenderId(), properties.getReceiverId(), clock);
        this.eligibilityCodec = new EligibilityCodec(envelope, Upstream.INSURANCE_ELIGIBILITY.key());
        this.submissionCodec = new AuthorizationRequestCodec(envelope, Upstream.INSURANCE_SUBMISSION.key());
        this.statusCodec = new StatusInquiryCodec(envelope, Upstream.INSURANCE_STATUS.key());
    }

    /**
     * Checks the member's drug coverage with a 270 inquiry.
     *
     * @throws ValidationException patient, insurance or NDC missing; nothing was sent
     */
    public CoverageResponse checkEligibility(EligibilityRequest request, CallDeadline deadline) {
        List<String> violations = new ArrayList<>();
        requirePatientAndInsurance(request.getPatient(), violations);
        requireNdc(request.getMedication(), violations);
        failOnViolations("Eligibility request is incomplete", violations);

        log.info("Checking eligibility for authorization={} payer={}",
                request.getAuthorizationId(), request.getPatient().getInsurance().getPayerId());
        CoverageResponse coverage = call(Upstream.INSURANCE_ELIGIBILITY, properties.getEligibilityPath(),
                eligibilityCodec, request, deadline, null);
        log.info("Eligibility for authorization={}: covered={}, priorAuthRequired={}, tier={}",
                request.getAuthorizationId(), coverage.isCovered(), coverage.isPriorAuthRequired(),
                coverage.getFormularyTier());
        return coverage;
    }

    /**
     * Submits a 278 review request. The idempotency key goes out in the envelope and the
     * {@value #IDEMPOTENCY_KEY_HEADER} header; every retry of this call reuses it.
     */
    public SubmissionResponse submitAuthorization(SubmissionRequest request, CallDeadline deadline) {
        List<String> violations = new ArrayList<>();
        requirePatientAndInsurance(request.getPatient(), violations);
        requireNdc(request.getMedication(), violations);
        if (request.getClinical() == null || request.getClinical().getDiagnosisCodes().isEmpty()) {
            violations.add("at least one diagnosis code is required");
        }
        if (request.getIdempotencyKey() == null) {
            violations.add("idempotency key is required");
        }
        failOnViolations("Authorization submission is incomplete", violations);

        log.info("Submitting authorization={} to payer with idempotency key {} (reused={})",
                request.getAuthorizationId(), request.getIdempotencyKey().asHeaderValue(),
                request.getIdempotencyKey().isReused());
        SubmissionResponse response = call(Upstream.INSURANCE_SUBMISSION, properties.getSubmissionPath(),
                submissionCodec, request, deadline, request.getIdempotencyKey().asHeaderValue());
        log.info("Payer accepted authorization={} as reference={} action={}",
                request.getAuthorizationId(), response.getExternalReferenceId(), response.getRemoteStatusCode());
        return response;
    }

    /**
     * Asks the payer for the current review outcome of a submitted request.
     */
    public StatusResponse checkStatus(String externalReferenceId, CallDeadline deadline) {
        if (externalReferenceId == null || externalReferenceId.isBlank()) {
            throw new ValidationException("External reference id is required for a status inquiry");
        }
        StatusResponse status = call(Upstream.INSURANCE_STATUS, properties.getStatusPath(),
                statusCodec, externalReferenceId, deadline, null);
        if (!status.isRecognized()) {
            log.warn("Payer returned unmapped status code '{}' for reference={}",
                    status.getRemoteStatusCode(), externalReferenceId);
        }
        return status;
    }

    private <D, R> R call(Upstream upstream, String path, WireCodec<D, R> codec, D request,
                          CallDeadline deadline, String idempotencyKey) {
        WireRequest.WireRequestBuilder wire = WireRequest.builder()
                .url(properties.getBaseUrl() + path)
                .contentType(codec.contentType())
                .body(codec.encode(request));
        if (idempotencyKey != null) {
            wire.header(IDEMPOTENCY_KEY_HEADER, idempotencyKey);
        }
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            wire.header(API_KEY_HEADER, properties.getApiKey());
        }
        WireRequest outbound = wire.build();

        return policies.forUpstream(upstream).execute(deadline, () -> {
            WireResponse response = transport.exchange(upstream.key(), outbound);
            if (response.getBody() == null) {
                throw new WireProtocolException("Empty reply from " + upstream.key());
            }
            return codec.decode(response.getBody());
        });
    }

    private static void requirePatientAndInsurance(PatientInfo patient, List<String> violations) {
        if (patient == null) {
            violations.add("patient info is required");
            return;
        }
        if (isBlank(patient.getFirstName()) || isBlank(patient.getLastName())) {
            violations.add("patient name is required");
        }
        InsuranceInfo insurance = patient.getInsurance();
        if (insurance == null) {
            violations.add("insurance info is required");
            return;
        }
        if (isBlank(insurance.getPayerId())) {
            violations.add("payer id is required");
        }
        if (isBlank(insurance.getMemberId())) {
            violations.add("member id is required");
        }
    }

    private static void requireNdc(MedicationInfo medication, List<String> violations) {
        if (medication == null || isBlank(medication.getNdcCode())) {
            violations.add("medication NDC code is required");
        }
    }

    private static void failOnViolations(String message, List<String> violations) {
        if (!violations.isEmpty()) {
            throw new ValidationException(message, violations);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

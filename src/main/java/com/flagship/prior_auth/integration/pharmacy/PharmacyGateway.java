package com.flagship.prior_auth.integration.pharmacy;

import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.flagship.prior_auth.authorization.Authorization;
import com.flagship.prior_auth.authorization.InsuranceInfo;
import com.flagship.prior_auth.config.IntegrationProperties;
import com.flagship.prior_auth.error.ValidationException;
import com.flagship.prior_auth.integration.StatusResponse;
import com.flagship.prior_auth.integration.SubmissionResponse;
import com.flagship.prior_auth.integration.Upstream;
import com.flagship.prior_auth.integration.WireProtocolException;
import com.flagship.prior_auth.integration.WireRequest;
import com.flagship.prior_auth.integration.WireResponse;
import com.flagship.prior_auth.integration.WireTransport;
import com.flagship.prior_auth.integration.idempotency.SubmissionKey;
import com.flagship.prior_auth.integration.pharmacy.script.ScriptRequestCodec;
import com.flagship.prior_auth.integration.pharmacy.script.ScriptStatusCodec;
import com.flagship.prior_auth.integration.resilience.CallDeadline;
import com.flagship.prior_auth.integration.resilience.ResiliencePolicyRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Pharmacy network integration over SCRIPT-style XML messages.
 *
 * The request is encoded, and its protected fields encrypted, before the resilience
 * policy is entered, so a missing key fails closed with no network attempt.
 */
@Component
@Slf4j
public class PharmacyGateway {

    /**
     * Per-attempt wait for a status inquiry. Pharmacy networks commit to answering status
     * inquiries within this SLA, so it applies regardless of the attempt timeout configured
     * for {@code pharmacy-status}.
     */
    public static final Duration STATUS_INQUIRY_TIMEOUT = Duration.ofSeconds(30);

    private final IntegrationProperties.Pharmacy properties;
    private final WireTransport transport;
    private final ResiliencePolicyRegistry policies;
    private final ScriptRequestCodec requestCodec;
    private final ScriptStatusCodec statusCodec;

    @Autowired
    public PharmacyGateway(IntegrationProperties properties, WireTransport transport,
                           ResiliencePolicyRegistry policies, FieldEncryptor encryptor,
                           XmlMapper scriptXmlMapper) {
        this(properties.getPharmacy(), transport, policies, encryptor, scriptXmlMapper, Clock.systemUTC());
    }

    PharmacyGateway(IntegrationProperties.Pharmacy properties, WireTransport transport,
                    ResiliencePolicyRegistry policies, FieldEncryptor encryptor,
                    XmlMapper xmlMapper, Clock clock) {
        this.properties = properties;
        this.transport = transport;
        this.policies = policies;
        this.requestCodec = new ScriptRequestCodec(xmlMapper, encryptor, properties.getSenderId(),
                Upstream.PHARMACY.key(), clock);
        this.statusCodec = new ScriptStatusCodec(xmlMapper, properties.getSenderId(),
                Upstream.PHARMACY_STATUS.key(), clock);
    }

    /**
     * Sends a PA request. The message ID is the idempotency key, so retries and later
     * resubmissions of an unconfirmed request are recognisable as the same message.
     *
     * @throws ValidationException required patient, benefit or drug data missing
     * @throws com.flagship.prior_auth.error.ConfigurationException encryption keys missing
     */
    public SubmissionResponse sendPriorAuthorizationRequest(Authorization authorization, SubmissionKey key,
                                                            CallDeadline deadline) {
        validate(authorization, key);
        String body = requestCodec.encode(new PharmacySubmission(authorization, key));

        log.info("Sending pharmacy PA request for authorization={} messageId={} (reused={})",
                authorization.getId(), key.asHeaderValue(), key.isReused());
        WireRequest request = WireRequest.builder()
                .url(properties.getBaseUrl() + properties.getRequestPath())
                .contentType(requestCodec.contentType())
                .body(body)
                .header("Idempotency-Key", key.asHeaderValue())
                .build();

        SubmissionResponse response = policies.forUpstream(Upstream.PHARMACY).execute(deadline,
                () -> requestCodec.decode(bodyOf(transport.exchange(Upstream.PHARMACY.key(), request))));
        log.info("Pharmacy accepted authorization={} as reference={} status={}",
                authorization.getId(), response.getExternalReferenceId(), response.getRemoteStatusCode());
        return response;
    }

    /**
     * Status inquiry with the fixed {@link #STATUS_INQUIRY_TIMEOUT} per attempt, still
     * bounded by {@code deadline}.
     */
    public StatusResponse checkAuthorizationStatus(String paReferenceId, CallDeadline deadline) {
        if (paReferenceId == null || paReferenceId.isBlank()) {
            throw new ValidationException("PA reference id is required for a status inquiry");
        }
        WireRequest request = WireRequest.builder()
                .url(properties.getBaseUrl() + properties.getStatusPath())
                .contentType(statusCodec.contentType())
                .body(statusCodec.encode(paReferenceId))
                .build();

        StatusResponse status = policies.forUpstream(Upstream.PHARMACY_STATUS).execute(deadline,
                STATUS_INQUIRY_TIMEOUT,
                () -> statusCodec.decode(bodyOf(transport.exchange(Upstream.PHARMACY_STATUS.key(), request))));
        if (!status.isRecognized()) {
            log.warn("Pharmacy returned unmapped status code '{}' for reference={}",
                    status.getRemoteStatusCode(), paReferenceId);
        }
        return status;
    }

    private static String bodyOf(WireResponse response) {
        if (response.getBody() == null || response.getBody().isBlank()) {
            throw new WireProtocolException("Empty reply from pharmacy network");
        }
        return response.getBody();
    }

    private static void validate(Authorization authorization, SubmissionKey key) {
        List<String> violations = new ArrayList<>();
        if (key == null) {
            violations.add("idempotency key is required");
        }
        if (authorization.getPatient() == null) {
            violations.add("patient info is required");
        } else {
            InsuranceInfo insurance = authorization.getPatient().getInsurance();
            if (insurance == null || !insurance.isPharmacyBenefit()) {
                violations.add("pharmacy BIN is required");
            } else if (insurance.getMemberId() == null || insurance.getMemberId().isBlank()) {
                violations.add("member id is required");
            }
        }
        if (authorization.getMedication() == null
                || authorization.getMedication().getNdcCode() == null
                || authorization.getMedication().getNdcCode().isBlank()) {
            violations.add("medication NDC code is required");
        } else if (authorization.getMedication().getMedicationName() == null) {
            violations.add("medication name is required");
        }
        if (!violations.isEmpty()) {
            throw new ValidationException("Pharmacy PA request is incomplete", violations);
        }
    }
}

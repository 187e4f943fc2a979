package com.flagship.prior_auth.authorization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.prior_auth.authorization.dto.CreateAuthorizationRequest;
import com.flagship.prior_auth.error.IntegrationUnavailableException;
import com.flagship.prior_auth.integration.StatusResponse;
import com.flagship.prior_auth.integration.SubmissionResponse;
import com.flagship.prior_auth.integration.insurance.CoverageResponse;
import com.flagship.prior_auth.integration.insurance.InsuranceGateway;
import com.flagship.prior_auth.integration.pharmacy.PharmacyGateway;
import com.flagship.prior_auth.integration.resilience.CallDeadline;
import jakarta.servlet.AsyncListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockAsyncContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end tests through the REST API against PostgreSQL and Redis.
 *
 * These tests verify:
 * - Creation validates input and records the DRAFT history entry
 * - Transitions run asynchronously and map domain errors onto HTTP statuses
 * - A gateway outage leaves the authorization unchanged and reports Retry-After
 * - A transition request that times out cancels the gateway call and tells the client to re-read
 * - A full lifecycle from DRAFT to APPROVED through a remote status refresh
 * - Update streams deliver status changes as Server-Sent Events
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class AuthorizationControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("prior_auth_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("status-polling.enabled", () -> "false");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private InsuranceGateway insuranceGateway;

    @MockBean
    private PharmacyGateway pharmacyGateway;

    @BeforeEach
    void setUp() {
        reset(insuranceGateway, pharmacyGateway);
    }

    private String createBody(InsuranceInfo insurance) throws Exception {
        return objectMapper.writeValueAsString(CreateAuthorizationRequest.builder()
                .patient(AuthorizationFixtures.patient(insurance))
                .medication(AuthorizationFixtures.medication())
                .clinical(AuthorizationFixtures.clinical())
                .assignedTo("reviewer-7")
                .build());
    }

    private UUID create() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/authorizations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(AuthorizationController.ACTOR_HEADER, "dr.smith")
                        .content(createBody(AuthorizationFixtures.medicalInsurance())))
                .andExpect(status().isCreated())
                .andReturn();
        return UUID.fromString(json(result).get("id").asText());
    }

    private ResultActions transition(UUID id, AuthorizationStatus target) throws Exception {
        MockHttpServletRequestBuilder builder = post("/api/authorizations/{id}/transitions", id)
                .contentType(MediaType.APPLICATION_JSON)
                .header(AuthorizationController.ACTOR_HEADER, "dr.smith")
                .header(AuthorizationController.TIMEOUT_HEADER, 5000)
                .content(objectMapper.writeValueAsString(Map.of(
                        "target_status", target.name(),
                        "reason", "Moving to " + target)));
        MvcResult started = mockMvc.perform(builder)
                .andExpect(request().asyncStarted())
                .andReturn();
        return mockMvc.perform(asyncDispatch(started));
    }

    private JsonNode json(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private void stubEligibility() {
        when(insuranceGateway.checkEligibility(any(), any())).thenReturn(CoverageResponse.builder()
                .covered(true)
                .priorAuthRequired(true)
                .copayAmount(new BigDecimal("25.00"))
                .formularyTier("2")
                .build());
    }

    @Test
    @DisplayName("Create returns DRAFT with its creation history entry and allowed transitions")
    void createAuthorization() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/authorizations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(AuthorizationController.ACTOR_HEADER, "dr.smith")
                        .content(createBody(AuthorizationFixtures.medicalInsurance())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("DRAFT"))
                .andExpect(jsonPath("$.created_by").value("dr.smith"))
                .andExpect(jsonPath("$.status_history.length()").value(1))
                .andExpect(jsonPath("$.patient.insurance.member_id").value("W123456789"))
                .andReturn();

        UUID id = UUID.fromString(json(result).get("id").asText());
        mockMvc.perform(get("/api/authorizations/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DRAFT"))
                .andExpect(jsonPath("$.version").value(0))
                .andExpect(jsonPath("$.patient.insurance.pharmacyBenefit").doesNotExist());
    }

    @Test
    @DisplayName("Create without medication is rejected with 400")
    void createValidation() throws Exception {
        String body = objectMapper.writeValueAsString(CreateAuthorizationRequest.builder()
                .patient(AuthorizationFixtures.patient(AuthorizationFixtures.medicalInsurance()))
                .build());

        mockMvc.perform(post("/api/authorizations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(AuthorizationController.ACTOR_HEADER, "dr.smith")
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"));
    }

    @Test
    @DisplayName("Create without an actor header is rejected with 400")
    void createRequiresActor() throws Exception {
        mockMvc.perform(post("/api/authorizations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody(AuthorizationFixtures.medicalInsurance())))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Unknown authorization returns 404")
    void unknownAuthorization() throws Exception {
        mockMvc.perform(get("/api/authorizations/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Not Found"));
    }

    @Test
    @DisplayName("Submitting runs the eligibility check and stores the coverage in metadata")
    void submitWithEligibility() throws Exception {
        UUID id = create();
        stubEligibility();

        transition(id, AuthorizationStatus.SUBMITTED)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUBMITTED"))
                .andExpect(jsonPath("$.metadata['coverage.covered']").value("true"))
                .andExpect(jsonPath("$.metadata['coverage.formularyTier']").value("2"))
                .andExpect(jsonPath("$.status_history.length()").value(2))
                .andExpect(jsonPath("$.version").value(1));
    }

    @Test
    @DisplayName("A transition outside the lifecycle is 409 and names both statuses")
    void invalidTransition() throws Exception {
        UUID id = create();

        transition(id, AuthorizationStatus.APPROVED)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Invalid Transition"))
                .andExpect(jsonPath("$.currentStatus").value("DRAFT"))
                .andExpect(jsonPath("$.details.from_status").value("DRAFT"))
                .andExpect(jsonPath("$.details.target_status").value("APPROVED"));

        verify(insuranceGateway, never()).checkEligibility(any(), any());
    }

    @Test
    @DisplayName("An unavailable payer leaves the authorization unchanged and returns Retry-After")
    void gatewayUnavailable() throws Exception {
        UUID id = create();
        stubEligibility();
        transition(id, AuthorizationStatus.SUBMITTED).andExpect(status().isOk());
        when(insuranceGateway.submitAuthorization(any(), any())).thenThrow(new IntegrationUnavailableException(
                "insurance-submission", "Circuit breaker for insurance-submission is OPEN", Duration.ofSeconds(30)));

        transition(id, AuthorizationStatus.UNDER_REVIEW)
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "30"))
                .andExpect(jsonPath("$.currentStatus").value("SUBMITTED"))
                .andExpect(jsonPath("$.retryGuidance").value("RETRY_LATER"))
                .andExpect(jsonPath("$.details.upstream").value("insurance-submission"));

        mockMvc.perform(get("/api/authorizations/{id}", id))
                .andExpect(jsonPath("$.status").value("SUBMITTED"))
                .andExpect(jsonPath("$.status_history.length()").value(2));
    }

    @Test
    @DisplayName("A transition request that times out cancels the gateway call and asks the client to re-read")
    void transitionTimeoutAsksForRefetch() throws Exception {
        UUID id = create();
        stubEligibility();
        transition(id, AuthorizationStatus.SUBMITTED).andExpect(status().isOk());
        CountDownLatch inGateway = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicReference<CallDeadline> gatewayDeadline = new AtomicReference<>();
        when(insuranceGateway.submitAuthorization(any(), any())).thenAnswer(invocation -> {
            gatewayDeadline.set(invocation.getArgument(1));
            inGateway.countDown();
            release.await(5, TimeUnit.SECONDS);
            throw new IntegrationUnavailableException("insurance-submission", "Call cancelled by caller", null);
        });

        try {
            MvcResult started = mockMvc.perform(post("/api/authorizations/{id}/transitions", id)
                            .contentType(MediaType.APPLICATION_JSON)
                            .header(AuthorizationController.ACTOR_HEADER, "dr.smith")
                            .header(AuthorizationController.TIMEOUT_HEADER, 5000)
                            .content(objectMapper.writeValueAsString(Map.of(
                                    "target_status", "UNDER_REVIEW",
                                    "reason", "Send to payer"))))
                    .andExpect(request().asyncStarted())
                    .andReturn();
            assertTrue(inGateway.await(5, TimeUnit.SECONDS));

            MockAsyncContext asyncContext = (MockAsyncContext) started.getRequest().getAsyncContext();
            for (AsyncListener listener : asyncContext.getListeners()) {
                listener.onTimeout(null);
            }

            mockMvc.perform(asyncDispatch(started))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.error").value("Transition Outcome Unknown"))
                    .andExpect(jsonPath("$.retryGuidance").value("REFETCH_AND_RETRY"))
                    .andExpect(jsonPath("$.details.authorization_id").value(id.toString()))
                    .andExpect(jsonPath("$.details.target_status").value("UNDER_REVIEW"));
            assertTrue(gatewayDeadline.get().isCancelled());
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("Full lifecycle: submit, send for review, then apply the payer's approval")
    void fullLifecycle() throws Exception {
        UUID id = create();
        stubEligibility();
        when(insuranceGateway.submitAuthorization(any(), any())).thenReturn(SubmissionResponse.builder()
                .externalReferenceId("AUTH-55821")
                .remoteStatusCode("A4")
                .build());
        when(insuranceGateway.checkStatus(eq("AUTH-55821"), any())).thenReturn(StatusResponse.builder()
                .externalReferenceId("AUTH-55821")
                .remoteStatusCode("A1")
                .mappedStatus(AuthorizationStatus.APPROVED)
                .recognized(true)
                .notes("Certified in total")
                .build());

        transition(id, AuthorizationStatus.SUBMITTED).andExpect(status().isOk());
        transition(id, AuthorizationStatus.UNDER_REVIEW)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metadata['submission.externalReferenceId']").value("AUTH-55821"))
                .andExpect(jsonPath("$.metadata['submission.route']").value("insurance"));

        mockMvc.perform(post("/api/authorizations/{id}/status-refresh", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transitioned").value(true))
                .andExpect(jsonPath("$.mapped_status").value("APPROVED"))
                .andExpect(jsonPath("$.authorization.status").value("APPROVED"))
                .andExpect(jsonPath("$.authorization.allowed_transitions.length()").value(0));

        MvcResult result = mockMvc.perform(get("/api/authorizations/{id}", id)).andReturn();
        JsonNode history = json(result).get("status_history");
        assertEquals(4, history.size());
        assertEquals("UNDER_REVIEW", history.get(3).get("from_status").asText());
        assertEquals("APPROVED", history.get(3).get("to_status").asText());
        assertEquals(AuthorizationStateMachine.STATUS_POLLER_ACTOR, history.get(3).get("changed_by").asText());
    }

    @Test
    @DisplayName("Refreshing an authorization that is not under review is rejected")
    void refreshRequiresUnderReview() throws Exception {
        UUID id = create();

        mockMvc.perform(post("/api/authorizations/{id}/status-refresh", id))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.currentStatus").value("DRAFT"));
    }

    @Test
    @DisplayName("Listing by status includes the new authorization")
    void findByStatus() throws Exception {
        UUID id = create();

        mockMvc.perform(get("/api/authorizations").param("status", "DRAFT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.id == '" + id + "')]").exists());
    }

    @Test
    @DisplayName("A non-positive request timeout is rejected before any work starts")
    void invalidTimeout() throws Exception {
        UUID id = create();

        mockMvc.perform(post("/api/authorizations/{id}/transitions", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(AuthorizationController.ACTOR_HEADER, "dr.smith")
                        .header(AuthorizationController.TIMEOUT_HEADER, 0)
                        .content("{\"target_status\":\"CANCELLED\",\"reason\":\"duplicate\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("The update stream delivers the status change and ends at a terminal status")
    void updateStream() throws Exception {
        UUID id = create();

        MvcResult stream = mockMvc.perform(get("/api/authorizations/{id}/updates", id)
                        .accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(request().asyncStarted())
                .andReturn();

        transition(id, AuthorizationStatus.CANCELLED).andExpect(status().isOk());

        String events = stream.getResponse().getContentAsString();
        assertTrue(events.contains("event:AuthorizationStatusChanged"), events);
        assertTrue(events.contains("\"status\":\"CANCELLED\""), events);
    }

    @Test
    @DisplayName("Health reports the database and every upstream breaker")
    void health() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.database").value("UP"))
                .andExpect(jsonPath("$.upstreams['insurance-submission']").value("CLOSED"))
                .andExpect(jsonPath("$.upstreams['pharmacy']").value("CLOSED"));
    }
}

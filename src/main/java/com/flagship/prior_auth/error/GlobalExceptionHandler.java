package com.flagship.prior_auth.error;

import com.flagship.prior_auth.authorization.AuthorizationStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 *
 * Every {@link PriorAuthException} is rendered with its retry guidance and, when the
 * error aborted a transition, the status the authorization still has.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        log.warn("Validation failed: {}", e.getMessage());
        Map<String, String> details = new LinkedHashMap<>();
        for (int i = 0; i < e.getViolations().size(); i++) {
            details.put("violation_" + (i + 1), e.getViolations().get(i));
        }
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", e, details);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidTransitionException e) {
        log.warn("Invalid transition: {}", e.getMessage());
        Map<String, String> details = new LinkedHashMap<>();
        details.put("from_status", String.valueOf(e.getFromStatus()));
        details.put("target_status", String.valueOf(e.getTargetStatus()));
        return respond(HttpStatus.CONFLICT, "Invalid Transition", e, details);
    }

    @ExceptionHandler(AuthorizationNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(AuthorizationNotFoundException e) {
        log.debug("Authorization not found: {}", e.getAuthorizationId());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e, null);
    }

    @ExceptionHandler(ConcurrentUpdateException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentUpdate(ConcurrentUpdateException e) {
        log.warn("Concurrent update: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Concurrent Update", e, null);
    }

    @ExceptionHandler(IntegrationUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleIntegrationUnavailable(IntegrationUnavailableException e) {
        log.warn("Integration unavailable: upstream={}, error={}", e.getUpstream(), e.getMessage());
        Duration retryAfter = e.getRetryAfter() != null ? e.getRetryAfter() : Duration.ofSeconds(1);
        long seconds = Math.max(1, (retryAfter.toMillis() + 999) / 1000);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .header(HttpHeaders.RETRY_AFTER, String.valueOf(seconds))
            .body(body("Integration Unavailable", e, Map.of("upstream", String.valueOf(e.getUpstream()))));
    }

    @ExceptionHandler(TransitionTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleTransitionTimeout(TransitionTimeoutException e) {
        log.warn("Transition timed out before completing: {}", e.getMessage());
        Map<String, String> details = new LinkedHashMap<>();
        details.put("authorization_id", String.valueOf(e.getAuthorizationId()));
        details.put("target_status", String.valueOf(e.getTargetStatus()));
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Transition Outcome Unknown", e, details);
    }

    @ExceptionHandler(AmbiguousFailureException.class)
    public ResponseEntity<ErrorResponse> handleAmbiguousFailure(AmbiguousFailureException e) {
        log.warn("Ambiguous upstream failure: upstream={}, error={}", e.getUpstream(), e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Ambiguous Failure", e,
            Map.of("upstream", String.valueOf(e.getUpstream())));
    }

    @ExceptionHandler(RemoteRejectionException.class)
    public ResponseEntity<ErrorResponse> handleRemoteRejection(RemoteRejectionException e) {
        log.warn("Rejected by {}: code={}, error={}", e.getUpstream(), e.getRejectCode(), e.getMessage());
        Map<String, String> details = new LinkedHashMap<>();
        details.put("upstream", String.valueOf(e.getUpstream()));
        details.put("reject_code", String.valueOf(e.getRejectCode()));
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Remote Rejection", e, details);
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationException e) {
        log.error("Configuration error: {}", e.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Configuration Error", e, null);
    }

    @ExceptionHandler(PriorAuthException.class)
    public ResponseEntity<ErrorResponse> handlePriorAuth(PriorAuthException e) {
        log.error("Unhandled prior authorization error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", e, null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return badRequest("Missing Required Header", "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing required parameter: {}", e.getParameterName());
        return badRequest("Missing Required Parameter",
            "Required parameter '" + e.getParameterName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid value for {}: {}", e.getName(), e.getValue());
        return badRequest("Invalid Request", "Invalid value for '" + e.getName() + "'", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return badRequest("Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return badRequest("Invalid Request", "Request body is malformed", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, PriorAuthException e,
                                                  Map<String, String> details) {
        return ResponseEntity.status(status).body(body(error, e, details));
    }

    private ErrorResponse body(String error, PriorAuthException e, Map<String, String> details) {
        return ErrorResponse.builder()
            .error(error)
            .message(e.getMessage())
            .currentStatus(e.getCurrentStatus())
            .retryGuidance(e.getRetryGuidance())
            .details(details == null || details.isEmpty() ? null : details)
            .timestamp(Instant.now())
            .build();
    }

    private ResponseEntity<ErrorResponse> badRequest(String error, String message, Map<String, String> details) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.builder()
            .error(error)
            .message(message)
            .retryGuidance(RetryGuidance.DO_NOT_RETRY)
            .details(details)
            .timestamp(Instant.now())
            .build());
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        AuthorizationStatus currentStatus;
        RetryGuidance retryGuidance;
        Map<String, String> details;
        Instant timestamp;
    }
}

package com.flagship.prior_auth.authorization.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.prior_auth.authorization.AuthorizationStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class TransitionRequest {

    @NotNull(message = "Target status is required")
    @JsonProperty("target_status")
    AuthorizationStatus targetStatus;

    @NotBlank(message = "Reason is required")
    @Size(max = 1000, message = "Reason must be at most 1000 characters")
    @JsonProperty("reason")
    String reason;
}

package com.flagship.prior_auth.authorization.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.prior_auth.authorization.AuthorizationStatus;
import com.flagship.prior_auth.authorization.StatusRefreshResult;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StatusRefreshResponse {

    @JsonProperty("authorization")
    AuthorizationResponse authorization;

    @JsonProperty("external_reference_id")
    String externalReferenceId;

    @JsonProperty("remote_status_code")
    String remoteStatusCode;

    @JsonProperty("mapped_status")
    AuthorizationStatus mappedStatus;

    @JsonProperty("recognized")
    boolean recognized;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("transitioned")
    boolean transitioned;

    public static StatusRefreshResponse from(StatusRefreshResult result) {
        return StatusRefreshResponse.builder()
            .authorization(AuthorizationResponse.from(result.getAuthorization()))
            .externalReferenceId(result.getRemoteStatus().getExternalReferenceId())
            .remoteStatusCode(result.getRemoteStatus().getRemoteStatusCode())
            .mappedStatus(result.getRemoteStatus().getMappedStatus())
            .recognized(result.getRemoteStatus().isRecognized())
            .notes(result.getRemoteStatus().getNotes())
            .transitioned(result.isTransitioned())
            .build();
    }
}

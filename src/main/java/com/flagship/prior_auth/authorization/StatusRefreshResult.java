package com.flagship.prior_auth.authorization;

import com.flagship.prior_auth.integration.StatusResponse;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StatusRefreshResult {
    Authorization authorization;
    StatusResponse remoteStatus;
    /** True if the remote status moved the authorization to a new status. */
    boolean transitioned;
}

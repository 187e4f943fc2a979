package com.flagship.prior_auth.authorization;

import lombok.Value;

/**
 * JSON renderings of the nested parts of an authorization, one per jsonb column.
 */
@Value
class AuthorizationDocuments {
    String patientInfo;
    String medicationInfo;
    String clinicalInfo;
    String documents;
    String workflowEvents;
    String metadata;
}

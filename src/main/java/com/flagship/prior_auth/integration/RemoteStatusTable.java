package com.flagship.prior_auth.integration;

import com.flagship.prior_auth.authorization.AuthorizationStatus;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed lookup from an upstream's status vocabulary to the local lifecycle.
 *
 * Codes missing from the table map to {@link AuthorizationStatus#NEEDS_INFO} and the raw
 * code is kept in the evidence text so it is never dropped.
 */
public final class RemoteStatusTable {

    private final String vocabulary;
    private final Map<String, AuthorizationStatus> table;

    public RemoteStatusTable(String vocabulary, Map<String, AuthorizationStatus> table) {
        this.vocabulary = vocabulary;
        this.table = Map.copyOf(table);
    }

    public Optional<AuthorizationStatus> lookup(String remoteCode) {
        if (remoteCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(table.get(remoteCode.trim().toUpperCase(Locale.ROOT)));
    }

    public StatusResponse toStatusResponse(String externalReferenceId, String remoteCode,
                                           String notes, String rawWireMessage) {
        Optional<AuthorizationStatus> mapped = lookup(remoteCode);
        String evidence = mapped.isPresent()
                ? rawWireMessage
                : String.format("Unmapped %s status code '%s'%n%s", vocabulary, remoteCode, rawWireMessage);
        return StatusResponse.builder()
                .externalReferenceId(externalReferenceId)
                .remoteStatusCode(remoteCode)
                .mappedStatus(mapped.orElse(AuthorizationStatus.NEEDS_INFO))
                .recognized(mapped.isPresent())
                .notes(notes)
                .rawEvidence(evidence)
                .build();
    }
}

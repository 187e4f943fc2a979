package com.flagship.prior_auth.authorization;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable storage for authorizations.
 *
 * {@link #save} is one atomic unit covering the status field and the new history
 * entries, and is guarded by an optimistic version check: saving an instance whose
 * {@code version} no longer matches the stored one fails with
 * {@link com.flagship.prior_auth.error.ConcurrentUpdateException}.
 */
public interface AuthorizationStore {

    /**
     * Loads the current state. The status is derived from the last history entry.
     */
    Optional<Authorization> load(UUID id);

    /**
     * Inserts ({@code version == null}) or updates the authorization.
     *
     * @return the stored authorization carrying its new version
     */
    Authorization save(Authorization authorization);

    List<Authorization> findByStatus(AuthorizationStatus status);
}

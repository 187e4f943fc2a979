package com.flagship.prior_auth.authorization;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AuthorizationRepository extends JpaRepository<AuthorizationEntity, UUID> {

    List<AuthorizationEntity> findByStatusOrderByUpdatedAtAsc(AuthorizationStatus status);
}

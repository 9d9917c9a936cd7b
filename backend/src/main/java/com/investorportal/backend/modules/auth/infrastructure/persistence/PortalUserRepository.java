package com.investorportal.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.investorportal.backend.modules.auth.domain.PortalUser;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PortalUserRepository extends JpaRepository<PortalUser, UUID> {

    Optional<PortalUser> findByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCase(String email);
}

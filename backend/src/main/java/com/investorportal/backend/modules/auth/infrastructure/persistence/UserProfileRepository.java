package com.investorportal.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.investorportal.backend.modules.auth.domain.UserProfile;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserProfileRepository extends JpaRepository<UserProfile, UUID> {

    @Query("""
            select p
              from UserProfile p
              join fetch p.user u
             where u.id = :userId
            """)
    Optional<UserProfile> findByUserId(@Param("userId") UUID userId);
}

package com.investorportal.backend.modules.rbac.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.investorportal.backend.modules.rbac.domain.UserRole;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserRoleRepository extends JpaRepository<UserRole, UUID> {

    @Query("""
            select ur
              from UserRole ur
             where ur.user.id = :userId
               and ur.role.id = :roleId
            """)
    Optional<UserRole> findByUserIdAndRoleId(@Param("userId") UUID userId, @Param("roleId") UUID roleId);

    @Query("""
            select ur
              from UserRole ur
              join fetch ur.role r
             where ur.user.id = :userId
               and ur.active = true
               and r.active = true
             order by r.name
            """)
    List<UserRole> findActiveByUserId(@Param("userId") UUID userId);

    @Query("""
            select distinct r.name
              from UserRole ur
              join ur.role r
             where ur.user.id = :userId
               and ur.active = true
               and r.active = true
            """)
    List<String> findEffectiveRoleNames(@Param("userId") UUID userId);

    @Query("""
            select count(ur) > 0
              from UserRole ur
             where ur.role.id = :roleId
               and ur.active = true
            """)
    boolean existsActiveByRoleId(@Param("roleId") UUID roleId);
}

package com.investorportal.backend.modules.rbac.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.investorportal.backend.modules.rbac.domain.RoleAssignment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoleAssignmentRepository extends JpaRepository<RoleAssignment, UUID> {

    @Query("""
            select ra
              from RoleAssignment ra
             where ra.user.id = :userId
               and ra.role.id = :roleId
               and ra.active = true
            """)
    Optional<RoleAssignment> findOpen(@Param("userId") UUID userId, @Param("roleId") UUID roleId);

    @Query("""
            select ra
              from RoleAssignment ra
              join fetch ra.role r
             where ra.user.id = :userId
             order by ra.createdAt desc
            """)
    List<RoleAssignment> findHistoryByUserId(@Param("userId") UUID userId);
}

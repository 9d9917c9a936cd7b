package com.investorportal.backend.modules.rbac.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.investorportal.backend.modules.rbac.domain.RolePermission;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RolePermissionRepository extends JpaRepository<RolePermission, UUID> {

    @Query("""
            select rp
              from RolePermission rp
             where rp.role.id = :roleId
               and rp.permission.id = :permissionId
            """)
    Optional<RolePermission> findByRoleIdAndPermissionId(@Param("roleId") UUID roleId,
                                                         @Param("permissionId") UUID permissionId);

    @Query("""
            select count(rp) > 0
              from RolePermission rp
             where rp.permission.id = :permissionId
               and rp.active = true
            """)
    boolean existsActiveByPermissionId(@Param("permissionId") UUID permissionId);

    /**
     * Permission names reachable by the user through active holdings of active roles
     * whose grant and permission are both active.
     */
    @Query("""
            select distinct p.name
              from UserRole ur
              join ur.role r
              join RolePermission rp on rp.role = r
              join rp.permission p
             where ur.user.id = :userId
               and ur.active = true
               and r.active = true
               and rp.active = true
               and p.active = true
            """)
    List<String> findEffectivePermissionNames(@Param("userId") UUID userId);
}

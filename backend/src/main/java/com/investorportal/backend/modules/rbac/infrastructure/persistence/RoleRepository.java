package com.investorportal.backend.modules.rbac.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.investorportal.backend.modules.rbac.domain.Role;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoleRepository extends JpaRepository<Role, UUID> {

    Optional<Role> findByName(String name);

    boolean existsByName(String name);

    boolean existsByNameAndIdNot(String name, UUID id);

    List<Role> findAllByOrderByNameAsc();

    List<Role> findByActiveTrueOrderByNameAsc();

    Optional<Role> findFirstByDefaultRoleTrueAndActiveTrue();

    @Modifying(flushAutomatically = true)
    @Query("""
            update Role r
               set r.defaultRole = false,
                   r.updatedAt = :now
             where r.defaultRole = true
            """)
    int clearDefault(@Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true)
    @Query("""
            update Role r
               set r.defaultRole = false,
                   r.updatedAt = :now
             where r.defaultRole = true
               and r.id <> :roleId
            """)
    int clearDefaultExcept(@Param("roleId") UUID roleId, @Param("now") OffsetDateTime now);
}

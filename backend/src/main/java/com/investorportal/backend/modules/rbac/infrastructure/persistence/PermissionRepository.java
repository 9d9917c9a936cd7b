package com.investorportal.backend.modules.rbac.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.investorportal.backend.modules.rbac.domain.Permission;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PermissionRepository extends JpaRepository<Permission, UUID> {

    boolean existsByName(String name);

    boolean existsByNameAndIdNot(String name, UUID id);

    List<Permission> findAllByOrderByNameAsc();

    List<Permission> findByActiveTrueOrderByNameAsc();
}

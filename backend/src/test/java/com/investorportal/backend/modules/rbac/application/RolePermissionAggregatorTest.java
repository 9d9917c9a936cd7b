package com.investorportal.backend.modules.rbac.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.UUID;

import com.investorportal.backend.modules.rbac.application.RolePermissionAggregator.ResolvedAuthorities;
import com.investorportal.backend.modules.rbac.infrastructure.persistence.RolePermissionRepository;
import com.investorportal.backend.modules.rbac.infrastructure.persistence.UserRoleRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RolePermissionAggregatorTest {

    @Mock
    private UserRoleRepository userRoleRepository;

    @Mock
    private RolePermissionRepository rolePermissionRepository;

    @InjectMocks
    private RolePermissionAggregator aggregator;

    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        when(userRoleRepository.findEffectiveRoleNames(userId)).thenReturn(List.of("ADMIN", "USER"));
        when(rolePermissionRepository.findEffectivePermissionNames(userId))
                .thenReturn(List.of("CREATE_USER", "VIEW_DASHBOARD", "VIEW_DASHBOARD"));
    }

    @Test
    void resolvesRolesAndUnionOfPermissions() {
        ResolvedAuthorities authorities = aggregator.resolve(userId);

        assertThat(authorities.roles()).containsExactlyInAnyOrder("ADMIN", "USER");
        assertThat(authorities.permissions()).containsExactlyInAnyOrder("CREATE_USER", "VIEW_DASHBOARD");
    }

    @Test
    void membershipHelpersReadTheResolvedSets() {
        assertThat(aggregator.hasRole(userId, "ADMIN")).isTrue();
        assertThat(aggregator.hasAnyRole(userId, List.of("INVESTOR", "USER"))).isTrue();
        assertThat(aggregator.hasAllPermissions(userId, List.of("CREATE_USER", "VIEW_DASHBOARD"))).isTrue();
        assertThat(aggregator.hasAllPermissions(userId, List.of("CREATE_USER", "DELETE_USER"))).isFalse();
        assertThat(aggregator.hasAnyPermission(userId, List.of("DELETE_USER"))).isFalse();
    }
}

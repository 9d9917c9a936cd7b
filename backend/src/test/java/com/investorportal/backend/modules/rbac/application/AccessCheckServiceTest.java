package com.investorportal.backend.modules.rbac.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.UUID;

import com.investorportal.backend.global.error.NotFoundProblemException;
import com.investorportal.backend.modules.auth.infrastructure.persistence.PortalUserRepository;
import com.investorportal.backend.modules.rbac.domain.PermissionMatch;
import com.investorportal.backend.modules.rbac.infrastructure.persistence.RolePermissionRepository;
import com.investorportal.backend.modules.rbac.infrastructure.persistence.UserRoleRepository;
import com.investorportal.backend.modules.rbac.presentation.dto.PermissionCheckResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AccessCheckServiceTest {

    @Mock
    private PortalUserRepository portalUserRepository;

    @Mock
    private UserRoleRepository userRoleRepository;

    @Mock
    private RolePermissionRepository rolePermissionRepository;

    private AccessCheckService accessCheckService;
    private final UUID investorId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        accessCheckService = new AccessCheckService(portalUserRepository,
                new RolePermissionAggregator(userRoleRepository, rolePermissionRepository));

        when(portalUserRepository.existsById(any())).thenReturn(false);
        when(portalUserRepository.existsById(investorId)).thenReturn(true);
        when(userRoleRepository.findEffectiveRoleNames(investorId)).thenReturn(List.of("INVESTOR"));
        when(rolePermissionRepository.findEffectivePermissionNames(investorId))
                .thenReturn(List.of("VIEW_PORTFOLIO", "CREATE_PORTFOLIO"));
    }

    @Test
    void permissionCheckRequiresEveryPermissionByDefault() {
        PermissionCheckResponse response = accessCheckService.checkPermissions(investorId,
                List.of("VIEW_PORTFOLIO", "DELETE_PORTFOLIO"), null);

        assertThat(response.match()).isEqualTo(PermissionMatch.ALL);
        assertThat(response.granted()).isFalse();
        assertThat(accessCheckService.checkPermissions(investorId, List.of("VIEW_PORTFOLIO", "CREATE_PORTFOLIO"), null)
                .granted()).isTrue();
    }

    @Test
    void anyMatchNeedsOnlyOnePermission() {
        PermissionCheckResponse response = accessCheckService.checkPermissions(investorId,
                List.of("VIEW_PORTFOLIO", "DELETE_PORTFOLIO"), PermissionMatch.ANY);

        assertThat(response.granted()).isTrue();
        assertThat(response.permissions()).containsExactly("VIEW_PORTFOLIO", "DELETE_PORTFOLIO");
        assertThat(accessCheckService.checkPermissions(investorId, List.of("DELETE_PORTFOLIO"), PermissionMatch.ANY)
                .granted()).isFalse();
    }

    @Test
    void roleChecksUseEffectiveRoles() {
        assertThat(accessCheckService.checkRole(investorId, "INVESTOR").granted()).isTrue();
        assertThat(accessCheckService.checkRole(investorId, "ADMIN").granted()).isFalse();
        assertThat(accessCheckService.checkAnyRole(investorId, List.of("ADMIN", "INVESTOR")).granted()).isTrue();
        assertThat(accessCheckService.checkAnyRole(investorId, List.of("ADMIN", "USER")).granted()).isFalse();
    }

    @Test
    void unknownUserIsNotFoundBeforeAnyLookup() {
        UUID stranger = UUID.randomUUID();

        NotFoundProblemException exception = assertThrows(NotFoundProblemException.class,
                () -> accessCheckService.checkRole(stranger, "ADMIN"));

        assertThat(exception.getCode()).isEqualTo("rbac.user_not_found");
        verifyNoInteractions(userRoleRepository, rolePermissionRepository);
    }
}

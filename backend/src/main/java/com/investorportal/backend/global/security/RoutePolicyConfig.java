package com.investorportal.backend.global.security;

import static com.investorportal.backend.modules.rbac.domain.PortalAuthorities.ASSIGN_ROLE;
import static com.investorportal.backend.modules.rbac.domain.PortalAuthorities.CREATE_PERMISSION;
import static com.investorportal.backend.modules.rbac.domain.PortalAuthorities.CREATE_ROLE;
import static com.investorportal.backend.modules.rbac.domain.PortalAuthorities.DELETE_PERMISSION;
import static com.investorportal.backend.modules.rbac.domain.PortalAuthorities.DELETE_ROLE;
import static com.investorportal.backend.modules.rbac.domain.PortalAuthorities.REVOKE_ROLE;
import static com.investorportal.backend.modules.rbac.domain.PortalAuthorities.ROLE_ADMIN;
import static com.investorportal.backend.modules.rbac.domain.PortalAuthorities.ROLE_INVESTOR;
import static com.investorportal.backend.modules.rbac.domain.PortalAuthorities.UPDATE_PERMISSION;
import static com.investorportal.backend.modules.rbac.domain.PortalAuthorities.UPDATE_ROLE;
import static com.investorportal.backend.modules.rbac.domain.PortalAuthorities.UPDATE_USER;
import static com.investorportal.backend.modules.rbac.domain.PortalAuthorities.VIEW_PERMISSION;
import static com.investorportal.backend.modules.rbac.domain.PortalAuthorities.VIEW_ROLE;
import static com.investorportal.backend.modules.rbac.domain.PortalAuthorities.VIEW_SYSTEM_METRICS;
import static com.investorportal.backend.modules.rbac.domain.PortalAuthorities.VIEW_USER;

import com.investorportal.backend.modules.rbac.domain.AccessPolicy;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;

/**
 * Route table. Everything under {@code /admin} is limited to ADMIN holders, except reading one's
 * own role holdings, which {@code UserRoleController} narrows further to the caller's own id for
 * non-admins.
 */
@Configuration
public class RoutePolicyConfig {

    @Bean
    public RoutePolicyRegistry routePolicyRegistry() {
        return RoutePolicyRegistry.builder()
                // public
                .route(HttpMethod.POST, "/auth/register", AccessPolicy.publicAccess())
                .route(HttpMethod.POST, "/auth/login", AccessPolicy.publicAccess())
                .route(HttpMethod.POST, "/auth/refresh", AccessPolicy.publicAccess())
                .route(HttpMethod.POST, "/auth/logout", AccessPolicy.publicAccess())
                .route(HttpMethod.GET, "/health", AccessPolicy.publicAccess())
                .route(HttpMethod.GET, "/readyz", AccessPolicy.publicAccess())
                .route(HttpMethod.GET, "/actuator/health/**", AccessPolicy.publicAccess())
                .route(HttpMethod.GET, "/v3/api-docs/**", AccessPolicy.publicAccess())
                .route(HttpMethod.GET, "/swagger-ui/**", AccessPolicy.publicAccess())
                .route(HttpMethod.GET, "/swagger-ui.html", AccessPolicy.publicAccess())
                .route("/error", AccessPolicy.publicAccess())

                // self service
                .route(HttpMethod.GET, "/auth/me", AccessPolicy.authenticated())
                .route(HttpMethod.POST, "/auth/logout-all", AccessPolicy.authenticated())
                .route(HttpMethod.POST, "/admin/permissions/check/me", AccessPolicy.authenticated())
                .route(HttpMethod.GET, "/admin/users/*/roles", AccessPolicy.anyRole(ROLE_ADMIN, ROLE_INVESTOR))

                // user administration
                .route(HttpMethod.PATCH, "/admin/users/*/status", admin().requireAllPermissions(UPDATE_USER).build())
                .route(HttpMethod.GET, "/admin/users/*/role-history",
                        admin().requireAllPermissions(VIEW_USER, VIEW_ROLE).build())

                // role-permission grants
                .route(HttpMethod.POST, "/admin/roles/*/permissions/*",
                        admin().requireAnyPermission(UPDATE_ROLE, UPDATE_PERMISSION).build())
                .route(HttpMethod.DELETE, "/admin/roles/*/permissions/*",
                        admin().requireAnyPermission(UPDATE_ROLE, UPDATE_PERMISSION).build())

                // role assignments
                .route(HttpMethod.POST, "/admin/roles/*/assignments", admin().requireAllPermissions(ASSIGN_ROLE).build())
                .route(HttpMethod.POST, "/admin/roles/*/bulk-assignments", admin().requireAllPermissions(ASSIGN_ROLE).build())
                .route(HttpMethod.DELETE, "/admin/roles/*/assignments/*", admin().requireAllPermissions(REVOKE_ROLE).build())

                // roles
                .route(HttpMethod.GET, "/admin/roles/**", admin().requireAllPermissions(VIEW_ROLE).build())
                .route(HttpMethod.POST, "/admin/roles", admin().requireAllPermissions(CREATE_ROLE).build())
                .route(HttpMethod.PUT, "/admin/roles/*", admin().requireAllPermissions(UPDATE_ROLE).build())
                .route(HttpMethod.DELETE, "/admin/roles/*", admin().requireAllPermissions(DELETE_ROLE).build())

                // permissions
                .route(HttpMethod.GET, "/admin/permissions", admin().requireAllPermissions(VIEW_PERMISSION).build())
                .route(HttpMethod.POST, "/admin/permissions/check/*", admin().requireAllPermissions(VIEW_PERMISSION).build())
                .route(HttpMethod.POST, "/admin/permissions", admin().requireAllPermissions(CREATE_PERMISSION).build())
                .route(HttpMethod.PUT, "/admin/permissions/*", admin().requireAllPermissions(UPDATE_PERMISSION).build())
                .route(HttpMethod.DELETE, "/admin/permissions/*", admin().requireAllPermissions(DELETE_PERMISSION).build())

                // operations
                .route("/actuator/**", admin().requireAnyPermission(VIEW_SYSTEM_METRICS).build())
                .route("/admin/**", AccessPolicy.allRoles(ROLE_ADMIN))
                .build();
    }

    private static AccessPolicy.Builder admin() {
        return AccessPolicy.builder().requireAllRoles(ROLE_ADMIN);
    }
}

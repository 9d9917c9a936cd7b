package com.investorportal.backend.modules.rbac.application;

import java.util.Collections;
import java.util.Set;

import com.investorportal.backend.global.error.AuthenticationProblemException;
import com.investorportal.backend.global.error.AuthorizationProblemException;
import com.investorportal.backend.global.security.AuthenticatedPrincipal;
import com.investorportal.backend.modules.rbac.domain.AccessPolicy;
import com.investorportal.backend.modules.rbac.domain.PolicyDecision;
import com.investorportal.backend.modules.rbac.domain.PolicyDecision.RequirementCategory;

import org.springframework.stereotype.Component;

/**
 * Decides whether a principal satisfies an {@link AccessPolicy}.
 *
 * <p>Categories are checked in a fixed order (all roles, any role, all permissions, any
 * permission) and the first failing one is reported. The evaluator holds no state.</p>
 */
@Component
public class AuthorizationEvaluator {

    /**
     * @throws AuthenticationProblemException when the policy is not public and there is no active principal
     */
    public PolicyDecision check(AccessPolicy policy, AuthenticatedPrincipal principal) {
        if (policy.publicRoute()) {
            return PolicyDecision.allow();
        }
        if (principal == null || !principal.active()) {
            throw AuthenticationProblemException.unauthenticated();
        }

        Set<String> roles = principal.roles();
        Set<String> permissions = principal.permissions();

        if (!policy.requireAllRoles().isEmpty() && !roles.containsAll(policy.requireAllRoles())) {
            return PolicyDecision.deny(RequirementCategory.ALL_ROLES, policy.requireAllRoles(), roles);
        }
        if (!policy.requireAnyRole().isEmpty() && Collections.disjoint(roles, policy.requireAnyRole())) {
            return PolicyDecision.deny(RequirementCategory.ANY_ROLE, policy.requireAnyRole(), roles);
        }
        if (!policy.requireAllPermissions().isEmpty() && !permissions.containsAll(policy.requireAllPermissions())) {
            return PolicyDecision.deny(RequirementCategory.ALL_PERMISSIONS, policy.requireAllPermissions(), permissions);
        }
        if (!policy.requireAnyPermission().isEmpty() && Collections.disjoint(permissions, policy.requireAnyPermission())) {
            return PolicyDecision.deny(RequirementCategory.ANY_PERMISSION, policy.requireAnyPermission(), permissions);
        }
        return PolicyDecision.allow();
    }

    public void enforce(AccessPolicy policy, AuthenticatedPrincipal principal) {
        PolicyDecision decision = check(policy, principal);
        if (!decision.allowed()) {
            throw new AuthorizationProblemException(decision.failedCategory().name(), decision.required(), decision.held());
        }
    }
}

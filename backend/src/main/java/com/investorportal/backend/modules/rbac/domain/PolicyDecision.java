package com.investorportal.backend.modules.rbac.domain;

import java.util.Set;

/**
 * Outcome of evaluating an {@link AccessPolicy}. A denial names the first failing category,
 * what it required and what the principal held.
 */
public record PolicyDecision(boolean allowed, RequirementCategory failedCategory, Set<String> required, Set<String> held) {

    private static final PolicyDecision ALLOW = new PolicyDecision(true, null, Set.of(), Set.of());

    public static PolicyDecision allow() {
        return ALLOW;
    }

    public static PolicyDecision deny(RequirementCategory category, Set<String> required, Set<String> held) {
        return new PolicyDecision(false, category, Set.copyOf(required), Set.copyOf(held));
    }

    public enum RequirementCategory {
        ALL_ROLES,
        ANY_ROLE,
        ALL_PERMISSIONS,
        ANY_PERMISSION
    }
}

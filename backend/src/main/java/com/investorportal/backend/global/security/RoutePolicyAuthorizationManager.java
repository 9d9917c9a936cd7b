package com.investorportal.backend.global.security;

import java.util.function.Supplier;

import com.investorportal.backend.modules.rbac.application.AuthorizationEvaluator;
import com.investorportal.backend.modules.rbac.domain.AccessPolicy;
import com.investorportal.backend.modules.rbac.domain.PolicyDecision;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;
import org.springframework.stereotype.Component;

/**
 * Bridges the route policy table into Spring Security's request authorization.
 *
 * <p>A missing principal is denied here and rendered as 401 by the entry point; a principal
 * failing a requirement is denied and rendered as 403 by the access denied handler.</p>
 */
@Component
public class RoutePolicyAuthorizationManager implements AuthorizationManager<RequestAuthorizationContext> {

    private static final Logger log = LoggerFactory.getLogger(RoutePolicyAuthorizationManager.class);
    private static final AuthorizationDecision GRANTED = new AuthorizationDecision(true);
    private static final AuthorizationDecision DENIED = new AuthorizationDecision(false);

    private final RoutePolicyRegistry routePolicyRegistry;
    private final AuthorizationEvaluator authorizationEvaluator;

    public RoutePolicyAuthorizationManager(RoutePolicyRegistry routePolicyRegistry,
                                           AuthorizationEvaluator authorizationEvaluator) {
        this.routePolicyRegistry = routePolicyRegistry;
        this.authorizationEvaluator = authorizationEvaluator;
    }

    @Override
    public AuthorizationDecision check(Supplier<Authentication> authentication, RequestAuthorizationContext context) {
        HttpServletRequest request = context.getRequest();
        AccessPolicy policy = routePolicyRegistry.resolve(request);
        if (policy.publicRoute()) {
            return GRANTED;
        }

        Authentication current = authentication.get();
        if (current == null || !(current.getPrincipal() instanceof AuthenticatedPrincipal principal) || !principal.active()) {
            return DENIED;
        }

        PolicyDecision decision = authorizationEvaluator.check(policy, principal);
        if (!decision.allowed()) {
            log.warn("Access denied for user {} on {} {}: {} required {} but principal holds {}",
                    principal.userId(), request.getMethod(), request.getRequestURI(),
                    decision.failedCategory(), decision.required(), decision.held());
            return DENIED;
        }
        return GRANTED;
    }
}

package com.investorportal.backend.global.security;

import java.util.ArrayList;
import java.util.List;

import com.investorportal.backend.modules.rbac.domain.AccessPolicy;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpMethod;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.util.UrlPathHelper;

/**
 * Ordered route to policy table. The first registration matching method and path wins;
 * routes nobody registered require an authenticated caller.
 */
public final class RoutePolicyRegistry {

    private static final AntPathMatcher PATH_MATCHER = new AntPathMatcher();

    private final List<Registration> registrations;
    private final AccessPolicy fallback;

    private RoutePolicyRegistry(List<Registration> registrations, AccessPolicy fallback) {
        this.registrations = List.copyOf(registrations);
        this.fallback = fallback;
    }

    public static Builder builder() {
        return new Builder();
    }

    public AccessPolicy resolve(HttpServletRequest request) {
        String path = UrlPathHelper.defaultInstance.getPathWithinApplication(request);
        return resolve(HttpMethod.valueOf(request.getMethod()), path);
    }

    public AccessPolicy resolve(HttpMethod method, String path) {
        for (Registration registration : registrations) {
            if (registration.matches(method, path)) {
                return registration.policy();
            }
        }
        return fallback;
    }

    private record Registration(HttpMethod method, String pattern, AccessPolicy policy) {

        boolean matches(HttpMethod requestMethod, String path) {
            return (method == null || method.equals(requestMethod)) && PATH_MATCHER.match(pattern, path);
        }
    }

    public static final class Builder {

        private final List<Registration> registrations = new ArrayList<>();
        private AccessPolicy fallback = AccessPolicy.authenticated();

        private Builder() {
        }

        public Builder route(HttpMethod method, String pattern, AccessPolicy policy) {
            registrations.add(new Registration(method, pattern, policy));
            return this;
        }

        /**
         * Registers the policy for every HTTP method.
         */
        public Builder route(String pattern, AccessPolicy policy) {
            return route(null, pattern, policy);
        }

        public Builder fallback(AccessPolicy policy) {
            this.fallback = policy;
            return this;
        }

        public RoutePolicyRegistry build() {
            return new RoutePolicyRegistry(registrations, fallback);
        }
    }
}

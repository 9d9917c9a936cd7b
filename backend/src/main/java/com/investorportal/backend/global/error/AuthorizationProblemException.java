package com.investorportal.backend.global.error;

import java.util.Set;

import org.springframework.http.HttpStatus;

/**
 * Authenticated caller lacking a required role or permission.
 *
 * <p>The caller only sees a generic detail. {@link #getDiagnostic()} names the failed requirement
 * and the principal's holdings and is meant for server-side logs.</p>
 */
public class AuthorizationProblemException extends ProblemException {

    public static final String CODE = "auth.forbidden";

    private final String category;
    private final Set<String> required;
    private final Set<String> held;

    public AuthorizationProblemException(String category, Set<String> required, Set<String> held) {
        super(HttpStatus.FORBIDDEN, CODE, "Insufficient permissions");
        this.category = category;
        this.required = Set.copyOf(required);
        this.held = Set.copyOf(held);
    }

    public String getCategory() {
        return category;
    }

    public Set<String> getRequired() {
        return required;
    }

    public Set<String> getHeld() {
        return held;
    }

    public String getDiagnostic() {
        return category + " required " + required + " but principal holds " + held;
    }
}

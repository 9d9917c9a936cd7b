package com.investorportal.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Bad credentials, inactive or missing account, or an invalid, expired, revoked or malformed
 * token. The detail never says which of these occurred.
 */
public class AuthenticationProblemException extends ProblemException {

    public static final String INVALID_CREDENTIALS = "auth.invalid_credentials";
    public static final String INVALID_TOKEN = "auth.invalid_token";
    public static final String UNAUTHENTICATED = "auth.unauthenticated";

    public AuthenticationProblemException(String code, String detail) {
        super(HttpStatus.UNAUTHORIZED, code, detail);
    }

    public AuthenticationProblemException(String code, String detail, Throwable cause) {
        super(HttpStatus.UNAUTHORIZED, code, detail, cause);
    }

    public static AuthenticationProblemException invalidCredentials() {
        return new AuthenticationProblemException(INVALID_CREDENTIALS, "Invalid credentials");
    }

    public static AuthenticationProblemException invalidToken() {
        return new AuthenticationProblemException(INVALID_TOKEN, "Invalid or expired token");
    }

    public static AuthenticationProblemException invalidToken(Throwable cause) {
        return new AuthenticationProblemException(INVALID_TOKEN, "Invalid or expired token", cause);
    }

    public static AuthenticationProblemException unauthenticated() {
        return new AuthenticationProblemException(UNAUTHENTICATED, "Authentication required");
    }
}

package com.investorportal.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Immutable authorization kernel settings, bound once at startup from {@code auth.*}.
 *
 * <p>Access and refresh tokens are signed with different keys; binding fails when a secret is
 * missing or when both secrets resolve to the same key bytes. A secret prefixed with
 * {@code base64:} is decoded, any other value is used as UTF-8 text.</p>
 */
@ConfigurationProperties(prefix = "auth")
public record AuthProperties(
        Jwt jwt,
        @DefaultValue("USER") String defaultRole
) {

    public static final String BASE64_PREFIX = "base64:";

    public AuthProperties {
        if (jwt == null) {
            throw new IllegalStateException("auth.jwt.* must be configured");
        }
        requireText(jwt.accessSecret(), "auth.jwt.access-secret");
        requireText(jwt.refreshSecret(), "auth.jwt.refresh-secret");
        if (Arrays.equals(jwt.accessKeyBytes(), jwt.refreshKeyBytes())) {
            throw new IllegalStateException("auth.jwt.access-secret and auth.jwt.refresh-secret must differ");
        }
    }

    private static void requireText(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(property + " must not be blank");
        }
    }

    static byte[] decodeSecret(String secret, String property) {
        if (!secret.startsWith(BASE64_PREFIX)) {
            return secret.getBytes(StandardCharsets.UTF_8);
        }
        try {
            return Base64.getDecoder().decode(secret.substring(BASE64_PREFIX.length()));
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException(property + " is not valid Base64", ex);
        }
    }

    public record Jwt(
            String accessSecret,
            String refreshSecret,
            @DefaultValue("15m") String accessExpiration,
            @DefaultValue("7d") String refreshExpiration
    ) {

        public byte[] accessKeyBytes() {
            return decodeSecret(accessSecret, "auth.jwt.access-secret");
        }

        public byte[] refreshKeyBytes() {
            return decodeSecret(refreshSecret, "auth.jwt.refresh-secret");
        }
    }
}

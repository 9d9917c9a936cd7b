package com.investorportal.backend.modules.auth.infrastructure.jwt;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.investorportal.backend.global.config.AuthProperties;

import org.springframework.stereotype.Component;

/**
 * Holds the two HMAC keys: one for access tokens, one for refresh tokens.
 * Key bytes come from {@link AuthProperties.Jwt}, which decodes {@code base64:} secrets.
 */
@Component
public class JwtTokenProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final int MIN_KEY_BYTES = 32;

    private final SecretKey accessKey;
    private final SecretKey refreshKey;

    public JwtTokenProvider(AuthProperties properties) {
        this.accessKey = toKey(properties.jwt().accessKeyBytes(), "auth.jwt.access-secret");
        this.refreshKey = toKey(properties.jwt().refreshKeyBytes(), "auth.jwt.refresh-secret");
    }

    private static SecretKey toKey(byte[] keyBytes, String property) {
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException(property + " must be at least " + MIN_KEY_BYTES + " bytes for HS256");
        }
        return new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    public SecretKey getAccessKey() {
        return accessKey;
    }

    public SecretKey getRefreshKey() {
        return refreshKey;
    }
}

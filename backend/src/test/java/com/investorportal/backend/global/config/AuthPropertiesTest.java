package com.investorportal.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.junit.jupiter.api.Test;

class AuthPropertiesTest {

    private static final String ACCESS = "access-signing-secret-0123456789-abcdefghij";
    private static final String REFRESH = "refresh-signing-secret-9876543210-klmnopqrst";

    @Test
    void plainSecretsAreUsedAsUtf8EvenWhenTheyLookLikeBase64() {
        String base64Looking = "QWxhZGRpbjpvcGVuIHNlc2FtZUFsYWRkaW46b3Blbg==";

        AuthProperties properties = properties(base64Looking, REFRESH);

        assertThat(properties.jwt().accessKeyBytes()).isEqualTo(base64Looking.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void prefixedSecretsAreDecoded() {
        byte[] key = "0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.UTF_8);
        String encoded = AuthProperties.BASE64_PREFIX + Base64.getEncoder().encodeToString(key);

        AuthProperties properties = properties(encoded, REFRESH);

        assertThat(properties.jwt().accessKeyBytes()).isEqualTo(key);
    }

    @Test
    void rejectsTwoEncodingsOfTheSameKey() {
        String encoded = AuthProperties.BASE64_PREFIX
                + Base64.getEncoder().encodeToString(ACCESS.getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> properties(ACCESS, encoded))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must differ");
    }

    @Test
    void rejectsIdenticalOrBlankSecrets() {
        assertThatThrownBy(() -> properties(ACCESS, ACCESS)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> properties(" ", REFRESH))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("auth.jwt.access-secret");
    }

    @Test
    void rejectsMalformedBase64() {
        assertThatThrownBy(() -> properties(AuthProperties.BASE64_PREFIX + "not*base64", REFRESH))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not valid Base64");
    }

    private static AuthProperties properties(String accessSecret, String refreshSecret) {
        return new AuthProperties(new AuthProperties.Jwt(accessSecret, refreshSecret, "15m", "7d"), "USER");
    }
}

package com.investorportal.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.Test;

class TokenLifetimeTest {

    private static final Duration FALLBACK = Duration.ofSeconds(42);

    @Test
    void parsesMinutesHoursAndDays() {
        assertThat(TokenLifetime.parse("15m", FALLBACK)).isEqualTo(Duration.ofMinutes(15));
        assertThat(TokenLifetime.parse("12h", FALLBACK)).isEqualTo(Duration.ofHours(12));
        assertThat(TokenLifetime.parse(" 7d ", FALLBACK)).isEqualTo(Duration.ofDays(7));
    }

    @Test
    void returnsFallbackForAnythingElse() {
        assertThat(TokenLifetime.parse(null, FALLBACK)).isEqualTo(FALLBACK);
        assertThat(TokenLifetime.parse("", FALLBACK)).isEqualTo(FALLBACK);
        assertThat(TokenLifetime.parse("15", FALLBACK)).isEqualTo(FALLBACK);
        assertThat(TokenLifetime.parse("15s", FALLBACK)).isEqualTo(FALLBACK);
        assertThat(TokenLifetime.parse("-5m", FALLBACK)).isEqualTo(FALLBACK);
        assertThat(TokenLifetime.parse("99999999999999999999d", FALLBACK)).isEqualTo(FALLBACK);
    }

    @Test
    void zeroLifetimeIsNotAccepted() {
        assertThat(TokenLifetime.parse("0m", FALLBACK)).isEqualTo(FALLBACK);
        assertThat(TokenLifetime.parse("000d", FALLBACK)).isEqualTo(FALLBACK);
    }

    @Test
    void lifetimeTooLargeForDurationFallsBack() {
        assertThat(TokenLifetime.parse("9999999999999999d", FALLBACK)).isEqualTo(FALLBACK);
        assertThat(TokenLifetime.parse("999999999999999999h", FALLBACK)).isEqualTo(FALLBACK);
    }
}

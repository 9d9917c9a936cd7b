package com.investorportal.backend.modules.auth.application;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses lifetimes written as {@code <digits>m|h|d}, e.g. {@code 15m} or {@code 7d}.
 * Zero amounts and amounts too large for a {@link Duration} fall back like any other unrecognized value.
 */
final class TokenLifetime {

    private static final Pattern FORMAT = Pattern.compile("^(\\d+)([mhd])$");

    private TokenLifetime() {
    }

    static Duration parse(String value, Duration fallback) {
        if (value == null) {
            return fallback;
        }
        Matcher matcher = FORMAT.matcher(value.trim());
        if (!matcher.matches()) {
            return fallback;
        }
        long amount;
        try {
            amount = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException ex) {
            return fallback;
        }
        if (amount <= 0) {
            return fallback;
        }
        try {
            return switch (matcher.group(2)) {
                case "m" -> Duration.ofMinutes(amount);
                case "h" -> Duration.ofHours(amount);
                default -> Duration.ofDays(amount);
            };
        } catch (ArithmeticException ex) {
            return fallback;
        }
    }
}

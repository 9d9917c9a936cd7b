package com.investorportal.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable record of refresh sessions, keyed by the opaque refresh token string.
 */
public interface SessionStore {

    /**
     * Persists a new live session. Storage failures propagate to the caller.
     */
    LiveSession create(NewSession session);

    /**
     * Revoked, expired and unknown tokens all come back empty.
     */
    Optional<LiveSession> findLive(String refreshToken);

    /**
     * Marks the session revoked if it is not already.
     *
     * @return {@code true} only for the call that performed the transition
     */
    boolean revoke(String refreshToken);

    int revokeAll(UUID userId);

    /**
     * Deletes sessions that are expired or revoked.
     */
    int cleanup();

    void touchActivity(String refreshToken, String userAgent, String ipAddress);

    record NewSession(UUID userId, String refreshToken, OffsetDateTime expiresAt, String userAgent, String ipAddress) {
    }

    record LiveSession(UUID sessionId, UUID userId, String refreshToken, OffsetDateTime expiresAt,
                       String userAgent, String ipAddress) {
    }
}

package com.investorportal.backend.modules.auth.infrastructure.persistence;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.investorportal.backend.modules.auth.application.SessionStore;
import com.investorportal.backend.modules.auth.domain.UserSession;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class JpaSessionStore implements SessionStore {

    private final UserSessionRepository userSessionRepository;
    private final PortalUserRepository portalUserRepository;
    private final Clock clock;

    public JpaSessionStore(UserSessionRepository userSessionRepository,
                           PortalUserRepository portalUserRepository,
                           Clock clock) {
        this.userSessionRepository = userSessionRepository;
        this.portalUserRepository = portalUserRepository;
        this.clock = clock;
    }

    @Override
    public LiveSession create(NewSession session) {
        UserSession entity = new UserSession();
        entity.setUser(portalUserRepository.getReferenceById(session.userId()));
        entity.setRefreshToken(session.refreshToken());
        entity.setRevoked(false);
        entity.setExpiresAt(session.expiresAt());
        entity.setUserAgent(session.userAgent());
        entity.setIpAddress(session.ipAddress());
        UserSession saved = userSessionRepository.saveAndFlush(entity);
        return new LiveSession(saved.getId(), session.userId(), saved.getRefreshToken(), saved.getExpiresAt(),
                saved.getUserAgent(), saved.getIpAddress());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LiveSession> findLive(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return Optional.empty();
        }
        return userSessionRepository.findLive(refreshToken, now())
                .map(session -> new LiveSession(
                        session.getId(),
                        session.getUser().getId(),
                        session.getRefreshToken(),
                        session.getExpiresAt(),
                        session.getUserAgent(),
                        session.getIpAddress()
                ));
    }

    @Override
    public boolean revoke(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return false;
        }
        return userSessionRepository.revokeIfActive(refreshToken, now()) > 0;
    }

    @Override
    public int revokeAll(UUID userId) {
        return userSessionRepository.revokeAllActive(userId, now());
    }

    @Override
    public int cleanup() {
        return userSessionRepository.deleteExpiredOrRevoked(now());
    }

    @Override
    public void touchActivity(String refreshToken, String userAgent, String ipAddress) {
        userSessionRepository.touch(refreshToken, userAgent, ipAddress, now());
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}

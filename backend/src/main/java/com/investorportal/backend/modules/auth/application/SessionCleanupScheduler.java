package com.investorportal.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SessionCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionCleanupScheduler.class);

    private final SessionStore sessionStore;

    public SessionCleanupScheduler(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @Scheduled(fixedDelayString = "${auth.session.cleanup-interval:PT1H}")
    public void purgeDeadSessions() {
        int removed = sessionStore.cleanup();
        if (removed > 0) {
            log.info("Removed {} expired or revoked sessions", removed);
        }
    }
}

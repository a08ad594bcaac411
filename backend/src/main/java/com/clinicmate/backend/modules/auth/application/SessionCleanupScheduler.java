package com.clinicmate.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class SessionCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionCleanupScheduler.class);

    private final SessionService sessionService;

    public SessionCleanupScheduler(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @Scheduled(fixedDelayString = "${clinicmate.auth.session.cleanup-interval:PT1H}")
    @Transactional
    public void cleanupExpiredSessions() {
        SessionService.CleanupResult result = sessionService.cleanupExpired();
        if (result.expired() > 0 || result.deleted() > 0) {
            log.info("Session cleanup marked {} expired and deleted {} stale sessions", result.expired(),
                    result.deleted());
        }
    }
}

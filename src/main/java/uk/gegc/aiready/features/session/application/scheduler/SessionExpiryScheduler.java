package uk.gegc.aiready.features.session.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.aiready.features.session.application.SessionStore;

/**
 * Scheduler for discarding idle sessions.
 * Runs periodically, enumerates the live sessions and deletes each one that has been idle for at
 * least the session TTL. Deletion waits for any operation in progress on that session.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionExpiryScheduler {

    private final SessionStore sessionStore;

    /**
     * Sweep at a fixed delay, configurable via app.session.sweep-interval-ms.
     * Default: 60000 ms (1 minute)
     */
    @Scheduled(fixedDelayString = "${app.session.sweep-interval-ms:60000}")
    public void sweepIdleSessions() {
        log.debug("Running scheduled sweep of idle sessions");
        int expired = 0;
        for (String sessionId : sessionStore.sessionIds()) {
            try {
                if (sessionStore.deleteIfIdle(sessionId)) {
                    expired++;
                }
            } catch (Exception e) {
                log.error("Error while expiring session {}", sessionId, e);
                // Keep sweeping the remaining sessions
            }
        }
        if (expired > 0) {
            log.info("Expired {} idle sessions, {} remain", expired, sessionStore.size());
        }
    }
}

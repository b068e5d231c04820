package uk.gegc.aiready.features.session.application;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.aiready.features.session.config.SessionProperties;
import uk.gegc.aiready.features.session.domain.model.ConversionSession;
import uk.gegc.aiready.features.session.domain.model.SessionSnapshot;
import uk.gegc.aiready.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;

/**
 * Process-wide registry of conversion sessions.
 *
 * <p>Sessions are only reachable through {@link #read} and {@link #write}, which run a callback under the
 * session's shared or exclusive lock and refresh its last activity. A session idle for at least the TTL is
 * deleted on the next access or by the expiry sweeper, whichever comes first.
 */
@Component
@Slf4j
public class SessionStore {

    private final ConcurrentHashMap<String, ConversionSession> sessions = new ConcurrentHashMap<>();
    private final SessionProperties properties;
    private final ConversionMetrics metrics;
    private final Clock clock;

    public SessionStore(SessionProperties properties, ConversionMetrics metrics, Clock clock) {
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        metrics.bindActiveSessions(sessions::size);
    }

    /**
     * Resumes the session named by {@code token} when it is live, otherwise creates a new one.
     * An idle session named by the token is deleted before its replacement is created.
     */
    public SessionSnapshot getOrCreate(String token) {
        ConversionSession session = lockIfLive(token, false);
        if (session != null) {
            try {
                session.touch(clock.instant());
                return session.snapshot();
            } finally {
                session.readLock().unlock();
            }
        }

        ConversionSession created = new ConversionSession(UUID.randomUUID().toString(), clock.instant());
        sessions.put(created.getId(), created);
        log.info("Created session {} ({} active)", created.getId(), sessions.size());
        return created.snapshot();
    }

    public SessionSnapshot get(String token) {
        return read(token, ConversionSession::snapshot);
    }

    /**
     * Runs {@code action} under the session's shared lock.
     *
     * @throws ResourceNotFoundException if the session does not exist, was deleted or has expired
     */
    public <T> T read(String token, Function<ConversionSession, T> action) {
        return withLock(token, false, action);
    }

    /**
     * Runs {@code action} under the session's exclusive lock.
     *
     * @throws ResourceNotFoundException if the session does not exist, was deleted or has expired
     */
    public <T> T write(String token, Function<ConversionSession, T> action) {
        return withLock(token, true, action);
    }

    /**
     * Deletes the session, releasing every file's bytes immediately.
     *
     * @throws ResourceNotFoundException if the session does not exist
     */
    public void delete(String token) {
        ConversionSession session = token == null ? null : sessions.get(token);
        if (session == null) {
            throw notFound(token);
        }
        session.writeLock().lock();
        try {
            if (session.isClosed()) {
                throw notFound(token);
            }
            close(session);
            log.info("Deleted session {}", token);
        } finally {
            session.writeLock().unlock();
        }
    }

    /**
     * Deletes the session only if it is still idle once its exclusive lock is held. Waits for any
     * running operation on the session to finish first.
     *
     * @return true if the session was deleted
     */
    public boolean deleteIfIdle(String token) {
        ConversionSession session = sessions.get(token);
        if (session == null) {
            return false;
        }
        session.writeLock().lock();
        try {
            if (session.isClosed() || !session.isIdle(clock.instant(), properties.getTtl())) {
                return false;
            }
            close(session);
            metrics.recordSessionExpired();
            log.info("Expired idle session {} (last activity {})", token, session.getLastActivityAt());
            return true;
        } finally {
            session.writeLock().unlock();
        }
    }

    public List<String> sessionIds() {
        return List.copyOf(sessions.keySet());
    }

    public int size() {
        return sessions.size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Releasing {} sessions on shutdown", sessions.size());
        for (ConversionSession session : sessions.values()) {
            session.writeLock().lock();
            try {
                close(session);
            } finally {
                session.writeLock().unlock();
            }
        }
    }

    private <T> T withLock(String token, boolean exclusive, Function<ConversionSession, T> action) {
        ConversionSession session = lockIfLive(token, exclusive);
        if (session == null) {
            throw notFound(token);
        }
        Lock lock = exclusive ? session.writeLock() : session.readLock();
        try {
            session.touch(clock.instant());
            return action.apply(session);
        } finally {
            // Long conversions count as activity until they finish
            session.touch(clock.instant());
            lock.unlock();
        }
    }

    /**
     * Looks the session up and acquires its lock. Returns null, holding no lock, when the session is unknown,
     * closed or idle; an idle session is deleted on the way out.
     */
    private ConversionSession lockIfLive(String token, boolean exclusive) {
        ConversionSession session = token == null ? null : sessions.get(token);
        if (session == null) {
            return null;
        }
        Lock lock = exclusive ? session.writeLock() : session.readLock();
        lock.lock();
        if (session.isClosed()) {
            lock.unlock();
            return null;
        }
        if (session.isIdle(clock.instant(), properties.getTtl())) {
            lock.unlock();
            deleteIfIdle(token);
            return null;
        }
        return session;
    }

    private void close(ConversionSession session) {
        session.close();
        sessions.remove(session.getId(), session);
    }

    private static ResourceNotFoundException notFound(String token) {
        return new ResourceNotFoundException("Session " + token + " not found or expired");
    }
}

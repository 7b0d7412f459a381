package postlogin.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import postlogin.core.model.session.SessionRecord;
import postlogin.core.port.out.SessionRepository;

/**
 * In-memory implementation of SessionRepository.
 *
 * <p>This implementation is intended for development and testing only.
 * Sessions are lost on restart and not shared across instances.
 *
 * <p>Expiry is checked on every read, so an expired record is never returned even if
 * the background reaper has not removed it yet. Conditional writes use
 * {@link ConcurrentMap#compute} so check and write are atomic per key.
 */
public class InMemorySessionRepository implements SessionRepository {

    private static final Logger LOG = Logger.getLogger(InMemorySessionRepository.class);

    private final ConcurrentMap<String, SessionRecord> sessions = new ConcurrentHashMap<>();
    private final ScheduledExecutorService cleanupExecutor;
    private final Clock clock;

    public InMemorySessionRepository() {
        this(Clock.systemUTC());
    }

    public InMemorySessionRepository(Clock clock) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "postlogin-session-cleanup");
            t.setDaemon(true);
            return t;
        });

        // Run cleanup every minute
        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpiredSessions, 1, 1, TimeUnit.MINUTES);
    }

    @Override
    public Uni<Boolean> saveIfAbsent(SessionRecord session) {
        return Uni.createFrom().item(() -> {
            Instant now = clock.instant();
            AtomicBoolean inserted = new AtomicBoolean(false);
            sessions.compute(session.sessionId(), (id, existing) -> {
                if (existing != null && !existing.isExpiredAt(now)) {
                    return existing;
                }
                inserted.set(true);
                return session;
            });
            if (!inserted.get()) {
                LOG.debugf("Session ID collision detected: %s", session.sessionId());
            }
            return inserted.get();
        });
    }

    @Override
    public Uni<SessionRecord> save(SessionRecord session) {
        return Uni.createFrom().item(() -> {
            sessions.put(session.sessionId(), session);
            return session;
        });
    }

    @Override
    public Uni<Boolean> replaceIfRefreshTokenMatches(SessionRecord session, String expectedRefreshTokenId) {
        return Uni.createFrom().item(() -> {
            Instant now = clock.instant();
            AtomicBoolean replaced = new AtomicBoolean(false);
            sessions.computeIfPresent(session.sessionId(), (id, existing) -> {
                if (existing.isExpiredAt(now) || !existing.refreshTokenId().equals(expectedRefreshTokenId)) {
                    return existing;
                }
                replaced.set(true);
                return session;
            });
            return replaced.get();
        });
    }

    @Override
    public Uni<Optional<SessionRecord>> findById(String sessionId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(liveSession(sessionId)));
    }

    @Override
    public Uni<Void> delete(String sessionId) {
        return Uni.createFrom().item(() -> {
            if (sessions.remove(sessionId) != null) {
                LOG.debugf("Session deleted: %s", sessionId);
            }
            return null;
        });
    }

    @Override
    public Uni<Boolean> exists(String sessionId) {
        return Uni.createFrom().item(() -> liveSession(sessionId) != null);
    }

    private SessionRecord liveSession(String sessionId) {
        SessionRecord session = sessions.get(sessionId);
        if (session == null || session.isExpiredAt(clock.instant())) {
            return null;
        }
        return session;
    }

    void cleanupExpiredSessions() {
        Instant now = clock.instant();
        int removed = 0;

        for (var entry : sessions.entrySet()) {
            if (entry.getValue().isExpiredAt(now) && sessions.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }

        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired sessions", removed);
        }
    }

    /**
     * Shuts down the cleanup executor.
     */
    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Return the number of stored records, including expired ones not yet reaped.
     */
    public int getSessionCount() {
        return sessions.size();
    }
}

package postlogin.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import postlogin.core.model.session.SessionRecord;

/**
 * Outbound port for session storage operations.
 *
 * <p>Records are keyed by session ID and live until {@link SessionRecord#expiresAt()}.
 * Expiry is authoritative: from that instant on a record must never be returned,
 * whether or not it has been physically removed yet.
 *
 * <p>Implementations may store sessions in Redis, in-memory, or custom backends via the SPI.
 */
public interface SessionRepository {

    /**
     * Store a new session only if the ID does not already exist.
     *
     * <ul>
     *   <li>Redis: SET with NX and PX</li>
     *   <li>In-Memory: ConcurrentHashMap.compute()</li>
     * </ul>
     *
     * @param session Session to store
     * @return true if saved, false if the ID is already taken by a live session
     */
    Uni<Boolean> saveIfAbsent(SessionRecord session);

    /**
     * Store or replace a session, resetting its TTL to its expiry.
     *
     * @param session Session to store
     * @return The saved session
     */
    Uni<SessionRecord> save(SessionRecord session);

    /**
     * Replace a session only if the stored refresh token id equals the expected one.
     *
     * @param session Replacement session
     * @param expectedRefreshTokenId Refresh token id the stored session must still carry
     * @return true if replaced, false if the session is gone or was renewed concurrently
     */
    Uni<Boolean> replaceIfRefreshTokenMatches(SessionRecord session, String expectedRefreshTokenId);

    /**
     * Retrieve a session by ID.
     *
     * <p>Never-existed and expired sessions are indistinguishable: both are empty.
     *
     * @param sessionId Session identifier
     * @return The session, or empty if not found or expired
     */
    Uni<Optional<SessionRecord>> findById(String sessionId);

    /**
     * Deletes a session. Deleting a missing session is not an error.
     *
     * @param sessionId Session identifier
     * @return Uni completing when deleted
     */
    Uni<Void> delete(String sessionId);

    /**
     * Check if a live session exists.
     *
     * @param sessionId Session identifier
     * @return true if the session exists and has not expired
     */
    Uni<Boolean> exists(String sessionId);
}

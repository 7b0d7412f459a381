package postlogin.core.model.session;

import java.time.Instant;

/**
 * Persisted state of one post-login session.
 *
 * <p>Everything except {@code refreshTokenId}, {@code updatedAt} and {@code expiresAt}
 * is fixed at initiation. Renewal replaces the whole record via {@link #renewed}.
 *
 * @param sessionId Unique session identifier, key in the session store
 * @param handle Derived internal username ({@code <prefix>-<BU>-<cif>})
 * @param cif Customer identification number
 * @param businessUnit Business unit resolved from the channel
 * @param customer Basic customer information from the channel
 * @param channelId Channel the session was initiated from
 * @param externalTokenKey Credential re-verified with the external authority on renewal
 * @param refreshTokenId Identifier embedded in the currently valid refresh token
 * @param correlationId Request id captured at initiation
 * @param createdAt Session creation timestamp
 * @param updatedAt Last renewal timestamp
 * @param expiresAt Expiry; the store treats the record as absent from this instant
 */
public record SessionRecord(
        String sessionId,
        String handle,
        String cif,
        String businessUnit,
        CustomerProfile customer,
        String channelId,
        String externalTokenKey,
        String refreshTokenId,
        String correlationId,
        Instant createdAt,
        Instant updatedAt,
        Instant expiresAt) {

    /**
     * Creates the record that replaces this one after a successful renewal.
     */
    public SessionRecord renewed(String newRefreshTokenId, Instant renewedAt, Instant newExpiresAt) {
        return new SessionRecord(
                sessionId,
                handle,
                cif,
                businessUnit,
                customer,
                channelId,
                externalTokenKey,
                newRefreshTokenId,
                correlationId,
                createdAt,
                renewedAt,
                newExpiresAt);
    }

    /**
     * Creates a copy with fresh identifiers (used when an ID collision forces a retry).
     */
    public SessionRecord withIdentifiers(String sessionId, String refreshTokenId) {
        return new SessionRecord(
                sessionId,
                handle,
                cif,
                businessUnit,
                customer,
                channelId,
                externalTokenKey,
                refreshTokenId,
                correlationId,
                createdAt,
                updatedAt,
                expiresAt);
    }

    /**
     * Checks whether the record has expired at the given instant.
     */
    public boolean isExpiredAt(Instant instant) {
        return expiresAt != null && !instant.isBefore(expiresAt);
    }
}

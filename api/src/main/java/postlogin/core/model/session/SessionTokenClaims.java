package postlogin.core.model.session;

import java.time.Instant;

/**
 * Claims recovered from a verified session token.
 *
 * @param sessionId Session identifier (JWT subject)
 * @param handle Derived internal username
 * @param businessUnit Business unit of the session
 * @param tokenType Access or refresh
 * @param refreshTokenId Refresh token identifier, null for access tokens
 * @param nonce Unique token identifier (JWT ID)
 * @param issuedAt Issue timestamp
 * @param expiresAt Expiry timestamp
 */
public record SessionTokenClaims(
        String sessionId,
        String handle,
        String businessUnit,
        TokenType tokenType,
        String refreshTokenId,
        String nonce,
        Instant issuedAt,
        Instant expiresAt) {}

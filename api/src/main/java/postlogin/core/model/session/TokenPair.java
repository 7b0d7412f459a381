package postlogin.core.model.session;

import java.time.Instant;

/**
 * Access and refresh token minted together for one session.
 */
public record TokenPair(String accessToken, Instant accessExpiresAt, String refreshToken, Instant refreshExpiresAt) {}

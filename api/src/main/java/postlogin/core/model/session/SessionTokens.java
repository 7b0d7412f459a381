package postlogin.core.model.session;

/**
 * Tokens handed back to the caller after initiation or renewal.
 *
 * @param token Signed access token
 * @param refreshToken Signed refresh token
 * @param message Human-readable outcome message
 * @param sessionId Session the tokens belong to
 */
public record SessionTokens(String token, String refreshToken, String message, String sessionId) {}

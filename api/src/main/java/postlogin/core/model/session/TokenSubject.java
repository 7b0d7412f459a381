package postlogin.core.model.session;

/**
 * Session identity carried inside minted tokens.
 *
 * @param sessionId Session the token belongs to
 * @param handle Derived internal username
 * @param businessUnit Business unit of the session
 * @param refreshTokenId Current refresh token identifier (only written to refresh tokens)
 */
public record TokenSubject(String sessionId, String handle, String businessUnit, String refreshTokenId) {

    public static TokenSubject of(SessionRecord record) {
        return new TokenSubject(record.sessionId(), record.handle(), record.businessUnit(), record.refreshTokenId());
    }
}

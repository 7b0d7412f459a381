package postlogin.core.port.in;

import io.smallrye.mutiny.Uni;

import postlogin.core.model.session.SessionInitiation;
import postlogin.core.model.session.SessionRecord;
import postlogin.core.model.session.SessionTokens;

/**
 * Inbound port for post-login session lifecycle operations.
 *
 * <p>Sessions are created for users already authenticated by an external identity
 * system and are kept alive by renewing the refresh token, which re-checks the
 * external session each time.
 *
 * <p>All failures are reported as {@link postlogin.core.model.session.SessionLifecycleException}
 * carrying a stable error code.
 */
public interface SessionLifecycle {

    /**
     * Creates a session and mints its first access and refresh tokens.
     *
     * <p>The external token key is stored for later re-verification but not checked here;
     * the caller is trusted to have authenticated the user upstream.
     *
     * @param initiation Session initiation command
     * @return The minted tokens
     */
    Uni<SessionTokens> initiate(SessionInitiation initiation);

    /**
     * Exchanges a refresh token for a new token pair after re-verifying the external session.
     *
     * @param refreshToken Refresh token of the session
     * @param correlationId Request id for tracing
     * @return The newly minted tokens
     */
    Uni<SessionTokens> renew(String refreshToken, String correlationId);

    /**
     * Ends the session owning the refresh token. Ending an already ended session is a no-op.
     *
     * @param refreshToken Refresh token of the session
     * @param correlationId Request id for tracing
     * @return Uni completing when the session is gone
     */
    Uni<Void> invalidate(String refreshToken, String correlationId);

    /**
     * Resolves the live session behind an access token.
     *
     * @param accessToken Access token
     * @return The stored session
     */
    Uni<SessionRecord> validateAccessToken(String accessToken);
}

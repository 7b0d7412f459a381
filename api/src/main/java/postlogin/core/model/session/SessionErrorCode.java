package postlogin.core.model.session;

/**
 * Stable failure codes of the session lifecycle.
 *
 * <p>Callers decide between retrying and re-authenticating based on these codes:
 * only {@link #VERIFICATION_UNAVAILABLE} is retryable.
 */
public enum SessionErrorCode {
    /** Request shape is invalid (missing CIF, token key, channel id, malformed identity). */
    VALIDATION_ERROR(false),
    /** Channel is unknown or has no business unit mapped. */
    CONFIGURATION_ERROR(false),
    /** Token signature, issuer, type or structure is invalid. */
    INVALID_TOKEN(false),
    /** Token is past its expiry. */
    TOKEN_EXPIRED(false),
    /** Session does not exist or has expired in the store. */
    SESSION_NOT_FOUND(false),
    /** Refresh token was already used or superseded. */
    STALE_TOKEN(false),
    /** External authority reported the external session as expired. */
    EXTERNAL_SESSION_EXPIRED(false),
    /** External authority could not be reached; the session is left untouched. */
    VERIFICATION_UNAVAILABLE(true),
    /** Anything unexpected. */
    INTERNAL_ERROR(false);

    private final boolean retryable;

    SessionErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}

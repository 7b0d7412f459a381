package postlogin.core.model.session;

/**
 * Typed failure of a session lifecycle operation.
 *
 * <p>The {@link SessionErrorCode} is part of the public contract; the message is
 * meant for the caller and must not contain secrets or internal details.
 */
public class SessionLifecycleException extends RuntimeException {

    private final SessionErrorCode code;

    public SessionLifecycleException(SessionErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public SessionLifecycleException(SessionErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public SessionErrorCode getCode() {
        return code;
    }

    public boolean isRetryable() {
        return code.retryable();
    }

    public static SessionLifecycleException validation(String message) {
        return new SessionLifecycleException(SessionErrorCode.VALIDATION_ERROR, message);
    }

    public static SessionLifecycleException configuration(String message) {
        return new SessionLifecycleException(SessionErrorCode.CONFIGURATION_ERROR, message);
    }

    public static SessionLifecycleException sessionNotFound() {
        return new SessionLifecycleException(SessionErrorCode.SESSION_NOT_FOUND, "Session not found");
    }

    public static SessionLifecycleException staleToken() {
        return new SessionLifecycleException(SessionErrorCode.STALE_TOKEN, "Refresh token has already been used");
    }
}

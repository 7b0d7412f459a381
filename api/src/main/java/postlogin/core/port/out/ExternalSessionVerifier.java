package postlogin.core.port.out;

import io.smallrye.mutiny.Uni;

import postlogin.core.model.session.VerificationResult;

/**
 * Outbound port to the external authority that originally authenticated the user.
 *
 * <p>A {@link VerificationResult} is a definitive answer. Not being able to get an
 * answer is reported as a {@link VerifierUnavailableException} failure and must
 * never be read as "expired".
 */
public interface ExternalSessionVerifier {

    /**
     * Asks the external authority whether an external session token is still valid.
     *
     * @param sessionToken External session token (the session's token key)
     * @param userId User the token was issued to
     * @param correlationId Request id propagated to the authority
     * @return The verdict, or a {@link VerifierUnavailableException} failure
     */
    Uni<VerificationResult> verify(String sessionToken, String userId, String correlationId);

    /**
     * Exception thrown when the external authority cannot be reached or gives no usable answer.
     */
    class VerifierUnavailableException extends RuntimeException {
        public VerifierUnavailableException(String message) {
            super(message);
        }

        public VerifierUnavailableException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

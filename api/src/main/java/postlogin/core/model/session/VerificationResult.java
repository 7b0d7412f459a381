package postlogin.core.model.session;

/**
 * Definitive answer from the external authority about an external session token.
 *
 * @param valid true if the external session is still alive
 * @param userId user the authority validated against
 * @param validatedAt validation timestamp as reported by the authority (may be null)
 */
public record VerificationResult(boolean valid, String userId, String validatedAt) {

    public static VerificationResult valid(String userId) {
        return new VerificationResult(true, userId, null);
    }

    public static VerificationResult expired(String userId) {
        return new VerificationResult(false, userId, null);
    }
}

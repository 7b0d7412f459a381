package postlogin.core.service.session;

import java.security.SecureRandom;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Generate cryptographically secure identifiers for sessions and refresh tokens.
 *
 * <p>Identifiers are 32 bytes (256 bits) of random data encoded as
 * URL-safe Base64 without padding.
 */
@ApplicationScoped
public class SessionIdGenerator {

    private static final int ID_BYTES = 32; // 256 bits
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    /**
     * Generate a new session ID.
     *
     * @return A URL-safe Base64 encoded ID (43 characters)
     */
    public String generate() {
        return nextId();
    }

    /**
     * Generate a new refresh token identifier.
     *
     * @return A URL-safe Base64 encoded ID (43 characters)
     */
    public String generateRefreshTokenId() {
        return nextId();
    }

    private String nextId() {
        byte[] bytes = new byte[ID_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }
}

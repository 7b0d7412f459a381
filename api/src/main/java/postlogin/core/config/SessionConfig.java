package postlogin.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for post-login session management.
 *
 * <p>Configuration prefix: {@code postlogin.session}
 *
 * <h2>Example Configuration</h2>
 * <pre>
 * postlogin.session.ttl=PT1H
 * postlogin.session.renewal-mode=compare_and_swap
 * postlogin.session.storage.provider=redis
 * postlogin.session.token.signing-secret=${POSTLOGIN_SIGNING_SECRET}
 * </pre>
 */
@ConfigMapping(prefix = "postlogin.session")
public interface SessionConfig {

    /**
     * Session TTL in the store, reset on every renewal.
     *
     * @return Session duration (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration ttl();

    /**
     * Prefix of derived session handles ({@code <prefix>-<BU>-<cif>}).
     *
     * @return Handle prefix (default: VPB)
     */
    @WithDefault("VPB")
    String handlePrefix();

    /**
     * How concurrent renewals of the same refresh token are resolved.
     *
     * @return Renewal mode (default: best_effort)
     */
    @WithDefault("best_effort")
    RenewalMode renewalMode();

    /**
     * ID generation configuration.
     */
    IdGenerationConfig idGeneration();

    /**
     * Storage configuration.
     */
    StorageConfig storage();

    /**
     * Token signing configuration.
     */
    TokenConfig token();

    /**
     * Strategies for writing a renewed session.
     */
    enum RenewalMode {
        /** Unconditional overwrite; the last concurrent writer wins. */
        best_effort,
        /** Overwrite only if the stored refresh token id still matches; losers get a stale token error. */
        compare_and_swap
    }

    /**
     * Session ID generation configuration.
     */
    interface IdGenerationConfig {

        /**
         * Maximum attempts for session ID collision.
         *
         * @return Max attempts (default: 3)
         */
        @WithDefault("3")
        int maxRetries();
    }

    /**
     * Storage configuration options.
     */
    interface StorageConfig {

        /**
         * Storage provider name.
         *
         * <p>Available providers: redis, memory, or custom SPI name.
         *
         * @return Provider name (default: redis)
         */
        @WithDefault("redis")
        String provider();

        /**
         * Redis-specific configuration.
         */
        RedisConfig redis();

        /**
         * Redis storage configuration.
         */
        interface RedisConfig {

            /**
             * Key prefix for session data in Redis.
             *
             * @return Key prefix (default: postlogin:session:)
             */
            @WithDefault("postlogin:session:")
            String keyPrefix();

            /**
             * Per-operation timeout.
             *
             * @return Timeout (default: 1 second)
             */
            @WithDefault("PT1S")
            Duration timeout();
        }
    }

    /**
     * Access and refresh token configuration.
     */
    interface TokenConfig {

        /**
         * Issuer claim of minted tokens; tokens from other issuers are rejected.
         *
         * @return Issuer (default: postlogin)
         */
        @WithDefault("postlogin")
        String issuer();

        /**
         * HMAC-SHA256 signing secret, at least 32 bytes.
         *
         * @return Signing secret
         */
        String signingSecret();

        /**
         * Access token lifetime.
         *
         * @return Access token duration (default: 15 minutes)
         */
        @WithDefault("PT15M")
        Duration accessTtl();

        /**
         * Refresh token lifetime, must be longer than the access token lifetime.
         *
         * @return Refresh token duration (default: 1 hour)
         */
        @WithDefault("PT1H")
        Duration refreshTtl();
    }
}

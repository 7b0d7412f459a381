package postlogin.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration of the built-in stand-in for the external authority.
 *
 * <p>Configuration prefix: {@code postlogin.mock-verifier}
 */
@ConfigMapping(prefix = "postlogin.mock-verifier")
public interface MockVerifierConfig {

    /**
     * Expose the mock validate-session endpoint. Never enable in production.
     *
     * @return true if enabled (default: false)
     */
    @WithDefault("false")
    boolean enabled();
}

package postlogin.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the external session verifier.
 *
 * <p>Configuration prefix: {@code postlogin.verifier}
 *
 * <h2>Environment Variables</h2>
 * <pre>
 * POSTLOGIN_VERIFIER_URL=https://partner.example.com/corporate/relationship-management/marketing/v1/customer/validate-session
 * POSTLOGIN_VERIFIER_API_KEY=...
 * </pre>
 */
@ConfigMapping(prefix = "postlogin.verifier")
public interface VerifierConfig {

    /**
     * Absolute URL of the validate-session endpoint.
     *
     * @return URL of the external authority
     */
    Optional<String> url();

    /**
     * API key sent in the {@code Apikey} header.
     *
     * @return API key
     */
    Optional<String> apiKey();

    /**
     * Upper bound for one verification call. Exceeding it counts as the authority being unavailable.
     *
     * @return timeout duration (default: 3 seconds)
     */
    @WithDefault("PT3S")
    Duration timeout();
}

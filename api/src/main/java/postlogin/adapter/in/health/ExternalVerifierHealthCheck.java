package postlogin.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import postlogin.core.config.VerifierConfig;

/**
 * Readiness check for the external session verifier configuration.
 *
 * <p>Only the configuration is checked. The authority itself is not called, so its
 * outages surface as retryable renewal failures instead of taking this instance out
 * of rotation.
 */
@Readiness
@ApplicationScoped
public class ExternalVerifierHealthCheck implements HealthCheck {

    private final VerifierConfig config;

    @Inject
    public ExternalVerifierHealthCheck(VerifierConfig config) {
        this.config = config;
    }

    @Override
    public HealthCheckResponse call() {
        final var url = config.url().filter(u -> !u.isBlank());
        if (url.isEmpty()) {
            return HealthCheckResponse.named("external-session-verifier")
                    .down()
                    .withData("reason", "URL not configured")
                    .build();
        }
        return HealthCheckResponse.named("external-session-verifier")
                .up()
                .withData("url", url.get())
                .withData("timeout", config.timeout().toString())
                .build();
    }
}

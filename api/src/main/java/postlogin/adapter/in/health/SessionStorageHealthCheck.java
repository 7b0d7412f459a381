package postlogin.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import postlogin.core.service.session.SessionStorageProviderRegistry;
import postlogin.spi.SessionStorageProvider;

/**
 * Readiness check for the selected session storage provider.
 *
 * <p>Delegates to {@link SessionStorageProvider#healthCheck()}; providers without a
 * health check of their own are reported UP.
 */
@Readiness
@ApplicationScoped
public class SessionStorageHealthCheck implements HealthCheck {

    private final SessionStorageProviderRegistry registry;

    @Inject
    public SessionStorageHealthCheck(SessionStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        SessionStorageProvider provider = registry.getSelectedProvider();
        return provider.healthCheck()
                .orElseGet(() -> HealthCheckResponse.named("session-storage")
                        .up()
                        .withData("provider", provider.name())
                        .build());
    }
}

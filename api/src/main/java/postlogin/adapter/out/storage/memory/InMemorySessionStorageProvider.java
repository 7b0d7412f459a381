package postlogin.adapter.out.storage.memory;

import java.time.Clock;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import postlogin.core.port.out.SessionRepository;
import postlogin.spi.SessionStorageProvider;

/**
 * In-memory session storage provider.
 *
 * <p>This provider is always available and serves as a fallback when
 * Redis or other storage backends are unavailable.
 *
 * <p><strong>Warning:</strong> sessions are local to one instance and lost on restart.
 * Not recommended for production.
 */
@ApplicationScoped
public class InMemorySessionStorageProvider implements SessionStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemorySessionStorageProvider.class);
    private static final int PRIORITY = 0; // Lowest priority - fallback only

    private final Clock clock;
    private InMemorySessionRepository repository;

    @Inject
    public InMemorySessionStorageProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true; // Always available
    }

    @Override
    public synchronized SessionRepository createRepository() {
        if (repository == null) {
            LOG.warn("Session storage is in-memory only: sessions are not shared between instances"
                    + " and are lost on restart. Configure Redis for production.");
            repository = new InMemorySessionRepository(clock);
        }
        return repository;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("session-storage-memory")
                .up()
                .withData("type", "in-memory")
                .withData("sessions", repository != null ? repository.getSessionCount() : 0)
                .build());
    }

    @Override
    public synchronized void shutdown() {
        if (repository != null) {
            repository.shutdown();
        }
    }
}

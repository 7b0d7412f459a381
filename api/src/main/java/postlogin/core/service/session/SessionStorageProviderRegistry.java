package postlogin.core.service.session;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import postlogin.core.config.SessionConfig;
import postlogin.core.port.out.SessionRepository;
import postlogin.spi.SessionStorageProvider;

/**
 * Registry for session storage providers.
 *
 * <p>Discovers providers via CDI and selects one based on configuration and availability.
 * The selected provider's repository is the session store handle for the lifetime of
 * the application; it is created at startup and released on shutdown.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider (postlogin.session.storage.provider), if available</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class SessionStorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(SessionStorageProviderRegistry.class);

    private final Instance<SessionStorageProvider> providers;
    private final SessionConfig config;

    private volatile SessionStorageProvider selectedProvider;
    private volatile SessionRepository repository;

    @Inject
    public SessionStorageProviderRegistry(Instance<SessionStorageProvider> providers, SessionConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Select the provider and open the store during startup, on a worker thread,
     * so the first request on the event loop never probes a backend.
     */
    void onStart(@Observes StartupEvent event) {
        getRepository();
        LOG.infof("Session storage provider initialized: %s", selectedProvider.name());
    }

    void onStop(@Observes ShutdownEvent event) {
        SessionStorageProvider provider = selectedProvider;
        if (provider != null) {
            LOG.infof("Shutting down session storage provider: %s", provider.name());
            provider.shutdown();
        }
    }

    /**
     * Get the session repository from the selected provider.
     *
     * @return Session repository instance
     */
    public SessionRepository getRepository() {
        if (repository == null) {
            synchronized (this) {
                if (repository == null) {
                    repository = getSelectedProvider().createRepository();
                }
            }
        }
        return repository;
    }

    /**
     * Get the selected storage provider.
     *
     * @return Selected provider
     */
    public SessionStorageProvider getSelectedProvider() {
        if (selectedProvider == null) {
            synchronized (this) {
                if (selectedProvider == null) {
                    selectedProvider = selectProvider();
                }
            }
        }
        return selectedProvider;
    }

    private SessionStorageProvider selectProvider() {
        String configuredProvider = config.storage().provider();

        // Probe the configured provider first; other backends are only checked when falling back
        Optional<SessionStorageProvider> configured = providers.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();

        if (configured.isPresent() && configured.get().isAvailable()) {
            LOG.infof("Using configured session storage provider: %s", configuredProvider);
            return configured.get();
        }

        LOG.warnf("Configured session storage provider '%s' is not available, falling back", configuredProvider);

        List<SessionStorageProvider> availableProviders = getAvailableProviders().stream()
                .sorted(Comparator.comparingInt(SessionStorageProvider::priority)
                        .reversed())
                .toList();

        LOG.debugf(
                "Available session storage providers: %s",
                availableProviders.stream().map(SessionStorageProvider::name).toList());

        if (!availableProviders.isEmpty()) {
            SessionStorageProvider provider = availableProviders.get(0);
            LOG.infof("Using session storage provider: %s (priority: %d)", provider.name(), provider.priority());
            return provider;
        }

        // The memory provider is always available, so this means it was removed from the deployment
        throw new IllegalStateException("No session storage providers available");
    }

    /**
     * Get all available providers (for health checks).
     *
     * @return List of available providers
     */
    public List<SessionStorageProvider> getAvailableProviders() {
        return providers.stream().filter(SessionStorageProvider::isAvailable).toList();
    }
}

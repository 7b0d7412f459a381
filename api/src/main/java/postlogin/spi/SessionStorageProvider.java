package postlogin.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import postlogin.core.port.out.SessionRepository;

/**
 * Service Provider Interface for session storage backends.
 *
 * <p>Implement this interface and expose it as a CDI bean to plug in a custom
 * session store. The {@code SessionStorageProviderRegistry} selects one provider
 * at startup and shuts it down when the application stops.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>redis - Redis-backed storage with native TTL (recommended for production)</li>
 *   <li>memory - In-memory storage (development/testing only)</li>
 * </ul>
 */
public interface SessionStorageProvider {

    /**
     * Unique name of this provider, matched against {@code postlogin.session.storage.provider}.
     *
     * @return Provider name (e.g., "redis", "memory")
     */
    String name();

    /**
     * Priority when the configured provider is unavailable (higher is preferred).
     *
     * @return Provider priority
     */
    int priority();

    /**
     * Check if this provider is available and ready to use.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create the session repository implementation.
     *
     * @return Session repository instance
     */
    SessionRepository createRepository();

    /**
     * Health of this storage backend for the readiness endpoint.
     *
     * @return Health check response, or empty if not supported
     */
    Optional<HealthCheckResponse> healthCheck();

    /**
     * Release resources held by the repository. Called once on application shutdown.
     */
    default void shutdown() {}
}

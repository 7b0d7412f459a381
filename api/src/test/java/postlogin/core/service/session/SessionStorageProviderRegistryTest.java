package postlogin.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import jakarta.enterprise.inject.Instance;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import postlogin.adapter.out.storage.memory.InMemorySessionRepository;
import postlogin.core.config.SessionConfig;
import postlogin.core.port.out.SessionRepository;
import postlogin.spi.SessionStorageProvider;

@DisplayName("SessionStorageProviderRegistry")
class SessionStorageProviderRegistryTest {

    @SuppressWarnings("unchecked")
    private SessionStorageProviderRegistry registry(String configured, SessionStorageProvider... providers) {
        Instance<SessionStorageProvider> instance = mock(Instance.class);
        when(instance.stream()).thenAnswer(invocation -> List.of(providers).stream());
        SessionConfig config = mock(SessionConfig.class, RETURNS_DEEP_STUBS);
        when(config.storage().provider()).thenReturn(configured);
        return new SessionStorageProviderRegistry(instance, config);
    }

    @Test
    @DisplayName("should use the configured provider when it is available")
    void shouldUseConfiguredProvider() {
        var memory = new FakeProvider("memory", 0, true);
        var redis = new FakeProvider("redis", 100, true);

        var registry = registry("memory", memory, redis);

        assertSame(memory, registry.getSelectedProvider());
    }

    @Test
    @DisplayName("should fall back to the highest priority available provider")
    void shouldFallBackByPriority() {
        var memory = new FakeProvider("memory", 0, true);
        var disk = new FakeProvider("disk", 50, true);
        var redis = new FakeProvider("redis", 100, false);

        var registry = registry("redis", memory, disk, redis);

        assertSame(disk, registry.getSelectedProvider());
    }

    @Test
    @DisplayName("should fall back when the configured provider is unknown")
    void shouldFallBackForUnknownName() {
        var memory = new FakeProvider("memory", 0, true);

        assertSame(memory, registry("cassandra", memory).getSelectedProvider());
    }

    @Test
    @DisplayName("should fail when no provider is available")
    void shouldFailWithoutProviders() {
        var registry = registry("redis", new FakeProvider("redis", 100, false));

        assertThrows(IllegalStateException.class, registry::getRepository);
    }

    @Test
    @DisplayName("should create the repository once")
    void shouldCreateRepositoryOnce() {
        var memory = new FakeProvider("memory", 0, true);
        var registry = registry("memory", memory);

        var first = registry.getRepository();
        var second = registry.getRepository();

        assertSame(first, second);
        assertEquals(1, memory.created);
    }

    @Test
    @DisplayName("should shut down the selected provider on stop")
    void shouldShutDownSelectedProvider() {
        var memory = new FakeProvider("memory", 0, true);
        var registry = registry("memory", memory);
        registry.onStart(null);

        registry.onStop(null);

        assertTrue(memory.shutDown);
    }

    @Test
    @DisplayName("should list only available providers")
    void shouldListAvailableProviders() {
        var memory = new FakeProvider("memory", 0, true);
        var redis = new FakeProvider("redis", 100, false);

        var available = registry("memory", memory, redis).getAvailableProviders();

        assertEquals(List.of(memory), available);
        assertFalse(available.contains(redis));
    }

    static class FakeProvider implements SessionStorageProvider {
        private final String name;
        private final int priority;
        private final boolean available;
        int created;
        boolean shutDown;

        FakeProvider(String name, int priority, boolean available) {
            this.name = name;
            this.priority = priority;
            this.available = available;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public int priority() {
            return priority;
        }

        @Override
        public boolean isAvailable() {
            return available;
        }

        @Override
        public SessionRepository createRepository() {
            created++;
            return new InMemorySessionRepository();
        }

        @Override
        public Optional<HealthCheckResponse> healthCheck() {
            return Optional.empty();
        }

        @Override
        public void shutdown() {
            shutDown = true;
        }
    }
}

package postlogin.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemorySessionStorageProvider")
class InMemorySessionStorageProviderTest {

    private final InMemorySessionStorageProvider provider = new InMemorySessionStorageProvider(Clock.systemUTC());

    @AfterEach
    void tearDown() {
        provider.shutdown();
    }

    @Test
    @DisplayName("should be the always-available lowest priority provider")
    void shouldDescribeItself() {
        assertEquals("memory", provider.name());
        assertEquals(0, provider.priority());
        assertTrue(provider.isAvailable());
    }

    @Test
    @DisplayName("should hand out a single repository")
    void shouldReuseRepository() {
        assertSame(provider.createRepository(), provider.createRepository());
    }

    @Test
    @DisplayName("should report UP")
    void shouldReportUp() {
        provider.createRepository();

        var health = provider.healthCheck().orElseThrow();

        assertEquals(HealthCheckResponse.Status.UP, health.getStatus());
        assertEquals("session-storage-memory", health.getName());
    }
}

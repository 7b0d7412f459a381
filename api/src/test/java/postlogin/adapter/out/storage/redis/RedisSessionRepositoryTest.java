package postlogin.adapter.out.storage.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import postlogin.adapter.out.storage.redis.RedisTimeoutHelper.RedisTimeoutException;
import postlogin.core.model.session.CustomerProfile;
import postlogin.core.model.session.SessionRecord;
import postlogin.core.port.out.SessionMetrics;
import postlogin.support.MutableClock;

@DisplayName("RedisSessionRepository")
@ExtendWith(MockitoExtension.class)
class RedisSessionRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
    private static final String KEY_PREFIX = "postlogin:session:";
    private static final String KEY = KEY_PREFIX + "s1";

    @Mock
    private ReactiveRedisDataSource redisDataSource;

    @Mock
    private ReactiveValueCommands<String, String> valueCommands;

    @Mock
    private ReactiveKeyCommands<String> keyCommands;

    @Mock
    private SessionMetrics metrics;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private MutableClock clock;
    private RedisSessionRepository repository;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        when(redisDataSource.value(String.class, String.class)).thenReturn(valueCommands);
        when(redisDataSource.key(String.class)).thenReturn(keyCommands);
        repository = new RedisSessionRepository(
                redisDataSource,
                objectMapper,
                KEY_PREFIX,
                new RedisTimeoutHelper(Duration.ofMillis(100), metrics, "session"),
                clock);
    }

    private SessionRecord session(String refreshTokenId, Duration ttl) {
        return new SessionRecord(
                "s1",
                "VPB-SME-12345",
                "12345",
                "SME",
                new CustomerProfile("C-1", "Jane Doe", "SME"),
                "1",
                "token-key",
                refreshTokenId,
                "req-1",
                NOW,
                NOW,
                NOW.plus(ttl));
    }

    private String json(SessionRecord session) throws Exception {
        return objectMapper.writeValueAsString(session);
    }

    @Nested
    @DisplayName("saveIfAbsent")
    class SaveIfAbsent {

        @Test
        @DisplayName("should SET NX with a millisecond TTL and report success")
        void shouldInsertWithTtl() throws Exception {
            var session = session("r1", Duration.ofHours(1));
            when(redisDataSource.execute("SET", KEY, json(session), "NX", "PX", "3600000"))
                    .thenReturn(Uni.createFrom().item(mock(Response.class)));

            assertTrue(repository.saveIfAbsent(session).await().indefinitely());
        }

        @Test
        @DisplayName("should report a collision when Redis replies nil")
        void shouldReportCollision() throws Exception {
            var session = session("r1", Duration.ofHours(1));
            when(redisDataSource.execute("SET", KEY, json(session), "NX", "PX", "3600000"))
                    .thenReturn(Uni.createFrom().nullItem());

            assertFalse(repository.saveIfAbsent(session).await().indefinitely());
        }
    }

    @Nested
    @DisplayName("save")
    class Save {

        @Test
        @DisplayName("should write with PSETEX using the remaining lifetime")
        void shouldWriteWithRemainingLifetime() throws Exception {
            var session = session("r1", Duration.ofMinutes(30));
            clock.advance(Duration.ofMinutes(10));
            when(valueCommands.psetex(KEY, Duration.ofMinutes(20).toMillis(), json(session)))
                    .thenReturn(Uni.createFrom().voidItem());

            assertEquals(session, repository.save(session).await().indefinitely());
        }

        @Test
        @DisplayName("should never send a non-positive TTL")
        void shouldClampTtl() throws Exception {
            var session = session("r1", Duration.ofMinutes(1));
            clock.advance(Duration.ofMinutes(5));
            when(valueCommands.psetex(KEY, 1L, json(session))).thenReturn(Uni.createFrom().voidItem());

            repository.save(session).await().indefinitely();

            verify(valueCommands).psetex(eq(KEY), eq(1L), eq(json(session)));
        }
    }

    @Nested
    @DisplayName("replaceIfRefreshTokenMatches")
    class ReplaceIfRefreshTokenMatches {

        @Test
        @DisplayName("should run the compare-and-set script and report a replacement")
        void shouldReportReplacement() throws Exception {
            var renewed = session("r2", Duration.ofHours(1));
            var reply = mock(Response.class);
            when(reply.toLong()).thenReturn(1L);
            when(redisDataSource.execute(
                            "EVAL",
                            RedisSessionRepository.REPLACE_IF_REFRESH_TOKEN_MATCHES_SCRIPT,
                            "1",
                            KEY,
                            "r1",
                            json(renewed),
                            "3600000"))
                    .thenReturn(Uni.createFrom().item(reply));

            assertTrue(repository.replaceIfRefreshTokenMatches(renewed, "r1").await().indefinitely());
        }

        @Test
        @DisplayName("should report a mismatch when the script returns 0")
        void shouldReportMismatch() throws Exception {
            var renewed = session("r3", Duration.ofHours(1));
            var reply = mock(Response.class);
            when(reply.toLong()).thenReturn(0L);
            when(redisDataSource.execute(
                            "EVAL",
                            RedisSessionRepository.REPLACE_IF_REFRESH_TOKEN_MATCHES_SCRIPT,
                            "1",
                            KEY,
                            "r1",
                            json(renewed),
                            "3600000"))
                    .thenReturn(Uni.createFrom().item(reply));

            assertFalse(repository.replaceIfRefreshTokenMatches(renewed, "r1").await().indefinitely());
        }
    }

    @Nested
    @DisplayName("findById")
    class FindById {

        @Test
        @DisplayName("should deserialize a stored session")
        void shouldDeserialize() throws Exception {
            var session = session("r1", Duration.ofHours(1));
            when(valueCommands.get(KEY)).thenReturn(Uni.createFrom().item(json(session)));

            assertEquals(session, repository.findById("s1").await().indefinitely().orElseThrow());
        }

        @Test
        @DisplayName("should return empty when the key is absent")
        void shouldReturnEmptyWhenAbsent() {
            when(valueCommands.get(KEY)).thenReturn(Uni.createFrom().nullItem());

            assertTrue(repository.findById("s1").await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should return empty for an expired record Redis has not evicted yet")
        void shouldHideExpiredRecord() throws Exception {
            var session = session("r1", Duration.ofMinutes(1));
            when(valueCommands.get(KEY)).thenReturn(Uni.createFrom().item(json(session)));
            clock.advance(Duration.ofMinutes(1));

            assertTrue(repository.findById("s1").await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should fail rather than report absence when Redis times out")
        void shouldFailOnTimeout() {
            when(valueCommands.get(KEY)).thenReturn(Uni.createFrom().nothing());

            assertThrows(
                    RedisTimeoutException.class,
                    () -> repository.findById("s1").await().indefinitely());
            verify(metrics).recordStoreTimeout("session", "findById");
        }

        @Test
        @DisplayName("should fail on corrupt stored JSON")
        void shouldFailOnCorruptJson() {
            when(valueCommands.get(KEY)).thenReturn(Uni.createFrom().item("{not json"));

            assertThrows(
                    RedisSessionRepository.SessionSerializationException.class,
                    () -> repository.findById("s1").await().indefinitely());
        }
    }

    @Nested
    @DisplayName("delete")
    class Delete {

        @Test
        @DisplayName("should delete the key")
        void shouldDeleteKey() {
            when(keyCommands.del(KEY)).thenReturn(Uni.createFrom().item(1));

            repository.delete("s1").await().indefinitely();

            verify(keyCommands).del(KEY);
        }

        @Test
        @DisplayName("should complete when the key is already gone")
        void shouldCompleteWhenMissing() {
            when(keyCommands.del(KEY)).thenReturn(Uni.createFrom().item(0));

            repository.delete("s1").await().indefinitely();

            verify(keyCommands).del(KEY);
        }
    }
}

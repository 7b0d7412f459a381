package postlogin.adapter.out.storage.redis;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import org.jboss.logging.Logger;

import postlogin.core.model.session.SessionRecord;
import postlogin.core.port.out.SessionRepository;

/**
 * Redis implementation of SessionRepository.
 *
 * <p>Sessions are stored as JSON under {@code <keyPrefix><sessionId>} with a millisecond
 * TTL derived from {@link SessionRecord#expiresAt()}. Inserts use {@code SET NX PX}; the
 * conditional renewal write runs as a Lua script so the refresh token id comparison and
 * the overwrite are a single atomic step on the server.
 *
 * <p>Reads re-check {@code expiresAt}, so a record whose key has not been evicted yet is
 * still reported absent once it has expired.
 */
public class RedisSessionRepository implements SessionRepository {

    private static final Logger LOG = Logger.getLogger(RedisSessionRepository.class);

    static final String REPLACE_IF_REFRESH_TOKEN_MATCHES_SCRIPT = """
            local current = redis.call('GET', KEYS[1])
            if not current then
              return 0
            end
            local stored = cjson.decode(current)
            if stored['refreshTokenId'] ~= ARGV[1] then
              return 0
            end
            redis.call('SET', KEYS[1], ARGV[2], 'PX', ARGV[3])
            return 1
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final RedisTimeoutHelper timeoutHelper;
    private final Clock clock;

    public RedisSessionRepository(
            ReactiveRedisDataSource redisDataSource,
            ObjectMapper objectMapper,
            String keyPrefix,
            RedisTimeoutHelper timeoutHelper,
            Clock clock) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
        this.timeoutHelper = timeoutHelper;
        this.clock = clock;
    }

    @Override
    public Uni<Boolean> saveIfAbsent(SessionRecord session) {
        String key = keyPrefix + session.sessionId();
        String value = serialize(session);

        // SET NX replies nil when the key already exists
        var operation = redisDataSource
                .execute("SET", key, value, "NX", "PX", String.valueOf(ttlMillis(session)))
                .map(response -> {
                    if (response != null) {
                        LOG.debugf("Session created in Redis: %s", session.sessionId());
                        return true;
                    }
                    LOG.debugf("Session ID collision in Redis: %s", session.sessionId());
                    return false;
                });
        return timeoutHelper.withTimeout(operation, "saveIfAbsent");
    }

    @Override
    public Uni<SessionRecord> save(SessionRecord session) {
        String key = keyPrefix + session.sessionId();
        String value = serialize(session);

        var operation = valueCommands
                .psetex(key, ttlMillis(session), value)
                .replaceWith(session);
        return timeoutHelper.withTimeout(operation, "save");
    }

    @Override
    public Uni<Boolean> replaceIfRefreshTokenMatches(SessionRecord session, String expectedRefreshTokenId) {
        String key = keyPrefix + session.sessionId();
        String value = serialize(session);

        // EVAL script numkeys key [key...] arg [arg...]
        var operation = redisDataSource
                .execute(
                        "EVAL",
                        REPLACE_IF_REFRESH_TOKEN_MATCHES_SCRIPT,
                        "1", // numkeys
                        key, // KEYS[1]
                        expectedRefreshTokenId, // ARGV[1]
                        value, // ARGV[2]
                        String.valueOf(ttlMillis(session)) // ARGV[3]
                        )
                .map(RedisSessionRepository::isOne);
        return timeoutHelper.withTimeout(operation, "replaceIfRefreshTokenMatches");
    }

    @Override
    public Uni<Optional<SessionRecord>> findById(String sessionId) {
        String key = keyPrefix + sessionId;

        var operation = valueCommands.get(key).map(value -> {
            if (value == null) {
                return Optional.<SessionRecord>empty();
            }
            SessionRecord session = deserialize(value);
            if (session.isExpiredAt(clock.instant())) {
                return Optional.<SessionRecord>empty();
            }
            return Optional.of(session);
        });
        return timeoutHelper.withTimeout(operation, "findById");
    }

    @Override
    public Uni<Void> delete(String sessionId) {
        String key = keyPrefix + sessionId;

        var operation = keyCommands.del(key).invoke(count -> {
            if (count != null && count > 0) {
                LOG.debugf("Session deleted from Redis: %s", sessionId);
            }
        });
        return timeoutHelper.withTimeout(operation, "delete").replaceWithVoid();
    }

    @Override
    public Uni<Boolean> exists(String sessionId) {
        return findById(sessionId).map(Optional::isPresent);
    }

    private long ttlMillis(SessionRecord session) {
        long millis = Duration.between(clock.instant(), session.expiresAt()).toMillis();
        // PX rejects zero and negative values
        return Math.max(1, millis);
    }

    private static boolean isOne(Response response) {
        return response != null && response.toLong() == 1L;
    }

    private String serialize(SessionRecord session) {
        try {
            return objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new SessionSerializationException("Failed to serialize session", e);
        }
    }

    private SessionRecord deserialize(String value) {
        try {
            return objectMapper.readValue(value, SessionRecord.class);
        } catch (JsonProcessingException e) {
            throw new SessionSerializationException("Failed to deserialize session", e);
        }
    }

    /**
     * Exception thrown when a session cannot be converted to or from its stored JSON form.
     */
    public static class SessionSerializationException extends RuntimeException {
        public SessionSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}

package postlogin.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import postlogin.core.model.session.SessionErrorCode;
import postlogin.core.model.session.SessionLifecycleException;
import postlogin.core.model.session.TokenPair;
import postlogin.core.model.session.TokenSubject;
import postlogin.core.model.session.TokenType;
import postlogin.support.MutableClock;

@DisplayName("SessionTokenCodec")
class SessionTokenCodecTest {

    private static final String SECRET = "unit-test-signing-secret-0123456789abcdef";
    private static final Instant START = Instant.parse("2025-03-01T10:00:00Z");
    private static final TokenSubject SUBJECT = new TokenSubject("session-1", "VPB-SME-12345", "SME", "rid-1");

    private MutableClock clock;
    private SessionTokenCodec codec;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        codec = new SessionTokenCodec("postlogin", SECRET, Duration.ofMinutes(15), Duration.ofHours(1), clock);
    }

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("should reject a signing secret shorter than 32 bytes")
        void shouldRejectShortSecret() {
            assertThrows(
                    IllegalStateException.class,
                    () -> new SessionTokenCodec(
                            "postlogin", "too-short", Duration.ofMinutes(15), Duration.ofHours(1), clock));
        }

        @Test
        @DisplayName("should reject a missing signing secret")
        void shouldRejectMissingSecret() {
            assertThrows(
                    IllegalStateException.class,
                    () -> new SessionTokenCodec("postlogin", null, Duration.ofMinutes(15), Duration.ofHours(1), clock));
        }

        @Test
        @DisplayName("should reject a refresh TTL not longer than the access TTL")
        void shouldRejectRefreshTtlNotLongerThanAccessTtl() {
            assertThrows(
                    IllegalStateException.class,
                    () -> new SessionTokenCodec(
                            "postlogin", SECRET, Duration.ofMinutes(15), Duration.ofMinutes(15), clock));
        }
    }

    @Nested
    @DisplayName("mintPair")
    class MintPair {

        @Test
        @DisplayName("should mint tokens whose claims parse back to the subject")
        void shouldMintParseableTokens() {
            TokenPair pair = codec.mintPair(SUBJECT);

            var access = codec.parse(pair.accessToken(), TokenType.ACCESS);
            assertEquals("session-1", access.sessionId());
            assertEquals("VPB-SME-12345", access.handle());
            assertEquals("SME", access.businessUnit());
            assertEquals(TokenType.ACCESS, access.tokenType());
            assertNull(access.refreshTokenId());

            var refresh = codec.parse(pair.refreshToken(), TokenType.REFRESH);
            assertEquals("session-1", refresh.sessionId());
            assertEquals("rid-1", refresh.refreshTokenId());
            assertEquals(TokenType.REFRESH, refresh.tokenType());
        }

        @Test
        @DisplayName("should use the configured lifetimes")
        void shouldUseConfiguredLifetimes() {
            TokenPair pair = codec.mintPair(SUBJECT);

            assertEquals(START.plus(Duration.ofMinutes(15)), pair.accessExpiresAt());
            assertEquals(START.plus(Duration.ofHours(1)), pair.refreshExpiresAt());
            assertEquals(START, codec.parse(pair.accessToken(), TokenType.ACCESS).issuedAt());
        }

        @Test
        @DisplayName("should give every token a distinct nonce")
        void shouldUseDistinctNonces() {
            var first = codec.parse(codec.mint(SUBJECT, TokenType.ACCESS), TokenType.ACCESS);
            var second = codec.parse(codec.mint(SUBJECT, TokenType.ACCESS), TokenType.ACCESS);

            assertNotEquals(first.nonce(), second.nonce());
        }
    }

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        @DisplayName("should reject an access token presented as a refresh token")
        void shouldRejectWrongType() {
            String access = codec.mint(SUBJECT, TokenType.ACCESS);

            var e = assertThrows(SessionLifecycleException.class, () -> codec.parse(access, TokenType.REFRESH));
            assertEquals(SessionErrorCode.INVALID_TOKEN, e.getCode());
        }

        @Test
        @DisplayName("should reject a token signed with another secret")
        void shouldRejectForeignSignature() {
            var other = new SessionTokenCodec(
                    "postlogin",
                    "another-signing-secret-0123456789abcdef",
                    Duration.ofMinutes(15),
                    Duration.ofHours(1),
                    clock);
            String token = other.mint(SUBJECT, TokenType.ACCESS);

            var e = assertThrows(SessionLifecycleException.class, () -> codec.parse(token, TokenType.ACCESS));
            assertEquals(SessionErrorCode.INVALID_TOKEN, e.getCode());
        }

        @Test
        @DisplayName("should reject a token from another issuer")
        void shouldRejectForeignIssuer() {
            var other = new SessionTokenCodec(
                    "someone-else", SECRET, Duration.ofMinutes(15), Duration.ofHours(1), clock);
            String token = other.mint(SUBJECT, TokenType.ACCESS);

            var e = assertThrows(SessionLifecycleException.class, () -> codec.parse(token, TokenType.ACCESS));
            assertEquals(SessionErrorCode.INVALID_TOKEN, e.getCode());
        }

        @Test
        @DisplayName("should reject a tampered token")
        void shouldRejectTamperedToken() {
            String token = codec.mint(SUBJECT, TokenType.ACCESS);
            String[] parts = token.split("\\.");
            String tampered = parts[0] + "." + parts[1] + "x." + parts[2];

            var e = assertThrows(SessionLifecycleException.class, () -> codec.parse(tampered, TokenType.ACCESS));
            assertEquals(SessionErrorCode.INVALID_TOKEN, e.getCode());
        }

        @Test
        @DisplayName("should reject garbage and blank input")
        void shouldRejectGarbage() {
            assertEquals(
                    SessionErrorCode.INVALID_TOKEN,
                    assertThrows(SessionLifecycleException.class, () -> codec.parse("not-a-token", TokenType.ACCESS))
                            .getCode());
            assertEquals(
                    SessionErrorCode.INVALID_TOKEN,
                    assertThrows(SessionLifecycleException.class, () -> codec.parse(" ", TokenType.ACCESS))
                            .getCode());
        }

        @Test
        @DisplayName("should report expiry once the lifetime has passed")
        void shouldReportExpiry() {
            String token = codec.mint(SUBJECT, TokenType.ACCESS);
            clock.advance(Duration.ofMinutes(16));

            var e = assertThrows(SessionLifecycleException.class, () -> codec.parse(token, TokenType.ACCESS));
            assertEquals(SessionErrorCode.TOKEN_EXPIRED, e.getCode());
        }

        @Test
        @DisplayName("should accept a token at exactly its expiry instant")
        void shouldAcceptAtExpiryInstant() {
            String token = codec.mint(SUBJECT, TokenType.REFRESH);
            clock.advance(Duration.ofHours(1));

            assertEquals("rid-1", codec.parse(token, TokenType.REFRESH).refreshTokenId());
        }

        @Test
        @DisplayName("should report expiry one second after the expiry instant")
        void shouldReportExpiryOneSecondLater() {
            String token = codec.mint(SUBJECT, TokenType.ACCESS);
            clock.advance(Duration.ofMinutes(15).plusSeconds(1));

            var e = assertThrows(SessionLifecycleException.class, () -> codec.parse(token, TokenType.ACCESS));
            assertEquals(SessionErrorCode.TOKEN_EXPIRED, e.getCode());
        }

        @Test
        @DisplayName("should still accept a token just before expiry")
        void shouldAcceptBeforeExpiry() {
            String token = codec.mint(SUBJECT, TokenType.REFRESH);
            clock.advance(Duration.ofMinutes(59));

            assertEquals("rid-1", codec.parse(token, TokenType.REFRESH).refreshTokenId());
        }
    }
}

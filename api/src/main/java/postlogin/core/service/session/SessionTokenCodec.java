package postlogin.core.service.session;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.runtime.Startup;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;

import postlogin.core.config.SessionConfig;
import postlogin.core.model.session.SessionErrorCode;
import postlogin.core.model.session.SessionLifecycleException;
import postlogin.core.model.session.SessionTokenClaims;
import postlogin.core.model.session.TokenPair;
import postlogin.core.model.session.TokenSubject;
import postlogin.core.model.session.TokenType;

/**
 * Mints and verifies the access and refresh tokens of post-login sessions.
 *
 * <p>Tokens are compact HS256 JWS tokens. Standard claims carry the issuer, the session id
 * ({@code sub}), a nonce ({@code jti}) and the validity window; custom claims carry the
 * token type, handle, business unit and, for refresh tokens only, the refresh token id.
 *
 * <p>The codec holds no mutable state. Time is read from the injected {@link Clock}.
 */
@Startup
@ApplicationScoped
public class SessionTokenCodec {

    private static final Logger LOG = Logger.getLogger(SessionTokenCodec.class);

    static final String CLAIM_TOKEN_TYPE = "token_type";
    static final String CLAIM_HANDLE = "handle";
    static final String CLAIM_BUSINESS_UNIT = "bu";
    static final String CLAIM_REFRESH_TOKEN_ID = "rid";

    private static final int MIN_SECRET_BYTES = 32;

    private final String issuer;
    private final HmacKey key;
    private final Duration accessTtl;
    private final Duration refreshTtl;
    private final Clock clock;

    @Inject
    public SessionTokenCodec(SessionConfig config, Clock clock) {
        this(
                config.token().issuer(),
                config.token().signingSecret(),
                config.token().accessTtl(),
                config.token().refreshTtl(),
                clock);
    }

    SessionTokenCodec(String issuer, String signingSecret, Duration accessTtl, Duration refreshTtl, Clock clock) {
        if (signingSecret == null || signingSecret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("Session token signing secret must be at least " + MIN_SECRET_BYTES
                    + " bytes (postlogin.session.token.signing-secret)");
        }
        if (refreshTtl.compareTo(accessTtl) <= 0) {
            throw new IllegalStateException("Refresh token TTL (" + refreshTtl
                    + ") must be longer than access token TTL (" + accessTtl + ")");
        }
        this.issuer = issuer;
        this.key = new HmacKey(signingSecret.getBytes(StandardCharsets.UTF_8));
        this.accessTtl = accessTtl;
        this.refreshTtl = refreshTtl;
        this.clock = clock;
        LOG.debugf("Session token codec initialized [issuer=%s, accessTtl=%s, refreshTtl=%s]",
                issuer, accessTtl, refreshTtl);
    }

    /**
     * Mint a matching access and refresh token for a session.
     *
     * @param subject Session identity to embed
     * @return The token pair
     */
    public TokenPair mintPair(TokenSubject subject) {
        Instant now = now();
        Instant accessExpiresAt = now.plus(accessTtl);
        Instant refreshExpiresAt = now.plus(refreshTtl);
        return new TokenPair(
                sign(subject, TokenType.ACCESS, now, accessExpiresAt),
                accessExpiresAt,
                sign(subject, TokenType.REFRESH, now, refreshExpiresAt),
                refreshExpiresAt);
    }

    /**
     * Mint a single token.
     *
     * @param subject Session identity to embed
     * @param type Token type
     * @return Compact serialized token
     */
    public String mint(TokenSubject subject, TokenType type) {
        Instant now = now();
        Duration ttl = type == TokenType.ACCESS ? accessTtl : refreshTtl;
        return sign(subject, type, now, now.plus(ttl));
    }

    /**
     * Verify a token and recover its claims.
     *
     * @param token Compact serialized token
     * @param expectedType Token type the caller requires
     * @return The verified claims
     * @throws SessionLifecycleException with {@link SessionErrorCode#TOKEN_EXPIRED} if the token has expired,
     *     or {@link SessionErrorCode#INVALID_TOKEN} for any other verification failure
     */
    public SessionTokenClaims parse(String token, TokenType expectedType) {
        if (token == null || token.isBlank()) {
            throw invalid("Token is required");
        }

        JwtClaims claims;
        try {
            claims = consumer().processToClaims(token);
        } catch (InvalidJwtException e) {
            LOG.debugv("Session token rejected: {0}", e.getMessage());
            if (e.hasExpired()) {
                throw new SessionLifecycleException(SessionErrorCode.TOKEN_EXPIRED, "Token has expired");
            }
            throw invalid(summarizeJwtError(e));
        }

        try {
            TokenType type = TokenType.fromClaimValue(claims.getStringClaimValue(CLAIM_TOKEN_TYPE));
            if (type != expectedType) {
                throw invalid("Invalid token type");
            }

            String handle = requireClaim(claims, CLAIM_HANDLE);
            String businessUnit = requireClaim(claims, CLAIM_BUSINESS_UNIT);
            String refreshTokenId = null;
            if (type == TokenType.REFRESH) {
                refreshTokenId = requireClaim(claims, CLAIM_REFRESH_TOKEN_ID);
            }

            return new SessionTokenClaims(
                    claims.getSubject(),
                    handle,
                    businessUnit,
                    type,
                    refreshTokenId,
                    claims.getJwtId(),
                    Instant.ofEpochSecond(claims.getIssuedAt().getValue()),
                    Instant.ofEpochSecond(claims.getExpirationTime().getValue()));
        } catch (MalformedClaimException | IllegalArgumentException e) {
            LOG.debugv("Session token has malformed claims: {0}", e.getMessage());
            throw invalid("Malformed token claims");
        }
    }

    private String sign(TokenSubject subject, TokenType type, Instant issuedAt, Instant expiresAt) {
        JwtClaims claims = new JwtClaims();
        claims.setIssuer(issuer);
        claims.setSubject(subject.sessionId());
        claims.setIssuedAt(NumericDate.fromSeconds(issuedAt.getEpochSecond()));
        claims.setExpirationTime(NumericDate.fromSeconds(expiresAt.getEpochSecond()));
        claims.setJwtId(UUID.randomUUID().toString());
        claims.setClaim(CLAIM_TOKEN_TYPE, type.claimValue());
        claims.setClaim(CLAIM_HANDLE, subject.handle());
        claims.setClaim(CLAIM_BUSINESS_UNIT, subject.businessUnit());
        if (type == TokenType.REFRESH) {
            claims.setClaim(CLAIM_REFRESH_TOKEN_ID, subject.refreshTokenId());
        }

        JsonWebSignature jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(key);
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);
        try {
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new SessionLifecycleException(SessionErrorCode.INTERNAL_ERROR, "Failed to sign session token", e);
        }
    }

    private JwtConsumer consumer() {
        return new JwtConsumerBuilder()
                .setRequireSubject()
                .setRequireExpirationTime()
                .setRequireIssuedAt()
                .setRequireJwtId()
                .setExpectedIssuer(issuer)
                .setSkipDefaultAudienceValidation()
                .setEvaluationTime(NumericDate.fromSeconds(now().getEpochSecond()))
                // Evaluation time is whole seconds; one second of skew keeps a token valid at exactly exp
                .setAllowedClockSkewInSeconds(1)
                .setVerificationKey(key)
                .setJwsAlgorithmConstraints(
                        AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA256)
                .build();
    }

    private Instant now() {
        return Instant.ofEpochSecond(clock.instant().getEpochSecond());
    }

    private static String requireClaim(JwtClaims claims, String name) throws MalformedClaimException {
        String value = claims.getStringClaimValue(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing claim: " + name);
        }
        return value;
    }

    private static SessionLifecycleException invalid(String message) {
        return new SessionLifecycleException(SessionErrorCode.INVALID_TOKEN, message);
    }

    private static String summarizeJwtError(InvalidJwtException e) {
        String message = e.getMessage();
        if (message != null && message.contains("issuer")) {
            return "Invalid token issuer";
        }
        if (message != null && message.contains("signature")) {
            return "Invalid token signature";
        }
        return "Invalid token";
    }
}

package postlogin.core.service.session;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import postlogin.core.config.SessionConfig;
import postlogin.core.config.VerifierConfig;
import postlogin.core.model.session.ChannelSetting;
import postlogin.core.model.session.SessionErrorCode;
import postlogin.core.model.session.SessionInitiation;
import postlogin.core.model.session.SessionLifecycleException;
import postlogin.core.model.session.SessionRecord;
import postlogin.core.model.session.SessionTokenClaims;
import postlogin.core.model.session.SessionTokens;
import postlogin.core.model.session.TokenPair;
import postlogin.core.model.session.TokenSubject;
import postlogin.core.model.session.TokenType;
import postlogin.core.model.session.VerificationResult;
import postlogin.core.port.in.SessionLifecycle;
import postlogin.core.port.out.ChannelSettingRepository;
import postlogin.core.port.out.ExternalSessionVerifier;
import postlogin.core.port.out.ExternalSessionVerifier.VerifierUnavailableException;
import postlogin.core.port.out.SessionMetrics;
import postlogin.core.port.out.SessionRepository;

/**
 * Implementation of the post-login session lifecycle.
 *
 * <p>Handles session initiation with ID collision retry, refresh token renewal with
 * external re-verification, logout and access token resolution. The service holds no
 * state of its own; the session store is the only shared state.
 *
 * <p>Renewal writes follow {@link SessionConfig#renewalMode()}: {@code best_effort}
 * overwrites unconditionally, {@code compare_and_swap} rejects all but the first of
 * several concurrent renewals of the same refresh token.
 */
@ApplicationScoped
public class SessionLifecycleService implements SessionLifecycle {

    private static final Logger LOG = Logger.getLogger(SessionLifecycleService.class);

    private static final String SUCCESS = "success";

    private final SessionStorageProviderRegistry storageRegistry;
    private final SessionIdGenerator idGenerator;
    private final SessionIdentityBuilder identityBuilder;
    private final SessionTokenCodec tokenCodec;
    private final ExternalSessionVerifier verifier;
    private final ChannelSettingRepository channelSettings;
    private final SessionMetrics metrics;
    private final SessionConfig config;
    private final VerifierConfig verifierConfig;
    private final Clock clock;

    @Inject
    public SessionLifecycleService(
            SessionStorageProviderRegistry storageRegistry,
            SessionIdGenerator idGenerator,
            SessionIdentityBuilder identityBuilder,
            SessionTokenCodec tokenCodec,
            ExternalSessionVerifier verifier,
            ChannelSettingRepository channelSettings,
            SessionMetrics metrics,
            SessionConfig config,
            VerifierConfig verifierConfig,
            Clock clock) {
        this.storageRegistry = storageRegistry;
        this.idGenerator = idGenerator;
        this.identityBuilder = identityBuilder;
        this.tokenCodec = tokenCodec;
        this.verifier = verifier;
        this.channelSettings = channelSettings;
        this.metrics = metrics;
        this.config = config;
        this.verifierConfig = verifierConfig;
        this.clock = clock;
    }

    @Override
    public Uni<SessionTokens> initiate(SessionInitiation initiation) {
        String correlationId = initiation == null ? null : initiation.correlationId();
        try {
            validate(initiation);
        } catch (SessionLifecycleException e) {
            metrics.recordInitiation(null, outcome(e));
            return Uni.createFrom().failure(e);
        }

        String channelId = initiation.channelId().trim();
        return channelSettings
                .findById(channelId)
                .map(channel -> resolveBusinessUnit(channelId, channel))
                .flatMap(businessUnit -> {
                    String handle = buildHandle(businessUnit, initiation.cif());
                    Instant now = clock.instant();
                    SessionRecord draft = new SessionRecord(
                            null,
                            handle,
                            initiation.cif().trim(),
                            businessUnit,
                            initiation.customer(),
                            channelId,
                            initiation.tokenKey().trim(),
                            null,
                            correlationId,
                            now,
                            now,
                            now.plus(config.ttl()));
                    return createSessionWithRetry(draft, 0);
                })
                .onFailure()
                .transform(e -> toLifecycleFailure(e, correlationId))
                .onFailure(SessionLifecycleException.class)
                .invoke(e -> metrics.recordInitiation(null, outcome(e)));
    }

    private Uni<SessionTokens> createSessionWithRetry(SessionRecord draft, int attempt) {
        int maxRetries = config.idGeneration().maxRetries();

        if (attempt >= maxRetries) {
            return Uni.createFrom()
                    .failure(new SessionLifecycleException(
                            SessionErrorCode.INTERNAL_ERROR,
                            "Failed to generate unique session ID after " + maxRetries + " attempts"));
        }

        SessionRecord session = draft.withIdentifiers(idGenerator.generate(), idGenerator.generateRefreshTokenId());

        return getRepository().saveIfAbsent(session).flatMap(saved -> {
            if (saved) {
                LOG.infof("Session initiated [bu=%s, channel=%s, correlationId=%s]",
                        session.businessUnit(), session.channelId(), session.correlationId());
                LOG.debugf("Session created: %s for %s", session.sessionId(), session.handle());
                metrics.recordInitiation(session.businessUnit(), SUCCESS);
                TokenPair tokens = tokenCodec.mintPair(TokenSubject.of(session));
                return Uni.createFrom()
                        .item(new SessionTokens(
                                tokens.accessToken(),
                                tokens.refreshToken(),
                                session.businessUnit() + " session initialized successfully",
                                session.sessionId()));
            }

            // Collision detected, retry with new ID
            LOG.warnf("Session ID collision detected (attempt %d/%d), retrying", attempt + 1, maxRetries);
            return createSessionWithRetry(draft, attempt + 1);
        });
    }

    @Override
    public Uni<SessionTokens> renew(String refreshToken, String correlationId) {
        SessionTokenClaims claims;
        try {
            claims = tokenCodec.parse(refreshToken, TokenType.REFRESH);
        } catch (SessionLifecycleException e) {
            metrics.recordRenewal(outcome(e));
            return Uni.createFrom().failure(e);
        }

        return getRepository()
                .findById(claims.sessionId())
                .map(found -> requireCurrent(found, claims))
                .flatMap(session -> {
                    String traceId = correlationId != null ? correlationId : session.correlationId();
                    return verify(session, traceId).flatMap(result -> {
                        if (!result.valid()) {
                            LOG.infof("External session expired, ending session [correlationId=%s]", traceId);
                            return getRepository()
                                    .delete(session.sessionId())
                                    .flatMap(v -> Uni.createFrom()
                                            .failure(new SessionLifecycleException(
                                                    SessionErrorCode.EXTERNAL_SESSION_EXPIRED,
                                                    "External session has expired")));
                        }
                        return writeRenewal(session);
                    });
                })
                .onFailure()
                .transform(e -> toLifecycleFailure(e, correlationId))
                .invoke(tokens -> metrics.recordRenewal(SUCCESS))
                .onFailure(SessionLifecycleException.class)
                .invoke(e -> metrics.recordRenewal(outcome(e)));
    }

    private Uni<VerificationResult> verify(SessionRecord session, String correlationId) {
        long start = System.nanoTime();
        return verifier.verify(session.externalTokenKey(), session.cif(), correlationId)
                .ifNoItem()
                .after(verifierConfig.timeout())
                .failWith(() -> new VerifierUnavailableException(
                        "External session verification timed out after " + verifierConfig.timeout()))
                .onFailure()
                .transform(e -> e instanceof VerifierUnavailableException
                        ? e
                        : new VerifierUnavailableException("External session verification failed", e))
                .invoke(result -> metrics.recordVerification(result.valid() ? "valid" : "expired", elapsedMs(start)))
                .onFailure()
                .invoke(e -> {
                    LOG.warnv("External session verification unavailable [correlationId={0}]: {1}",
                            correlationId, e.getMessage());
                    metrics.recordVerification("unavailable", elapsedMs(start));
                });
    }

    private Uni<SessionTokens> writeRenewal(SessionRecord session) {
        Instant now = clock.instant();
        SessionRecord renewed =
                session.renewed(idGenerator.generateRefreshTokenId(), now, now.plus(config.ttl()));

        Uni<Boolean> write;
        if (config.renewalMode() == SessionConfig.RenewalMode.compare_and_swap) {
            write = getRepository().replaceIfRefreshTokenMatches(renewed, session.refreshTokenId());
        } else {
            write = getRepository().save(renewed).map(saved -> true);
        }

        return write.map(written -> {
            if (!written) {
                LOG.debugf("Concurrent renewal lost for session %s", session.sessionId());
                throw SessionLifecycleException.staleToken();
            }
            LOG.debugf("Session renewed: %s", session.sessionId());
            TokenPair tokens = tokenCodec.mintPair(TokenSubject.of(renewed));
            return new SessionTokens(
                    tokens.accessToken(),
                    tokens.refreshToken(),
                    renewed.businessUnit() + " token renewed successfully",
                    renewed.sessionId());
        });
    }

    @Override
    public Uni<Void> invalidate(String refreshToken, String correlationId) {
        SessionTokenClaims claims;
        try {
            claims = tokenCodec.parse(refreshToken, TokenType.REFRESH);
        } catch (SessionLifecycleException e) {
            return Uni.createFrom().failure(e);
        }

        return getRepository()
                .findById(claims.sessionId())
                .flatMap(found -> {
                    if (found.isEmpty()) {
                        LOG.debugf("Session %s already ended", claims.sessionId());
                        return Uni.createFrom().voidItem();
                    }
                    SessionRecord session = requireCurrent(found, claims);
                    LOG.infof("Invalidating session [correlationId=%s]", correlationId);
                    return getRepository().delete(session.sessionId());
                })
                .onFailure()
                .transform(e -> toLifecycleFailure(e, correlationId));
    }

    @Override
    public Uni<SessionRecord> validateAccessToken(String accessToken) {
        SessionTokenClaims claims;
        try {
            claims = tokenCodec.parse(accessToken, TokenType.ACCESS);
        } catch (SessionLifecycleException e) {
            return Uni.createFrom().failure(e);
        }

        return getRepository()
                .findById(claims.sessionId())
                .map(found -> found.orElseThrow(SessionLifecycleException::sessionNotFound))
                .onFailure()
                .transform(e -> toLifecycleFailure(e, null));
    }

    private void validate(SessionInitiation initiation) {
        if (initiation == null) {
            throw SessionLifecycleException.validation("Request data is required");
        }
        if (isBlank(initiation.cif())) {
            throw SessionLifecycleException.validation("cif is required");
        }
        if (isBlank(initiation.tokenKey())) {
            throw SessionLifecycleException.validation("tokenKey is required");
        }
        if (isBlank(initiation.channelId())) {
            throw SessionLifecycleException.validation("channelId is required");
        }
        if (initiation.customer() == null) {
            throw SessionLifecycleException.validation("basicCustomerInfo is required");
        }
    }

    private String resolveBusinessUnit(String channelId, Optional<ChannelSetting> channel) {
        if (channel.isEmpty()) {
            throw SessionLifecycleException.configuration("Unknown channel: " + channelId);
        }
        return channel.get()
                .businessUnit()
                .map(bu -> bu.trim().toUpperCase(Locale.ROOT))
                .orElseThrow(() ->
                        SessionLifecycleException.configuration("No business unit configured for channel: " + channelId));
    }

    private String buildHandle(String businessUnit, String cif) {
        try {
            return identityBuilder.buildHandle(businessUnit, cif);
        } catch (SessionIdentityBuilder.InvalidIdentityException e) {
            throw SessionLifecycleException.validation(e.getMessage());
        }
    }

    private static SessionRecord requireCurrent(Optional<SessionRecord> found, SessionTokenClaims claims) {
        SessionRecord session = found.orElseThrow(SessionLifecycleException::sessionNotFound);
        if (!session.refreshTokenId().equals(claims.refreshTokenId())) {
            throw SessionLifecycleException.staleToken();
        }
        return session;
    }

    private Throwable toLifecycleFailure(Throwable failure, String correlationId) {
        if (failure instanceof SessionLifecycleException) {
            return failure;
        }
        if (failure instanceof VerifierUnavailableException) {
            return new SessionLifecycleException(
                    SessionErrorCode.VERIFICATION_UNAVAILABLE,
                    "External session verification is temporarily unavailable",
                    failure);
        }
        LOG.errorf(failure, "Unexpected session lifecycle failure [correlationId=%s]", correlationId);
        return new SessionLifecycleException(SessionErrorCode.INTERNAL_ERROR, "Internal error", failure);
    }

    private static String outcome(Throwable failure) {
        if (failure instanceof SessionLifecycleException e) {
            return e.getCode().name().toLowerCase(Locale.ROOT);
        }
        return SessionErrorCode.INTERNAL_ERROR.name().toLowerCase(Locale.ROOT);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private SessionRepository getRepository() {
        return storageRegistry.getRepository();
    }
}

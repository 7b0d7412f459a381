package postlogin.adapter.in.http;

import java.util.Map;
import java.util.UUID;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import postlogin.adapter.in.dto.InitSessionRequest;
import postlogin.adapter.in.dto.RefreshTokenRequest;
import postlogin.adapter.in.dto.SessionInfoResponse;
import postlogin.adapter.in.dto.TokenResponse;
import postlogin.adapter.in.problem.SessionProblem;
import postlogin.core.model.session.CustomerProfile;
import postlogin.core.model.session.SessionInitiation;
import postlogin.core.model.session.SessionTokens;
import postlogin.core.port.in.SessionLifecycle;

/**
 * REST endpoints for the post-login session lifecycle.
 *
 * <p>Every response echoes the {@code x-request-id} header; when the caller sends none,
 * a random one is generated and used as the correlation id.
 */
@Path("/postlogin")
@Produces(MediaType.APPLICATION_JSON)
public class PostloginResource {

    private static final Logger LOG = Logger.getLogger(PostloginResource.class);

    static final String REQUEST_ID_HEADER = "x-request-id";
    private static final String BEARER_PREFIX = "Bearer ";

    @Inject
    SessionLifecycle sessionLifecycle;

    /**
     * Create a session for a user authenticated by the external authority.
     */
    @POST
    @Path("/init-session")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> initSession(InitSessionRequest body, @HeaderParam(REQUEST_ID_HEADER) String requestId) {
        String correlationId = correlationId(requestId);
        LOG.debugf("Initializing post-login session [correlationId=%s]", correlationId);

        if (body == null || body.data() == null) {
            throw SessionProblem.validationError("Request data is required");
        }

        var data = body.data();
        var info = data.basicCustomerInfo();
        CustomerProfile customer =
                info == null ? null : new CustomerProfile(info.customerId(), info.customerName(), info.customerType());
        String channelId = data.payload() == null ? null : data.payload().channelId();

        var initiation = new SessionInitiation(data.cif(), customer, data.tokenKey(), channelId, correlationId);
        return sessionLifecycle.initiate(initiation).map(tokens -> tokenResponse(tokens, correlationId));
    }

    /**
     * Exchange a refresh token for a new token pair.
     */
    @POST
    @Path("/renew-token")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> renewToken(RefreshTokenRequest body, @HeaderParam(REQUEST_ID_HEADER) String requestId) {
        String correlationId = correlationId(requestId);
        return sessionLifecycle
                .renew(refreshToken(body), correlationId)
                .map(tokens -> tokenResponse(tokens, correlationId));
    }

    /**
     * End the session owning the refresh token.
     */
    @POST
    @Path("/logout")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> logout(RefreshTokenRequest body, @HeaderParam(REQUEST_ID_HEADER) String requestId) {
        String correlationId = correlationId(requestId);
        return sessionLifecycle
                .invalidate(refreshToken(body), correlationId)
                .map(v -> Response.noContent()
                        .header(REQUEST_ID_HEADER, correlationId)
                        .build());
    }

    /**
     * Describe the session behind the bearer access token.
     */
    @GET
    @Path("/session")
    public Uni<SessionInfoResponse> getSession(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            throw SessionProblem.invalidToken("Bearer access token is required");
        }

        String accessToken = authorization.substring(BEARER_PREFIX.length()).trim();
        return sessionLifecycle
                .validateAccessToken(accessToken)
                .map(session -> new SessionInfoResponse(
                        session.sessionId(),
                        session.handle(),
                        session.businessUnit(),
                        session.cif(),
                        session.expiresAt().toString()));
    }

    /**
     * Liveness of the service itself, independent of its dependencies.
     */
    @GET
    @Path("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy", "service", "postlogin");
    }

    private static String refreshToken(RefreshTokenRequest body) {
        if (body == null || body.data() == null) {
            throw SessionProblem.validationError("Request data is required");
        }
        String refreshToken = body.data().refreshToken();
        if (refreshToken == null || refreshToken.isBlank()) {
            throw SessionProblem.validationError("refreshToken is required");
        }
        return refreshToken;
    }

    private static Response tokenResponse(SessionTokens tokens, String correlationId) {
        return Response.ok(new TokenResponse(tokens.token(), tokens.refreshToken(), tokens.message()))
                .header(REQUEST_ID_HEADER, correlationId)
                .build();
    }

    private static String correlationId(String requestId) {
        return requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
    }
}

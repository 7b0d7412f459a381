package postlogin.adapter.in.http;

import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.inject.Inject;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response.Status;

import com.tietoevry.quarkus.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;

import postlogin.adapter.in.problem.SessionProblem;
import postlogin.core.config.MockVerifierConfig;

/**
 * Stand-in for the external authority's validate-session endpoint, for local runs and tests.
 *
 * <p>Only served when {@code postlogin.mock-verifier.enabled=true}. Session tokens starting
 * with {@code expired} are reported expired, tokens starting with {@code invalid} are
 * rejected with 401, anything else is valid.
 */
@Path("/corporate/relationship-management/marketing/v1/customer")
@Produces(MediaType.APPLICATION_JSON)
public class MockSessionValidationResource {

    private static final Logger LOG = Logger.getLogger(MockSessionValidationResource.class);
    private static final String VALIDATED_AT = "2024-01-01T00:00:00Z";

    @Inject
    MockVerifierConfig config;

    @POST
    @Path("/validate-session")
    public Map<String, Object> validateSession(
            @HeaderParam("Apikey") String apiKey,
            @HeaderParam("x-request-id") String requestId,
            @HeaderParam("x-session-token") String sessionToken,
            @HeaderParam("x-user-id") String userId) {
        if (!config.enabled()) {
            throw SessionProblem.featureDisabled("Mock session verifier");
        }

        LOG.debugf("Mock validate session called [requestId=%s, userId=%s]", requestId, userId);

        if (isBlank(apiKey)) {
            throw problem(Status.UNAUTHORIZED, "Missing Apikey header");
        }
        if (isBlank(requestId)) {
            throw problem(Status.BAD_REQUEST, "Missing x-request-id header");
        }
        if (isBlank(sessionToken)) {
            throw problem(Status.BAD_REQUEST, "Missing x-session-token header");
        }
        if (isBlank(userId)) {
            throw problem(Status.BAD_REQUEST, "Missing x-user-id header");
        }
        if (sessionToken.startsWith("invalid")) {
            throw problem(Status.UNAUTHORIZED, "Invalid session token");
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("isExpire", sessionToken.startsWith("expired"));
        data.put("userId", userId);
        data.put("sessionToken", sessionToken);
        data.put("validatedAt", VALIDATED_AT);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("data", data);
        response.put("message", "Session validation completed");
        return response;
    }

    private static HttpProblem problem(Status status, String detail) {
        return HttpProblem.builder()
                .withTitle(status.getReasonPhrase())
                .withStatus(status)
                .withDetail(detail)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package postlogin.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.tietoevry.quarkus.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import postlogin.core.model.session.SessionErrorCode;
import postlogin.core.model.session.SessionLifecycleException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 *
 * <p>Client errors are logged at debug level; only internal errors are logged as errors,
 * and those were already logged with their correlation id by the lifecycle service.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapSessionLifecycleException(SessionLifecycleException e) {
        if (e.getCode() == SessionErrorCode.VERIFICATION_UNAVAILABLE) {
            LOG.warnv("Session request failed: {0}", e.getMessage());
        } else {
            LOG.debugv("Session request rejected: {0} {1}", e.getCode(), e.getMessage());
        }
        return toResponse(SessionProblem.of(e));
    }

    @ServerExceptionMapper
    public Response mapJsonProcessingException(JsonProcessingException e) {
        LOG.debugv("Malformed request body: {0}", e.getOriginalMessage());
        return toResponse(SessionProblem.validationError("Malformed request body"));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(SessionProblem.validationError("Invalid request"));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}

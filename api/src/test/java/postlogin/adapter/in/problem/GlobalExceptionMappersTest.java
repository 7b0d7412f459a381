package postlogin.adapter.in.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import com.tietoevry.quarkus.resteasy.problem.HttpProblem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import postlogin.core.model.session.SessionErrorCode;
import postlogin.core.model.session.SessionLifecycleException;

@DisplayName("GlobalExceptionMappers")
class GlobalExceptionMappersTest {

    private final GlobalExceptionMappers mappers = new GlobalExceptionMappers();

    @Test
    @DisplayName("should answer IllegalArgumentException with a fixed validation detail")
    void shouldNotEchoIllegalArgumentMessage() {
        var response = mappers.mapIllegalArgumentException(
                new IllegalArgumentException("Cannot deserialize value of type `java.time.Instant` from String"));

        var problem = (HttpProblem) response.getEntity();
        assertEquals(400, response.getStatus());
        assertEquals("Invalid request", problem.getDetail());
        assertEquals("VALIDATION_ERROR", problem.getParameters().get("code"));
        assertFalse(problem.getDetail().contains("java.time"));
    }

    @Test
    @DisplayName("should keep the detail of client-facing lifecycle errors")
    void shouldKeepLifecycleDetail() {
        var response = mappers.mapSessionLifecycleException(SessionLifecycleException.sessionNotFound());

        var problem = (HttpProblem) response.getEntity();
        assertEquals(404, response.getStatus());
        assertEquals("Session not found", problem.getDetail());
        assertEquals(SessionErrorCode.SESSION_NOT_FOUND.name(), problem.getParameters().get("code"));
    }

    @Test
    @DisplayName("should hide the detail of internal lifecycle errors")
    void shouldHideInternalDetail() {
        var response = mappers.mapSessionLifecycleException(
                new SessionLifecycleException(SessionErrorCode.INTERNAL_ERROR, "store down at 10.0.0.5"));

        var problem = (HttpProblem) response.getEntity();
        assertEquals(500, response.getStatus());
        assertEquals("An unexpected error occurred", problem.getDetail());
    }
}

package postlogin.adapter.in.problem;

import java.util.Locale;

import jakarta.ws.rs.core.Response.Status;

import com.tietoevry.quarkus.resteasy.problem.HttpProblem;

import postlogin.core.model.session.SessionErrorCode;
import postlogin.core.model.session.SessionLifecycleException;

/**
 * RFC 7807 Problem Details factory for session lifecycle errors.
 *
 * <p>Every problem carries two extension members: {@code code}, the stable
 * {@link SessionErrorCode} name, and {@code retryable}.
 */
public final class SessionProblem {

    private SessionProblem() {
        // Utility class - prevent instantiation
    }

    public static HttpProblem of(SessionLifecycleException e) {
        SessionErrorCode code = e.getCode();
        // Internal errors never leak exception messages
        String detail = code == SessionErrorCode.INTERNAL_ERROR ? "An unexpected error occurred" : e.getMessage();
        return of(code, detail);
    }

    public static HttpProblem of(SessionErrorCode code, String detail) {
        return HttpProblem.builder()
                .withTitle(title(code))
                .withStatus(status(code))
                .withDetail(detail)
                .with("code", code.name())
                .with("retryable", code.retryable())
                .build();
    }

    public static HttpProblem validationError(String detail) {
        return of(SessionErrorCode.VALIDATION_ERROR, detail);
    }

    public static HttpProblem invalidToken(String detail) {
        return of(SessionErrorCode.INVALID_TOKEN, detail);
    }

    public static HttpProblem featureDisabled(String feature) {
        return HttpProblem.builder()
                .withTitle("Feature Disabled")
                .withStatus(Status.NOT_FOUND)
                .withDetail("%s is not enabled".formatted(feature))
                .build();
    }

    static Status status(SessionErrorCode code) {
        return switch (code) {
            case VALIDATION_ERROR, INVALID_TOKEN -> Status.BAD_REQUEST;
            case CONFIGURATION_ERROR, SESSION_NOT_FOUND -> Status.NOT_FOUND;
            case TOKEN_EXPIRED, EXTERNAL_SESSION_EXPIRED -> Status.UNAUTHORIZED;
            case STALE_TOKEN -> Status.CONFLICT;
            case VERIFICATION_UNAVAILABLE -> Status.SERVICE_UNAVAILABLE;
            case INTERNAL_ERROR -> Status.INTERNAL_SERVER_ERROR;
        };
    }

    private static String title(SessionErrorCode code) {
        String[] words = code.name().toLowerCase(Locale.ROOT).split("_");
        StringBuilder title = new StringBuilder();
        for (String word : words) {
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return title.toString();
    }
}

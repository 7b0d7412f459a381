package postlogin.adapter.out.verifier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import postlogin.core.config.VerifierConfig;
import postlogin.core.model.session.VerificationResult;
import postlogin.core.port.out.ExternalSessionVerifier;

/**
 * External session verifier that calls the validate-session endpoint of the authority
 * that originally authenticated the user.
 *
 * <h2>Request Format</h2>
 * <pre>{@code
 * POST /corporate/relationship-management/marketing/v1/customer/validate-session
 * Apikey: <api key>
 * x-request-id: <correlation id>
 * x-session-token: <external token key>
 * x-user-id: <cif>
 *
 * {}
 * }</pre>
 *
 * <h2>Response Format</h2>
 * <pre>{@code
 * {
 *   "status": "success",
 *   "data": { "isExpire": false, "userId": "12345", "sessionToken": "...", "validatedAt": "..." },
 *   "message": "Session is valid"
 * }
 * }</pre>
 *
 * <p>Only a 200 response with {@code status == "success"} and a boolean {@code data.isExpire}
 * is a verdict. Everything else, including timeouts and transport errors, fails with
 * {@link VerifierUnavailableException}.
 */
@ApplicationScoped
public class RemoteSessionVerifier implements ExternalSessionVerifier {

    private static final Logger LOG = Logger.getLogger(RemoteSessionVerifier.class);

    static final String HEADER_API_KEY = "Apikey";
    static final String HEADER_REQUEST_ID = "x-request-id";
    static final String HEADER_SESSION_TOKEN = "x-session-token";
    static final String HEADER_USER_ID = "x-user-id";

    private final WebClient webClient;
    private final VerifierConfig config;

    @Inject
    public RemoteSessionVerifier(Vertx vertx, VerifierConfig config) {
        this.webClient = WebClient.create(vertx);
        this.config = config;
    }

    @Override
    public Uni<VerificationResult> verify(String sessionToken, String userId, String correlationId) {
        final var url = config.url().filter(u -> !u.isBlank());
        if (url.isEmpty()) {
            return Uni.createFrom()
                    .failure(new VerifierUnavailableException("External session verifier URL not configured"));
        }

        final var startTime = System.currentTimeMillis();
        final var request = webClient
                .postAbs(url.get())
                .timeout(config.timeout().toMillis())
                .putHeader("Content-Type", "application/json")
                .putHeader("Accept", "application/json")
                .putHeader(HEADER_SESSION_TOKEN, sessionToken)
                .putHeader(HEADER_USER_ID, userId);
        config.apiKey().ifPresent(key -> request.putHeader(HEADER_API_KEY, key));
        if (correlationId != null) {
            request.putHeader(HEADER_REQUEST_ID, correlationId);
        }

        return request.sendJsonObject(new JsonObject())
                .map(response -> {
                    final var duration = System.currentTimeMillis() - startTime;
                    final var result = parseResponse(response, userId);
                    LOG.debugf(
                            "External session verification: valid=%s, duration=%dms, correlationId=%s",
                            result.valid(), duration, correlationId);
                    return result;
                })
                .onFailure()
                .transform(error -> {
                    if (error instanceof VerifierUnavailableException) {
                        return error;
                    }
                    final var duration = System.currentTimeMillis() - startTime;
                    LOG.warnf(
                            "External session verification error: %s, duration=%dms, correlationId=%s",
                            error.getClass().getSimpleName(), duration, correlationId);
                    return new VerifierUnavailableException("External session verifier call failed", error);
                });
    }

    private VerificationResult parseResponse(HttpResponse<Buffer> response, String userId) {
        if (response.statusCode() != 200) {
            LOG.warnf("External session verifier returned status %d", response.statusCode());
            throw new VerifierUnavailableException(
                    "External session verifier returned status " + response.statusCode());
        }

        final JsonObject json;
        try {
            json = response.bodyAsJsonObject();
        } catch (RuntimeException e) {
            throw new VerifierUnavailableException("External session verifier returned malformed JSON", e);
        }
        if (json == null || !"success".equals(json.getValue("status"))) {
            throw new VerifierUnavailableException("External session verifier did not report success");
        }

        final var data = json.getValue("data");
        if (!(data instanceof JsonObject dataObject) || !(dataObject.getValue("isExpire") instanceof Boolean expired)) {
            throw new VerifierUnavailableException("External session verifier response has no isExpire flag");
        }

        final var validatedUser = dataObject.getValue("userId") instanceof String id ? id : userId;
        final var validatedAt = dataObject.getValue("validatedAt") instanceof String at ? at : null;
        return new VerificationResult(!expired, validatedUser, validatedAt);
    }
}

package postlogin.adapter.in.dto;

/**
 * DTO describing the session behind an access token.
 *
 * @param sessionId session identifier
 * @param chatUsername derived session handle
 * @param businessUnit business unit of the session
 * @param cif customer identification number
 * @param expiresAt ISO-8601 session expiry
 */
public record SessionInfoResponse(
        String sessionId, String chatUsername, String businessUnit, String cif, String expiresAt) {}

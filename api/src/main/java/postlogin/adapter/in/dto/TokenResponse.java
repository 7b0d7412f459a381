package postlogin.adapter.in.dto;

/**
 * DTO returned by session initiation and token renewal.
 *
 * @param token access token
 * @param refreshToken refresh token
 * @param message outcome message, e.g. "SME session initialized successfully"
 */
public record TokenResponse(String token, String refreshToken, String message) {}

package postlogin.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * DTO for token renewal and logout requests: {@code {"data": {"refreshToken": "..."}}}.
 *
 * @param data request envelope
 */
public record RefreshTokenRequest(Data data) {

    public record Data(@JsonAlias("refresh_token") String refreshToken) {}
}

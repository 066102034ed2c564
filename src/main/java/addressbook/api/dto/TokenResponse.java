package addressbook.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO carrying a session token.
 *
 * @param accessToken compact signed JWT
 * @param tokenType   always {@code bearer}
 */
public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType
) {
    public static final String BEARER = "bearer";

    public static TokenResponse bearer(final String accessToken) {
        return new TokenResponse(accessToken, BEARER);
    }

    @Override
    public String toString() {
        return "TokenResponse[accessToken=***, tokenType=" + tokenType + "]";
    }
}

package villagecompute.jobengine.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OAuth 2.0 token endpoint response for the {@code refresh_token} grant (RFC 6749 Section 5.1).
 *
 * @param accessToken
 *            the new access token
 * @param expiresIn
 *            token lifetime in seconds; null when the provider omits it
 * @param refreshToken
 *            rotated refresh token, or null when the provider keeps the old one valid
 * @param tokenType
 *            token type, usually "Bearer"
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record OAuthTokenResponseType(@JsonProperty("access_token") String accessToken,
        @JsonProperty("expires_in") Long expiresIn, @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("token_type") String tokenType) {
}

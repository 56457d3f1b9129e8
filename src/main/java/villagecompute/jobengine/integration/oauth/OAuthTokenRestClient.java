package villagecompute.jobengine.integration.oauth;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import villagecompute.jobengine.api.types.OAuthTokenResponseType;

/**
 * REST client for a provider's OAuth 2.0 token endpoint.
 *
 * <p>
 * Each credential carries its own endpoint, so instances are built per call by {@link OAuthTokenClient} with the
 * endpoint URL as base URI rather than registered under a config key.
 */
public interface OAuthTokenRestClient {

    /**
     * Calls the token endpoint with form-encoded parameters per RFC 6749 Section 6.
     *
     * @param grantType
     *            always "refresh_token"
     */
    @POST
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    OAuthTokenResponseType refresh(@FormParam("grant_type") String grantType,
            @FormParam("refresh_token") String refreshToken, @FormParam("client_id") String clientId,
            @FormParam("client_secret") String clientSecret);
}

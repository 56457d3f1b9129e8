package villagecompute.jobengine.integration.oauth;

import io.quarkus.rest.client.reactive.QuarkusRestClientBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.ProcessingException;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import villagecompute.jobengine.api.types.OAuthTokenResponseType;
import villagecompute.jobengine.data.models.IntegrationCredential;
import villagecompute.jobengine.exceptions.PermanentExecutionException;
import villagecompute.jobengine.exceptions.TransientExecutionException;

import java.net.URI;
import java.util.concurrent.TimeUnit;

/**
 * Client for the OAuth 2.0 refresh_token grant against a credential's own token endpoint.
 *
 * <p>
 * A rejected refresh token ({@code invalid_grant}) is reported as {@link PermanentExecutionException}; the caller
 * should mark the credential revoked. Every other failure is a {@link TransientExecutionException}. Error bodies are
 * inspected by {@link OAuthErrorResponseMapper}.
 */
@ApplicationScoped
public class OAuthTokenClient {

    @ConfigProperty(
            name = "jobengine.handlers.http-timeout-seconds",
            defaultValue = "30")
    long timeoutSeconds;

    /**
     * @throws PermanentExecutionException
     *             if the provider rejected the refresh token
     * @throws TransientExecutionException
     *             for any other HTTP error, an unreachable endpoint or a response without access token
     */
    public OAuthTokenResponseType refresh(IntegrationCredential credential) {
        OAuthTokenRestClient client = QuarkusRestClientBuilder.newBuilder()
                .baseUri(URI.create(credential.tokenEndpoint)).connectTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .register(new OAuthErrorResponseMapper(credential.provider)).build(OAuthTokenRestClient.class);
        try {
            OAuthTokenResponseType response = client.refresh("refresh_token", credential.refreshToken,
                    credential.clientId, credential.clientSecret);
            if (response == null || response.accessToken() == null) {
                throw new TransientExecutionException(
                        "Token endpoint for " + credential.provider + " returned no access_token");
            }
            return response;
        } catch (ProcessingException e) {
            throw new TransientExecutionException(
                    "Token endpoint for " + credential.provider + " unreachable: " + e.getMessage(), e);
        }
    }
}

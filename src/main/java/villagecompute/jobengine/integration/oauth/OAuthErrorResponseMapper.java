package villagecompute.jobengine.integration.oauth;

import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;
import villagecompute.jobengine.exceptions.PermanentExecutionException;
import villagecompute.jobengine.exceptions.TransientExecutionException;

/**
 * Maps token endpoint error responses while the body is still readable. An {@code invalid_grant} error means the
 * refresh token is dead and becomes a {@link PermanentExecutionException}; anything else is transient.
 */
public class OAuthErrorResponseMapper implements ResponseExceptionMapper<RuntimeException> {

    static final String INVALID_GRANT = "invalid_grant";

    private final String provider;

    public OAuthErrorResponseMapper(String provider) {
        this.provider = provider;
    }

    @Override
    public RuntimeException toThrowable(Response response) {
        String body = readBody(response);
        if (body.contains(INVALID_GRANT)) {
            return new PermanentExecutionException(INVALID_GRANT + ": " + provider + " rejected the refresh token");
        }
        return new TransientExecutionException(
                "Token endpoint for " + provider + " returned HTTP " + response.getStatus());
    }

    @Override
    public boolean handles(int status, MultivaluedMap<String, Object> headers) {
        return status >= 400;
    }

    private static String readBody(Response response) {
        try {
            if (!response.hasEntity()) {
                return "";
            }
            String body = response.readEntity(String.class);
            return body == null ? "" : body;
        } catch (RuntimeException unreadable) {
            return "";
        }
    }
}

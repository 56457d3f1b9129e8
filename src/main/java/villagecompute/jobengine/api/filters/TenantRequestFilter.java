package villagecompute.jobengine.api.filters;

import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import villagecompute.jobengine.observability.LoggingConfig;
import villagecompute.jobengine.tenancy.TenantContext;

import java.util.List;

/**
 * Requires the {@code X-Tenant-Id} header on tenant-facing endpoints ({@code /jobs}, {@code /cron-jobs}).
 *
 * <p>
 * A request without the header is rejected with 403 before it reaches a resource. Accepted requests have the header
 * rewritten to its {@link TenantContext#normalize normalized} form and get {@code tenant_id} and
 * {@code request_origin} in the MDC; the response filter clears them again. Resources read the tenant from the
 * rewritten header themselves, since the filter and the resource method may run on different threads.
 *
 * <p>
 * <b>Priority:</b> Runs at {@code Priorities.AUTHORIZATION} (2000).
 */
@Provider
@Priority(Priorities.AUTHORIZATION)
public class TenantRequestFilter implements ContainerRequestFilter, ContainerResponseFilter {

    private static final Logger LOG = Logger.getLogger(TenantRequestFilter.class);

    public static final String TENANT_HEADER = "X-Tenant-Id";

    static final List<String> TENANT_PATHS = List.of("jobs", "cron-jobs");

    @Override
    public void filter(ContainerRequestContext requestContext) {
        String path = normalize(requestContext.getUriInfo().getPath());
        if (!isTenantPath(path)) {
            return;
        }

        String tenantId = TenantContext.normalize(requestContext.getHeaderString(TENANT_HEADER));
        if (tenantId == null) {
            LOG.debugf("Rejected %s /%s without %s header", requestContext.getMethod(), path, TENANT_HEADER);
            requestContext.abortWith(Response.status(Response.Status.FORBIDDEN)
                    .entity(new ErrorResponse("Missing " + TENANT_HEADER + " header")).build());
            return;
        }

        requestContext.getHeaders().putSingle(TENANT_HEADER, tenantId);
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setTenantId(tenantId);
        LoggingConfig.setRequestOrigin(requestContext.getMethod() + " /" + path);
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        LoggingConfig.clearMDC();
    }

    static boolean isTenantPath(String path) {
        for (String prefix : TENANT_PATHS) {
            if (path.equals(prefix) || path.startsWith(prefix + "/")) {
                return true;
            }
        }
        return false;
    }

    private static String normalize(String path) {
        String trimmed = path == null ? "" : path;
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed;
    }

    /**
     * Simple error response record for 403 responses.
     */
    public record ErrorResponse(String error) {
    }
}

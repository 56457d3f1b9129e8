package villagecompute.jobengine.api.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.jobengine.api.types.TickSummaryType;
import villagecompute.jobengine.services.CronSchedulerService;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;

/**
 * Entry point for the external scheduler trigger (platform cron, Kubernetes CronJob, cloud scheduler).
 *
 * <p>
 * Protected by a shared secret in {@code X-Scheduler-Token}, compared against {@code jobengine.tick.token}. Calling
 * more often than needed is harmless: a tick only fires schedules that are due and not yet advanced.
 */
@Path("/internal/scheduler")
@Produces(MediaType.APPLICATION_JSON)
public class SchedulerTickResource {

    private static final Logger LOG = Logger.getLogger(SchedulerTickResource.class);

    static final String TOKEN_HEADER = "X-Scheduler-Token";

    @Inject
    CronSchedulerService scheduler;

    @ConfigProperty(
            name = "jobengine.tick.token")
    String expectedToken;

    /**
     * Runs one tick against the current time.
     *
     * @return 200 with the tick summary, 401 for a missing or wrong token
     */
    @POST
    @Path("/tick")
    public Response tick(@HeaderParam(TOKEN_HEADER) String token) {
        if (token == null || !MessageDigest.isEqual(token.getBytes(StandardCharsets.UTF_8),
                expectedToken.getBytes(StandardCharsets.UTF_8))) {
            LOG.warn("Rejected scheduler tick with missing or invalid token");
            return Response.status(Response.Status.UNAUTHORIZED).entity(new ErrorResponse("Invalid scheduler token"))
                    .build();
        }
        try {
            TickSummaryType summary = scheduler.tick(Instant.now());
            return Response.ok(summary).build();
        } catch (Exception e) {
            LOG.errorf(e, "Scheduler tick failed");
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Scheduler tick failed")).build();
        }
    }

    /**
     * Simple error response record for API errors.
     */
    public record ErrorResponse(String error) {
    }
}

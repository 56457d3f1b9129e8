package villagecompute.jobengine.api.rest;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import villagecompute.jobengine.api.filters.TenantRequestFilter;
import villagecompute.jobengine.api.types.EnqueueJobRequestType;
import villagecompute.jobengine.api.types.JobAttemptType;
import villagecompute.jobengine.api.types.JobCreatedType;
import villagecompute.jobengine.api.types.JobDetailType;
import villagecompute.jobengine.api.types.JobStatusType;
import villagecompute.jobengine.api.types.PageType;
import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.data.models.Job.JobStatus;
import villagecompute.jobengine.exceptions.HandlerNotFoundException;
import villagecompute.jobengine.exceptions.ResourceNotFoundException;
import villagecompute.jobengine.exceptions.TenantAccessException;
import villagecompute.jobengine.exceptions.ValidationException;
import villagecompute.jobengine.jobs.EnqueueOptions;
import villagecompute.jobengine.jobs.JobPriority;
import villagecompute.jobengine.services.ExecutionHistoryService;
import villagecompute.jobengine.services.JobQueueService;
import villagecompute.jobengine.services.JobQueueService.JobPage;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Tenant API for background jobs: enqueue, poll, list, cancel, attempt history and statistics.
 *
 * <p>
 * Every endpoint is scoped to the tenant in {@code X-Tenant-Id}; a job of another tenant is reported as not found.
 *
 * <p>
 * <b>Error Responses:</b>
 * <ul>
 * <li>400 - invalid body, unknown job type or priority</li>
 * <li>403 - missing tenant header or platform-reserved job type</li>
 * <li>404 - job absent or owned by another tenant</li>
 * <li>409 - cancelling a job that already finished</li>
 * </ul>
 */
@Path("/jobs")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class JobResource {

    private static final Logger LOG = Logger.getLogger(JobResource.class);

    @Inject
    JobQueueService jobQueue;

    @Inject
    ExecutionHistoryService history;

    /**
     * Enqueues a job.
     *
     * <p>
     * <b>Request Body:</b>
     *
     * <pre>
     * {
     *   "type": "catalog:import",
     *   "payload": {"connector": "shopify"},
     *   "priority": "high",
     *   "maxRetries": 3,
     *   "delaySeconds": 0
     * }
     * </pre>
     *
     * @return 201 with {@code {"jobId": 42}}
     */
    @POST
    public Response enqueue(@HeaderParam(TenantRequestFilter.TENANT_HEADER) String tenantId,
            @Valid EnqueueJobRequestType request) {
        if (request == null) {
            return error(Response.Status.BAD_REQUEST, "Request body required");
        }
        try {
            EnqueueOptions options = new EnqueueOptions(JobPriority.fromString(request.priority()),
                    request.maxRetries(), request.metadata(),
                    request.delaySeconds() == null ? null : Duration.ofSeconds(request.delaySeconds()));
            Job job = jobQueue.submit(tenantId, request.type(), request.payload(), options);
            return Response.status(Response.Status.CREATED).entity(new JobCreatedType(job.id)).build();
        } catch (HandlerNotFoundException e) {
            return error(Response.Status.BAD_REQUEST, e.getMessage());
        } catch (ValidationException e) {
            return error(Response.Status.BAD_REQUEST, e.getMessage());
        } catch (TenantAccessException e) {
            return error(Response.Status.FORBIDDEN, e.getMessage());
        } catch (Exception e) {
            LOG.errorf(e, "Failed to enqueue job of type %s for tenant %s", request.type(), tenantId);
            return error(Response.Status.INTERNAL_SERVER_ERROR, "Failed to enqueue job");
        }
    }

    /**
     * Counts of the tenant's jobs per status.
     */
    @GET
    @Path("/status")
    public Response countsByStatus(@HeaderParam(TenantRequestFilter.TENANT_HEADER) String tenantId) {
        Map<String, Long> counts = new LinkedHashMap<>();
        jobQueue.countByStatus(tenantId).forEach((status, count) -> counts.put(status.name(), count));
        return Response.ok(counts).build();
    }

    /**
     * Job statistics over a window.
     *
     * @param window
     *            {@code 1h}, {@code 24h} (default), {@code 7d} or {@code 30d}
     */
    @GET
    @Path("/stats")
    public Response stats(@HeaderParam(TenantRequestFilter.TENANT_HEADER) String tenantId,
            @QueryParam("window") @DefaultValue("24h") String window) {
        try {
            return Response.ok(history.jobStats(tenantId, window, Instant.now())).build();
        } catch (ValidationException e) {
            return error(Response.Status.BAD_REQUEST, e.getMessage());
        }
    }

    /**
     * The tenant's most recent job attempts across all jobs, newest first.
     */
    @GET
    @Path("/activity")
    public Response activity(@HeaderParam(TenantRequestFilter.TENANT_HEADER) String tenantId,
            @QueryParam("limit") @DefaultValue("100") int limit) {
        try {
            return Response.ok(jobQueue.recentActivity(tenantId, limit).stream().map(JobAttemptType::from).toList())
                    .build();
        } catch (ValidationException e) {
            return error(Response.Status.BAD_REQUEST, e.getMessage());
        }
    }

    /**
     * Status polling endpoint. Single primary-key read.
     */
    @GET
    @Path("/{id}/status")
    public Response status(@HeaderParam(TenantRequestFilter.TENANT_HEADER) String tenantId,
            @PathParam("id") Long jobId) {
        try {
            return Response.ok(JobStatusType.from(jobQueue.getStatus(tenantId, jobId))).build();
        } catch (ResourceNotFoundException e) {
            return error(Response.Status.NOT_FOUND, e.getMessage());
        }
    }

    @GET
    @Path("/{id}")
    public Response get(@HeaderParam(TenantRequestFilter.TENANT_HEADER) String tenantId,
            @PathParam("id") Long jobId) {
        try {
            return Response.ok(JobDetailType.from(jobQueue.getJob(tenantId, jobId))).build();
        } catch (ResourceNotFoundException e) {
            return error(Response.Status.NOT_FOUND, e.getMessage());
        }
    }

    /**
     * Every finished attempt of a job, oldest first.
     */
    @GET
    @Path("/{id}/history")
    public Response attempts(@HeaderParam(TenantRequestFilter.TENANT_HEADER) String tenantId,
            @PathParam("id") Long jobId) {
        try {
            return Response.ok(jobQueue.history(tenantId, jobId).stream().map(JobAttemptType::from).toList()).build();
        } catch (ResourceNotFoundException e) {
            return error(Response.Status.NOT_FOUND, e.getMessage());
        }
    }

    /**
     * Lists the tenant's jobs, newest first.
     */
    @GET
    public Response list(@HeaderParam(TenantRequestFilter.TENANT_HEADER) String tenantId,
            @QueryParam("status") String status, @QueryParam("type") String type,
            @QueryParam("page") @DefaultValue("0") int page, @QueryParam("size") @DefaultValue("20") int size) {
        try {
            JobPage found = jobQueue.list(tenantId, parseStatus(status), type, page, size);
            return Response.ok(new PageType<>(found.items().stream().map(JobDetailType::from).toList(), found.total(),
                    found.page(), found.size())).build();
        } catch (ValidationException e) {
            return error(Response.Status.BAD_REQUEST, e.getMessage());
        }
    }

    /**
     * Cancels a job. Pending jobs are cancelled at once; running jobs stop at their next cancellation check.
     *
     * @return 200 with the job status, 409 if the job already finished
     */
    @POST
    @Path("/{id}/cancel")
    public Response cancel(@HeaderParam(TenantRequestFilter.TENANT_HEADER) String tenantId,
            @PathParam("id") Long jobId) {
        try {
            Job job = jobQueue.cancel(tenantId, jobId, Instant.now());
            return Response.ok(JobStatusType.from(job)).build();
        } catch (ResourceNotFoundException e) {
            return error(Response.Status.NOT_FOUND, e.getMessage());
        } catch (ValidationException e) {
            return error(e.isConflict() ? Response.Status.CONFLICT : Response.Status.BAD_REQUEST, e.getMessage());
        }
    }

    private static JobStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return JobStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown status '" + status + "'");
        }
    }

    private static Response error(Response.Status status, String message) {
        return Response.status(status).entity(new ErrorResponse(message)).build();
    }

    /**
     * Simple error response record for API errors.
     */
    public record ErrorResponse(String error) {
    }
}

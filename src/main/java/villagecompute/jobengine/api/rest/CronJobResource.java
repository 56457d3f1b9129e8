package villagecompute.jobengine.api.rest;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import villagecompute.jobengine.api.filters.TenantRequestFilter;
import villagecompute.jobengine.api.types.CreateCronJobRequestType;
import villagecompute.jobengine.api.types.CronJobExecutionType;
import villagecompute.jobengine.api.types.CronJobType;
import villagecompute.jobengine.api.types.JobTypeInfoType;
import villagecompute.jobengine.api.types.PageType;
import villagecompute.jobengine.api.types.PauseCronJobRequestType;
import villagecompute.jobengine.api.types.UpdateCronJobRequestType;
import villagecompute.jobengine.data.models.CronJob;
import villagecompute.jobengine.data.models.CronJobExecution;
import villagecompute.jobengine.exceptions.ResourceNotFoundException;
import villagecompute.jobengine.exceptions.ScheduleMisconfiguredException;
import villagecompute.jobengine.exceptions.TenantAccessException;
import villagecompute.jobengine.exceptions.ValidationException;
import villagecompute.jobengine.jobs.JobTypeRegistry;
import villagecompute.jobengine.services.ExecutionHistoryService;
import villagecompute.jobengine.services.JobQueueService;
import villagecompute.jobengine.services.ScheduleService;

import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Tenant API for cron schedules.
 *
 * <p>
 * Deleting a schedule deactivates it; its execution history stays queryable. Platform schedules ({@code system:} job
 * types) are invisible here and cannot be created.
 *
 * <p>
 * <b>Error Responses:</b>
 * <ul>
 * <li>400 - invalid cron expression or timezone, unknown job type, invalid body</li>
 * <li>403 - missing tenant header, system job type or source</li>
 * <li>404 - schedule absent or owned by another tenant</li>
 * <li>409 - executing an inactive schedule</li>
 * </ul>
 */
@Path("/cron-jobs")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class CronJobResource {

    private static final Logger LOG = Logger.getLogger(CronJobResource.class);

    @Inject
    ScheduleService schedules;

    @Inject
    ExecutionHistoryService history;

    @Inject
    JobTypeRegistry registry;

    /**
     * Creates a schedule.
     *
     * <p>
     * <b>Request Body:</b>
     *
     * <pre>
     * {
     *   "name": "Nightly Shopify import",
     *   "cron_expression": "0 2 * * *",
     *   "timezone": "Europe/Amsterdam",
     *   "job_type": "catalog:import",
     *   "configuration": {"connector": "shopify"}
     * }
     * </pre>
     *
     * @return 201 with the schedule, including its first {@code next_run_at}
     */
    @POST
    public Response create(@HeaderParam(TenantRequestFilter.TENANT_HEADER) String tenantId,
            @Valid CreateCronJobRequestType request) {
        if (request == null) {
            return error(Response.Status.BAD_REQUEST, "Request body required");
        }
        return handle("create schedule", () -> Response.status(Response.Status.CREATED)
                .entity(CronJobType.from(schedules.create(tenantId, request, Instant.now()))).build());
    }

    @GET
    public Response list(@HeaderParam(TenantRequestFilter.TENANT_HEADER) String tenantId,
            @QueryParam("page") @DefaultValue("0") int page, @QueryParam("size") @DefaultValue("20") int size) {
        return handle("list schedules", () -> {
            ScheduleService.Page<CronJob> found = schedules.list(tenantId, page, size);
            return Response.ok(new PageType<>(found.items().stream().map(CronJobType::from).toList(), found.total(),
                    found.page(), found.size())).build();
        });
    }

    /**
     * Job types a schedule can target, with their execution mode.
     */
    @GET
    @Path("/types")
    public Response types() {
        List<JobTypeInfoType> types = registry.listHandlers().stream()
                .filter(handler -> !handler.handlesType().startsWith(JobQueueService.SYSTEM_TYPE_PREFIX))
                .map(handler -> new JobTypeInfoType(handler.handlesType(), handler.executionMode().name(),
                        handler.description()))
                .toList();
        return Response.ok(types).build();
    }

    @GET
    @Path("/stats")
    public Response stats(@HeaderParam(TenantRequestFilter.TENANT_HEADER) String tenantId) {
        return Response.ok(history.scheduleStats(tenantId)).build();
    }

    @GET
    @Path("/{id}")
    public Response get(@HeaderParam(TenantRequestFilter.TENANT_HEADER) String tenantId, @PathParam("id") Long id) {
        return handle("get schedule", () -> Response.ok(CronJobType.from(schedules.get(tenantId, id))).build());
    }

    /**
     * Partial update. Null fields are left unchanged.
     */
    @PUT
    @Path("/{id}")
    public Response update(@HeaderParam(TenantRequestFilter.TENANT_HEADER) String tenantId, @PathParam("id") Long id,
            @Valid UpdateCronJobRequestType request) {
        if (request == null) {
            return error(Response.Status.BAD_REQUEST, "Request body required");
        }
        return handle("update schedule",
                () -> Response.ok(CronJobType.from(schedules.update(tenantId, id, request, Instant.now()))).build());
    }

    /**
     * Deactivates the schedule.
     */
    @DELETE
    @Path("/{id}")
    public Response delete(@HeaderParam(TenantRequestFilter.TENANT_HEADER) String tenantId,
            @PathParam("id") Long id) {
        return handle("deactivate schedule",
                () -> Response.ok(CronJobType.from(schedules.deactivate(tenantId, id, Instant.now()))).build());
    }

    @POST
    @Path("/{id}/pause")
    public Response pause(@HeaderParam(TenantRequestFilter.TENANT_HEADER) String tenantId, @PathParam("id") Long id,
            PauseCronJobRequestType request) {
        String reason = request == null ? null : request.reason();
        return handle("pause schedule",
                () -> Response.ok(CronJobType.from(schedules.pause(tenantId, id, reason, Instant.now()))).build());
    }

    /**
     * Resumes a paused schedule, clearing its failure streak.
     */
    @POST
    @Path("/{id}/resume")
    public Response resume(@HeaderParam(TenantRequestFilter.TENANT_HEADER) String tenantId,
            @PathParam("id") Long id) {
        return handle("resume schedule",
                () -> Response.ok(CronJobType.from(schedules.resume(tenantId, id, Instant.now()))).build());
    }

    /**
     * Fires the schedule now without moving its next run.
     *
     * @return the execution record; for queued job types it is ENQUEUED with the job id
     */
    @POST
    @Path("/{id}/execute")
    public Response execute(@HeaderParam(TenantRequestFilter.TENANT_HEADER) String tenantId,
            @PathParam("id") Long id) {
        return handle("execute schedule", () -> {
            CronJobExecution execution = schedules.execute(tenantId, id, Instant.now());
            return Response.ok(CronJobExecutionType.from(execution)).build();
        });
    }

    @GET
    @Path("/{id}/executions")
    public Response executions(@HeaderParam(TenantRequestFilter.TENANT_HEADER) String tenantId,
            @PathParam("id") Long id, @QueryParam("page") @DefaultValue("0") int page,
            @QueryParam("size") @DefaultValue("20") int size) {
        return handle("list executions", () -> {
            ScheduleService.Page<CronJobExecution> found = schedules.executions(tenantId, id, page, size);
            return Response.ok(new PageType<>(found.items().stream().map(CronJobExecutionType::from).toList(),
                    found.total(), found.page(), found.size())).build();
        });
    }

    private Response handle(String action, Supplier<Response> call) {
        try {
            return call.get();
        } catch (ResourceNotFoundException e) {
            return error(Response.Status.NOT_FOUND, e.getMessage());
        } catch (ScheduleMisconfiguredException e) {
            return error(Response.Status.BAD_REQUEST, e.getMessage());
        } catch (ValidationException e) {
            return error(e.isConflict() ? Response.Status.CONFLICT : Response.Status.BAD_REQUEST, e.getMessage());
        } catch (TenantAccessException e) {
            return error(Response.Status.FORBIDDEN, e.getMessage());
        } catch (Exception e) {
            LOG.errorf(e, "Failed to %s", action);
            return error(Response.Status.INTERNAL_SERVER_ERROR, "Failed to " + action);
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

package villagecompute.jobengine.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.jobengine.api.types.CreateCronJobRequestType;
import villagecompute.jobengine.api.types.UpdateCronJobRequestType;
import villagecompute.jobengine.data.models.CronJob;
import villagecompute.jobengine.data.models.CronJob.SourceType;
import villagecompute.jobengine.data.models.CronJobExecution;
import villagecompute.jobengine.exceptions.ResourceNotFoundException;
import villagecompute.jobengine.exceptions.ScheduleMisconfiguredException;
import villagecompute.jobengine.exceptions.TenantAccessException;
import villagecompute.jobengine.exceptions.ValidationException;
import villagecompute.jobengine.jobs.JobPriority;
import villagecompute.jobengine.jobs.JobTypeRegistry;
import villagecompute.jobengine.scheduling.CronExpression;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;

/**
 * Schedule management: create, update, deactivate, pause, resume, manual execution and execution history.
 *
 * <p>
 * Expressions, timezones and job types are validated synchronously, so a schedule that reaches the tick is always
 * runnable. Tenants can neither see nor create system schedules; those are created by {@link SystemScheduleBootstrap}.
 *
 * <p>
 * Schedules are never hard-deleted: deletion deactivates, keeping the execution history intact.
 */
@ApplicationScoped
public class ScheduleService {

    private static final Logger LOG = Logger.getLogger(ScheduleService.class);

    static final int MAX_RETRIES_LIMIT = 25;

    @Inject
    JobTypeRegistry registry;

    @Inject
    CronSchedulerService scheduler;

    @ConfigProperty(
            name = "jobengine.schedules.default-max-failures",
            defaultValue = "5")
    int defaultMaxFailures;

    @ConfigProperty(
            name = "jobengine.jobs.default-max-retries",
            defaultValue = "3")
    int defaultMaxRetries;

    /**
     * Page of schedules or executions with total count.
     */
    public record Page<T>(List<T> items, long total, int page, int size) {
    }

    /**
     * Creates a tenant schedule.
     *
     * @throws ScheduleMisconfiguredException
     *             for invalid expression, timezone or job type
     * @throws TenantAccessException
     *             for {@code system:} job types or SYSTEM source
     */
    @Transactional
    public CronJob create(String tenantId, CreateCronJobRequestType request, Instant now) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new TenantAccessException("Tenant context is required");
        }
        if (request.name() == null || request.name().isBlank()) {
            throw new ValidationException("name is required");
        }
        SourceType sourceType = parseSourceType(request.sourceType());
        if (sourceType == SourceType.SYSTEM) {
            throw new TenantAccessException("System schedules cannot be created by tenants");
        }
        validateJobType(request.jobType(), true);

        CronJob cronJob = new CronJob();
        cronJob.tenantId = tenantId;
        cronJob.name = request.name().trim();
        cronJob.description = request.description();
        cronJob.cronExpression = request.cronExpression() == null ? null : request.cronExpression().trim();
        cronJob.timezone = normalizeZone(request.timezone());
        cronJob.jobType = request.jobType();
        cronJob.configuration = request.configuration() == null ? new HashMap<>()
                : new HashMap<>(request.configuration());
        cronJob.sourceType = sourceType;
        cronJob.sourceId = request.sourceId();
        cronJob.active = request.active() == null || request.active();
        cronJob.oneTime = Boolean.TRUE.equals(request.oneTime());
        cronJob.priority = JobPriority.fromString(request.priority());
        cronJob.maxRetries = validateMaxRetries(request.maxRetries());
        cronJob.maxRuns = validateMaxRuns(request.maxRuns());
        cronJob.maxFailures = validateMaxFailures(request.maxFailures());
        cronJob.createdAt = now;
        cronJob.updatedAt = now;
        cronJob.nextRunAt = CronSchedulerService.computeNextRun(cronJob.cronExpression, cronJob.timezone, now);
        cronJob.persist();

        LOG.infof("Created schedule %d (%s) for tenant %s: '%s' %s -> %s, next run %s", cronJob.id, cronJob.name,
                tenantId, cronJob.cronExpression, cronJob.timezone, cronJob.jobType, cronJob.nextRunAt);
        return cronJob;
    }

    /**
     * Creates a platform-wide schedule if no system schedule for {@code jobType} exists yet.
     *
     * @return the new or existing schedule
     */
    @Transactional
    public CronJob ensureSystemSchedule(String name, String description, String cronExpression, String jobType,
            JobPriority priority, Instant now) {
        return CronJob.findSystemByJobType(jobType).orElseGet(() -> {
            validateJobType(jobType, false);
            CronJob cronJob = new CronJob();
            cronJob.name = name;
            cronJob.description = description;
            cronJob.cronExpression = cronExpression;
            cronJob.timezone = "UTC";
            cronJob.jobType = jobType;
            cronJob.configuration = new HashMap<>();
            cronJob.sourceType = SourceType.SYSTEM;
            cronJob.system = true;
            cronJob.active = true;
            cronJob.priority = priority == null ? JobPriority.NORMAL : priority;
            cronJob.maxRetries = defaultMaxRetries;
            cronJob.maxFailures = defaultMaxFailures;
            cronJob.createdAt = now;
            cronJob.updatedAt = now;
            cronJob.nextRunAt = CronSchedulerService.computeNextRun(cronExpression, cronJob.timezone, now);
            cronJob.persist();
            LOG.infof("Bootstrapped system schedule %d (%s): '%s' -> %s", cronJob.id, name, cronExpression, jobType);
            return cronJob;
        });
    }

    @Transactional
    public CronJob get(String tenantId, Long cronJobId) {
        return CronJob.findByIdForTenant(cronJobId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Cron job not found: " + cronJobId));
    }

    @Transactional
    public Page<CronJob> list(String tenantId, int page, int size) {
        validatePaging(page, size);
        return new Page<>(CronJob.findByTenant(tenantId, page, size), CronJob.countByTenant(tenantId), page, size);
    }

    /**
     * Applies a partial update. Changing the expression or timezone, or reactivating, recomputes {@code next_run_at}
     * from {@code now}.
     */
    @Transactional
    public CronJob update(String tenantId, Long cronJobId, UpdateCronJobRequestType request, Instant now) {
        CronJob cronJob = get(tenantId, cronJobId);
        boolean recompute = false;

        if (request.name() != null) {
            if (request.name().isBlank()) {
                throw new ValidationException("name must not be blank");
            }
            cronJob.name = request.name().trim();
        }
        if (request.description() != null) {
            cronJob.description = request.description();
        }
        if (request.cronExpression() != null && !request.cronExpression().trim().equals(cronJob.cronExpression)) {
            cronJob.cronExpression = request.cronExpression().trim();
            recompute = true;
        }
        if (request.timezone() != null && !normalizeZone(request.timezone()).equals(cronJob.timezone)) {
            cronJob.timezone = normalizeZone(request.timezone());
            recompute = true;
        }
        if (request.configuration() != null) {
            cronJob.configuration = new HashMap<>(request.configuration());
        }
        if (request.active() != null && request.active() != cronJob.active) {
            cronJob.active = request.active();
            recompute = recompute || cronJob.active;
        }
        if (request.maxRuns() != null) {
            cronJob.maxRuns = validateMaxRuns(request.maxRuns());
        }
        if (request.maxFailures() != null) {
            cronJob.maxFailures = validateMaxFailures(request.maxFailures());
        }
        if (request.priority() != null) {
            cronJob.priority = JobPriority.fromString(request.priority());
        }
        if (request.maxRetries() != null) {
            cronJob.maxRetries = validateMaxRetries(request.maxRetries());
        }

        if (recompute) {
            cronJob.nextRunAt = CronSchedulerService.computeNextRun(cronJob.cronExpression, cronJob.timezone, now);
        }
        cronJob.updatedAt = now;
        LOG.infof("Updated schedule %d (%s), next run %s", cronJob.id, cronJob.name, cronJob.nextRunAt);
        return cronJob;
    }

    /**
     * Soft delete: the schedule stops firing, its history is kept.
     */
    @Transactional
    public CronJob deactivate(String tenantId, Long cronJobId, Instant now) {
        CronJob cronJob = get(tenantId, cronJobId);
        cronJob.active = false;
        cronJob.updatedAt = now;
        LOG.infof("Deactivated schedule %d (%s)", cronJob.id, cronJob.name);
        return cronJob;
    }

    @Transactional
    public CronJob pause(String tenantId, Long cronJobId, String reason, Instant now) {
        CronJob cronJob = get(tenantId, cronJobId);
        cronJob.paused = true;
        cronJob.pausedReason = reason == null || reason.isBlank() ? "Paused by user" : reason;
        cronJob.updatedAt = now;
        LOG.infof("Paused schedule %d (%s): %s", cronJob.id, cronJob.name, cronJob.pausedReason);
        return cronJob;
    }

    /**
     * Unpauses, clears the failure streak and schedules the next occurrence after {@code now}.
     */
    @Transactional
    public CronJob resume(String tenantId, Long cronJobId, Instant now) {
        CronJob cronJob = get(tenantId, cronJobId);
        cronJob.paused = false;
        cronJob.pausedReason = null;
        cronJob.consecutiveFailures = 0;
        cronJob.nextRunAt = CronSchedulerService.computeNextRun(cronJob.cronExpression, cronJob.timezone, now);
        cronJob.updatedAt = now;
        LOG.infof("Resumed schedule %d (%s), next run %s", cronJob.id, cronJob.name, cronJob.nextRunAt);
        return cronJob;
    }

    /**
     * Fires the schedule now, recorded with {@code triggered_by=MANUAL}. Not transactional: inline handlers run outside
     * the caller's transaction.
     */
    public CronJobExecution execute(String tenantId, Long cronJobId, Instant now) {
        CronJob cronJob = QuarkusTransaction.requiringNew().call(() -> get(tenantId, cronJobId));
        if (!cronJob.active) {
            throw new ValidationException("Cron job " + cronJobId + " is not active", true);
        }
        Long executionId = scheduler.executeNow(cronJobId, now);
        return QuarkusTransaction.requiringNew().call(() -> CronJobExecution.<CronJobExecution>findById(executionId));
    }

    @Transactional
    public Page<CronJobExecution> executions(String tenantId, Long cronJobId, int page, int size) {
        validatePaging(page, size);
        get(tenantId, cronJobId);
        return new Page<>(CronJobExecution.findByCronJob(cronJobId, page, size),
                CronJobExecution.countByCronJob(cronJobId), page, size);
    }

    private void validateJobType(String jobType, boolean tenantRequest) {
        if (jobType == null || jobType.isBlank()) {
            throw new ScheduleMisconfiguredException("job_type is required");
        }
        if (tenantRequest && jobType.startsWith(JobQueueService.SYSTEM_TYPE_PREFIX)) {
            throw new TenantAccessException("Job type '" + jobType + "' is reserved for system schedules");
        }
        if (!registry.isRegistered(jobType)) {
            throw new ScheduleMisconfiguredException("Unknown job type '" + jobType + "'");
        }
    }

    private static String normalizeZone(String timezone) {
        return CronExpression.parseZone(timezone).getId();
    }

    private static SourceType parseSourceType(String value) {
        if (value == null || value.isBlank()) {
            return SourceType.USER;
        }
        try {
            return SourceType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown source_type '" + value + "'");
        }
    }

    private int validateMaxRetries(Integer maxRetries) {
        int value = maxRetries == null ? defaultMaxRetries : maxRetries;
        if (value < 0 || value > MAX_RETRIES_LIMIT) {
            throw new ValidationException("max_retries must be between 0 and " + MAX_RETRIES_LIMIT);
        }
        return value;
    }

    private static Integer validateMaxRuns(Integer maxRuns) {
        if (maxRuns != null && maxRuns < 1) {
            throw new ValidationException("max_runs must be at least 1");
        }
        return maxRuns;
    }

    private int validateMaxFailures(Integer maxFailures) {
        int value = maxFailures == null ? defaultMaxFailures : maxFailures;
        if (value < 1) {
            throw new ValidationException("max_failures must be at least 1");
        }
        return value;
    }

    private static void validatePaging(int page, int size) {
        if (page < 0 || size < 1 || size > 200) {
            throw new ValidationException("page must be >= 0 and size between 1 and 200");
        }
    }
}

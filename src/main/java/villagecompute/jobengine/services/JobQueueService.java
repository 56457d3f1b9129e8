package villagecompute.jobengine.services;

import io.opentelemetry.api.trace.Span;
import io.quarkus.hibernate.orm.panache.PanacheQuery;
import io.quarkus.panache.common.Page;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import jakarta.persistence.LockModeType;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.data.models.Job.JobStatus;
import villagecompute.jobengine.data.models.JobAttempt;
import villagecompute.jobengine.exceptions.HandlerNotFoundException;
import villagecompute.jobengine.exceptions.ResourceNotFoundException;
import villagecompute.jobengine.exceptions.TenantAccessException;
import villagecompute.jobengine.exceptions.ValidationException;
import villagecompute.jobengine.jobs.EnqueueOptions;
import villagecompute.jobengine.jobs.JobEnqueuedEvent;
import villagecompute.jobengine.jobs.JobPriority;
import villagecompute.jobengine.jobs.JobTypeRegistry;
import villagecompute.jobengine.observability.JobEngineMetrics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Producer- and tenant-facing job operations: enqueue, status polling, listing and cancellation.
 *
 * <p>
 * {@link #enqueue} commits the PENDING row before returning, so a job survives any crash after the call. A
 * {@link JobEnqueuedEvent} is fired in the same transaction; the worker pool observes it after commit to poll early,
 * but correctness never depends on it.
 *
 * <p>
 * All reads are scoped to a tenant: a job belonging to another tenant is reported as not found.
 *
 * @see JobRecordStore for worker-side transitions
 */
@ApplicationScoped
public class JobQueueService {

    private static final Logger LOG = Logger.getLogger(JobQueueService.class);

    public static final String SYSTEM_TYPE_PREFIX = "system:";

    static final String INITIATOR_API = "api";

    static final int MAX_RETRIES_LIMIT = 25;

    @Inject
    JobTypeRegistry registry;

    @Inject
    Event<JobEnqueuedEvent> enqueuedEvents;

    @Inject
    ScheduleOutcomeRecorder outcomes;

    @Inject
    JobEngineMetrics metrics;

    @ConfigProperty(
            name = "jobengine.jobs.default-max-retries",
            defaultValue = "3")
    int defaultMaxRetries;

    /**
     * Page of jobs plus the total match count.
     */
    public record JobPage(List<Job> items, long total, int page, int size) {
    }

    /**
     * Enqueues a job on behalf of a tenant request. Platform job types are refused.
     *
     * @throws TenantAccessException
     *             for {@code system:} types
     * @throws HandlerNotFoundException
     *             for unknown types
     */
    @Transactional
    public Job submit(String tenantId, String jobType, Map<String, Object> payload, EnqueueOptions options) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new TenantAccessException("Tenant context is required");
        }
        if (jobType != null && jobType.startsWith(SYSTEM_TYPE_PREFIX)) {
            throw new TenantAccessException("Job type '" + jobType + "' is reserved for the platform");
        }
        EnqueueOptions effective = options == null ? EnqueueOptions.defaults() : options;
        return enqueue(tenantId, jobType, payload, effective.withMetadata(callerMetadata(effective.metadata())),
                Instant.now());
    }

    @Transactional
    public Job enqueue(String tenantId, String jobType, Map<String, Object> payload, EnqueueOptions options) {
        return enqueue(tenantId, jobType, payload, options, Instant.now());
    }

    /**
     * Persists a new PENDING job.
     *
     * @param now
     *            creation time; the job becomes dispatchable at {@code now + delay}
     * @throws HandlerNotFoundException
     *             if no handler is registered for {@code jobType}
     * @throws ValidationException
     *             if the retry budget or delay is out of range
     */
    @Transactional
    public Job enqueue(String tenantId, String jobType, Map<String, Object> payload, EnqueueOptions options,
            Instant now) {
        if (!registry.isRegistered(jobType)) {
            throw new HandlerNotFoundException(jobType);
        }
        EnqueueOptions effective = options == null ? EnqueueOptions.defaults() : options;
        int maxRetries = effective.maxRetries() == null ? defaultMaxRetries : effective.maxRetries();
        if (maxRetries < 0 || maxRetries > MAX_RETRIES_LIMIT) {
            throw new ValidationException("maxRetries must be between 0 and " + MAX_RETRIES_LIMIT);
        }
        if (effective.delay() != null && effective.delay().isNegative()) {
            throw new ValidationException("delay must not be negative");
        }
        JobPriority priority = effective.priority() == null ? JobPriority.NORMAL : effective.priority();
        Instant notBefore = effective.delay() == null ? now : now.plus(effective.delay());

        Job job = Job.create(tenantId, jobType, payload, priority, maxRetries, effective.metadata(), now, notBefore);

        Span.current().setAttribute("job.id", job.id).setAttribute("job.type", jobType);
        LOG.infof("Enqueued job %d (type: %s, tenant: %s, priority: %s, max retries: %d)", job.id, jobType, tenantId,
                priority, maxRetries);
        enqueuedEvents.fire(new JobEnqueuedEvent(job.id, tenantId, jobType, priority));
        return job;
    }

    /**
     * Single primary-key read for status polling.
     *
     * @throws ResourceNotFoundException
     *             if the job does not exist for this tenant
     */
    @Transactional
    public Job getStatus(String tenantId, Long jobId) {
        return Job.findByIdForTenant(jobId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Job not found: " + jobId));
    }

    @Transactional
    public Job getJob(String tenantId, Long jobId) {
        return getStatus(tenantId, jobId);
    }

    /**
     * Lists a tenant's jobs, newest first, optionally filtered by status and type.
     */
    @Transactional
    public JobPage list(String tenantId, JobStatus status, String jobType, int page, int size) {
        if (page < 0 || size < 1 || size > 200) {
            throw new ValidationException("page must be >= 0 and size between 1 and 200");
        }
        StringBuilder query = new StringBuilder("tenantId = ?1");
        List<Object> params = new ArrayList<>();
        params.add(tenantId);
        if (status != null) {
            params.add(status);
            query.append(" AND status = ?").append(params.size());
        }
        if (jobType != null && !jobType.isBlank()) {
            params.add(jobType);
            query.append(" AND jobType = ?").append(params.size());
        }
        PanacheQuery<Job> found = Job.find(query + " ORDER BY createdAt DESC, id DESC", params.toArray());
        long total = found.count();
        List<Job> items = found.page(Page.of(page, size)).list();
        return new JobPage(items, total, page, size);
    }

    /**
     * Every finished attempt of a tenant's job, oldest first.
     *
     * @throws ResourceNotFoundException
     *             if the job does not exist for this tenant
     */
    @Transactional
    public List<JobAttempt> history(String tenantId, Long jobId) {
        getStatus(tenantId, jobId);
        return JobAttempt.findByJob(jobId);
    }

    /**
     * A tenant's most recent attempts across all jobs, newest first.
     */
    @Transactional
    public List<JobAttempt> recentActivity(String tenantId, int limit) {
        if (limit < 1 || limit > 200) {
            throw new ValidationException("limit must be between 1 and 200");
        }
        return JobAttempt.findRecentByTenant(tenantId, limit);
    }

    /**
     * Cancels a job.
     *
     * <p>
     * PENDING and RETRYING jobs become CANCELLED immediately. RUNNING jobs get {@code cancel_requested}; the handler
     * stops at its next cancellation check. Terminal jobs cannot be cancelled.
     *
     * @throws ValidationException
     *             (conflict) if the job already finished
     */
    @Transactional
    public Job cancel(String tenantId, Long jobId, Instant now) {
        Job job = getStatus(tenantId, jobId);
        Job.getEntityManager().refresh(job, LockModeType.PESSIMISTIC_WRITE);

        switch (job.status) {
            case PENDING, RETRYING -> {
                job.status = JobStatus.CANCELLED;
                job.cancelRequested = true;
                job.finishedAt = now;
                job.updatedAt = now;
                LOG.infof("Cancelled job %d (type: %s) before execution", job.id, job.jobType);
                metrics.recordFailed(job.jobType, "cancelled", null);
                outcomes.recordJobOutcome(job, now);
            }
            case RUNNING -> {
                job.cancelRequested = true;
                job.updatedAt = now;
                LOG.infof("Requested cancellation of running job %d (type: %s)", job.id, job.jobType);
            }
            default -> throw new ValidationException("Job " + jobId + " already finished with status " + job.status,
                    true);
        }
        return job;
    }

    /**
     * Drops keys the engine owns from caller-supplied metadata and tags the job as API-initiated.
     */
    static Map<String, Object> callerMetadata(Map<String, Object> metadata) {
        Map<String, Object> cleaned = new HashMap<>();
        if (metadata != null) {
            metadata.forEach((key, value) -> {
                if (!key.equals(Job.META_CRON_JOB_ID) && !key.equals(Job.META_CRON_EXECUTION_ID)
                        && !key.startsWith(Job.META_CHECKPOINT_PREFIX)) {
                    cleaned.put(key, value);
                }
            });
        }
        cleaned.put(Job.META_INITIATED_BY, INITIATOR_API);
        return cleaned;
    }

    @Transactional
    public Map<JobStatus, Long> countByStatus(String tenantId) {
        return Job.countByStatus(tenantId);
    }
}

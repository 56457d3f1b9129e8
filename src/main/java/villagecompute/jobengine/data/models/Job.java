package villagecompute.jobengine.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jboss.logging.Logger;
import villagecompute.jobengine.jobs.JobPriority;

import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Panache entity for one unit of asynchronous work, the durable record behind the worker pool.
 *
 * <p>
 * The row is the sole source of truth: once {@code enqueue} commits it, the job exists independently of any worker
 * process. Workers only ever mutate a row through the conditional updates below, each of which names the status (and,
 * while running, the claiming worker) it expects, so two processes can never both own a job.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (BIGSERIAL, PK) - Primary identifier</li>
 * <li>{@code tenant_id} (TEXT) - Owning tenant; null only for platform jobs produced by system schedules</li>
 * <li>{@code job_type} (TEXT) - Registry key, e.g. {@code catalog:import}</li>
 * <li>{@code priority} / {@code priority_rank} - Tier name and its dispatch rank (urgent=1 ... low=10)</li>
 * <li>{@code payload} (JSONB) - Handler parameters</li>
 * <li>{@code status} (TEXT) - PENDING, RUNNING, RETRYING, COMPLETED, FAILED, CANCELLED</li>
 * <li>{@code progress} / {@code progress_message} - Last reported progress</li>
 * <li>{@code attempt_count} / {@code max_retries} - Failed attempts so far and the retry budget</li>
 * <li>{@code next_attempt_at} - Earliest dispatch time (enqueue delay or retry backoff)</li>
 * <li>{@code heartbeat_at} - Last claim or progress write; watched by the reaper</li>
 * <li>{@code locked_by} - Worker identifier (hostname:pid:thread) holding the claim</li>
 * <li>{@code result} / {@code error} / {@code error_class} - Outcome of the last attempt</li>
 * <li>{@code metadata} (JSONB) - Initiator, correlation id, schedule linkage, checkpoints</li>
 * <li>{@code cancel_requested} - Cooperative cancellation flag</li>
 * </ul>
 *
 * @see villagecompute.jobengine.services.JobQueueService for tenant-facing operations
 * @see villagecompute.jobengine.services.JobRecordStore for worker-facing conditional writes
 */
@Entity
@Table(
        name = "jobs",
        indexes = {@Index(
                name = "idx_jobs_dispatch",
                columnList = "status, priority_rank, created_at"),
                @Index(
                        name = "idx_jobs_tenant_status",
                        columnList = "tenant_id, status")})
public class Job extends PanacheEntityBase {

    private static final Logger LOG = Logger.getLogger(Job.class);

    public static final String META_INITIATED_BY = "initiated_by";
    public static final String META_CORRELATION_ID = "correlation_id";
    public static final String META_CRON_JOB_ID = "cron_job_id";
    public static final String META_CRON_EXECUTION_ID = "cron_execution_id";
    public static final String META_CHECKPOINT_PREFIX = "checkpoint.";

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "tenant_id")
    public String tenantId;

    @Column(
            name = "job_type",
            nullable = false)
    public String jobType;

    @Column(
            name = "priority",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobPriority priority;

    @Column(
            name = "priority_rank",
            nullable = false)
    public int priorityRank;

    @Column(
            name = "payload")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> payload;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobStatus status;

    @Column(
            name = "progress",
            nullable = false)
    public int progress;

    @Column(
            name = "progress_message")
    public String progressMessage;

    @Column(
            name = "attempt_count",
            nullable = false)
    public int attemptCount;

    @Column(
            name = "max_retries",
            nullable = false)
    public int maxRetries;

    @Column(
            name = "next_attempt_at",
            nullable = false)
    public Instant nextAttemptAt;

    @Column(
            name = "heartbeat_at")
    public Instant heartbeatAt;

    @Column(
            name = "locked_by")
    public String lockedBy;

    @Column(
            name = "cancel_requested",
            nullable = false)
    public boolean cancelRequested;

    @Column(
            name = "result")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> result;

    @Column(
            name = "error",
            length = 4000)
    public String error;

    @Column(
            name = "error_class")
    public String errorClass;

    @Column(
            name = "metadata")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> metadata;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "started_at")
    public Instant startedAt;

    @Column(
            name = "finished_at")
    public Instant finishedAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Job lifecycle statuses.
     */
    public enum JobStatus {
        /**
         * Created or re-queued, waiting for {@code next_attempt_at}.
         */
        PENDING,

        /**
         * Claimed and executing on exactly one worker.
         */
        RUNNING,

        /**
         * Failed transiently, waiting out the backoff delay before returning to PENDING.
         */
        RETRYING,

        /**
         * Handler returned successfully.
         */
        COMPLETED,

        /**
         * Permanent failure or retry budget exhausted.
         */
        FAILED,

        /**
         * Cancelled before or during execution.
         */
        CANCELLED;

        /**
         * Returns true for states that no worker or scheduler may move out of.
         */
        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == CANCELLED;
        }
    }

    /**
     * Builds and persists a new PENDING job. Caller must hold a transaction.
     */
    public static Job create(String tenantId, String jobType, Map<String, Object> payload, JobPriority priority,
            int maxRetries, Map<String, Object> metadata, Instant now, Instant notBefore) {
        Job job = new Job();
        job.tenantId = tenantId;
        job.jobType = jobType;
        job.payload = payload == null ? new HashMap<>() : new HashMap<>(payload);
        job.priority = priority;
        job.priorityRank = priority.getRank();
        job.status = JobStatus.PENDING;
        job.progress = 0;
        job.attemptCount = 0;
        job.maxRetries = maxRetries;
        job.metadata = metadata == null ? new HashMap<>() : new HashMap<>(metadata);
        job.createdAt = now;
        job.updatedAt = now;
        job.nextAttemptAt = notBefore == null || notBefore.isBefore(now) ? now : notBefore;

        job.persist();
        LOG.debugf("Created job %d (type: %s, tenant: %s, priority: %s)", job.id, jobType, tenantId, priority);
        return job;
    }

    /**
     * Builds an unsaved job used to hand an inline schedule firing to a handler. Never persisted.
     */
    public static Job inline(String tenantId, String jobType, Map<String, Object> payload,
            Map<String, Object> metadata, Instant now) {
        Job job = new Job();
        job.tenantId = tenantId;
        job.jobType = jobType;
        job.payload = payload == null ? Map.of() : payload;
        job.metadata = metadata == null ? Map.of() : metadata;
        job.priority = JobPriority.NORMAL;
        job.priorityRank = JobPriority.NORMAL.getRank();
        job.status = JobStatus.RUNNING;
        job.createdAt = now;
        job.startedAt = now;
        job.updatedAt = now;
        job.nextAttemptAt = now;
        return job;
    }

    /**
     * Finds pending jobs that are due, in dispatch order: priority rank ascending, then FIFO.
     *
     * @param now
     *            dispatch time; jobs delayed or backing off past it are skipped
     * @param limit
     *            max rows to return
     */
    public static List<Job> findDispatchCandidates(Instant now, int limit) {
        return find("status = ?1 AND nextAttemptAt <= ?2 ORDER BY priorityRank ASC, createdAt ASC, id ASC",
                JobStatus.PENDING, now).page(0, limit).list();
    }

    /**
     * Looks up a job visible to {@code tenantId}.
     */
    public static Optional<Job> findByIdForTenant(Long id, String tenantId) {
        return find("id = ?1 AND tenantId = ?2", id, tenantId).firstResultOptional();
    }

    /**
     * Atomic single-claim: moves the row PENDING -> RUNNING only if it is still PENDING.
     *
     * @return 1 if this caller won the claim, 0 if another worker (or a cancel) got there first
     */
    public static int claim(Long id, String workerId, Instant now) {
        return update(
                "status = ?1, startedAt = ?2, heartbeatAt = ?2, lockedBy = ?3, updatedAt = ?2 "
                        + "WHERE id = ?4 AND status = ?5 AND cancelRequested = false",
                JobStatus.RUNNING, now, workerId, id, JobStatus.PENDING);
    }

    /**
     * Moves every RETRYING job whose backoff has elapsed back to PENDING.
     *
     * @return number of re-queued jobs
     */
    public static int requeueDueRetries(Instant now) {
        return update("status = ?1, updatedAt = ?2 WHERE status = ?3 AND nextAttemptAt <= ?2", JobStatus.PENDING, now,
                JobStatus.RETRYING);
    }

    /**
     * Finds RUNNING jobs whose worker has not written a heartbeat since {@code threshold}.
     */
    public static List<Job> findStaleRunning(Instant threshold) {
        return find("status = ?1 AND heartbeatAt < ?2 ORDER BY heartbeatAt ASC", JobStatus.RUNNING, threshold).list();
    }

    /**
     * Finds finished jobs whose schedule execution is still ENQUEUED.
     */
    public static List<Job> findFinishedWithOpenExecution(int limit) {
        return find("status IN ?1 AND id IN (SELECT e.jobId FROM CronJobExecution e WHERE e.status = ?2) ORDER BY id",
                List.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED),
                CronJobExecution.ExecutionStatus.ENQUEUED).range(0, limit - 1).list();
    }

    /**
     * Counts a tenant's jobs grouped by status. Statuses with no rows are reported as zero.
     */
    public static Map<JobStatus, Long> countByStatus(String tenantId) {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        List<Object[]> rows = getEntityManager()
                .createQuery("SELECT j.status, COUNT(j) FROM Job j WHERE j.tenantId = ?1 GROUP BY j.status",
                        Object[].class)
                .setParameter(1, tenantId).getResultList();
        for (Object[] row : rows) {
            counts.put((JobStatus) row[0], (Long) row[1]);
        }
        return counts;
    }

    /**
     * Type, status and timing of a tenant's jobs created at or after {@code since}. Rows are
     * {@code [jobType, status, startedAt, finishedAt]}.
     */
    public static List<Object[]> findStatsRows(String tenantId, Instant since) {
        return getEntityManager()
                .createQuery("SELECT j.jobType, j.status, j.startedAt, j.finishedAt FROM Job j"
                        + " WHERE j.tenantId = ?1 AND j.createdAt >= ?2", Object[].class)
                .setParameter(1, tenantId).setParameter(2, since).getResultList();
    }

    /**
     * Deletes terminal jobs that finished before {@code cutoff}.
     *
     * @return number of rows deleted
     */
    public static long deleteFinishedBefore(Instant cutoff) {
        return delete("status IN ?1 AND finishedAt < ?2",
                List.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED), cutoff);
    }

    /**
     * Counts all jobs in a status across tenants. Backs the backlog gauges.
     */
    public static long countInStatus(JobStatus status) {
        return count("status", status);
    }

    /**
     * Returns the schedule id stored in metadata by the scheduler tick, if this job was produced by a schedule.
     */
    public Optional<Long> cronJobId() {
        return metadataLong(META_CRON_JOB_ID);
    }

    /**
     * Returns the execution row id stored in metadata by the scheduler tick.
     */
    public Optional<Long> cronExecutionId() {
        return metadataLong(META_CRON_EXECUTION_ID);
    }

    private Optional<Long> metadataLong(String key) {
        if (metadata == null) {
            return Optional.empty();
        }
        Object value = metadata.get(key);
        if (value instanceof Number number) {
            return Optional.of(number.longValue());
        }
        if (value instanceof String text && !text.isBlank()) {
            return Optional.of(Long.parseLong(text));
        }
        return Optional.empty();
    }
}

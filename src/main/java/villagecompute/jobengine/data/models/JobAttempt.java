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

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only record of one execution attempt of a {@link Job}.
 *
 * <p>
 * The job row only keeps the outcome of its latest attempt; every finished attempt (completed, failed, cancelled or
 * reclaimed after a lost heartbeat) also lands here so the full history of a retried job stays visible. Rows are
 * written in the transaction that records the outcome on the job and are never updated.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (BIGSERIAL, PK) - Primary identifier</li>
 * <li>{@code job_id} (BIGINT) - Job the attempt belongs to</li>
 * <li>{@code tenant_id} (TEXT) - Copied from the job so activity feeds need no join</li>
 * <li>{@code attempt_number} (INT) - 1-based attempt counter</li>
 * <li>{@code outcome} (TEXT) - COMPLETED, FAILED, CANCELLED, HEARTBEAT_LOST</li>
 * <li>{@code result} (JSONB) / {@code error} / {@code error_class} - What the attempt produced</li>
 * <li>{@code started_at} / {@code finished_at} / {@code duration_ms} - Attempt timing</li>
 * </ul>
 */
@Entity
@Table(
        name = "job_attempts",
        indexes = {@Index(
                name = "idx_job_attempts_job",
                columnList = "job_id, finished_at"),
                @Index(
                        name = "idx_job_attempts_tenant",
                        columnList = "tenant_id, finished_at")})
public class JobAttempt extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "job_id",
            nullable = false)
    public Long jobId;

    @Column(
            name = "tenant_id")
    public String tenantId;

    @Column(
            name = "job_type",
            nullable = false)
    public String jobType;

    @Column(
            name = "attempt_number",
            nullable = false)
    public int attemptNumber;

    @Column(
            name = "outcome",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public Outcome outcome;

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
            name = "worker_id")
    public String workerId;

    @Column(
            name = "started_at")
    public Instant startedAt;

    @Column(
            name = "finished_at",
            nullable = false)
    public Instant finishedAt;

    @Column(
            name = "duration_ms")
    public Long durationMs;

    /**
     * How an attempt ended.
     */
    public enum Outcome {
        COMPLETED, FAILED, CANCELLED,

        /**
         * The worker stopped heartbeating and the reaper reclaimed the job.
         */
        HEARTBEAT_LOST
    }

    /**
     * Appends an attempt row from the job's current outcome fields. Caller must hold a transaction, and must call this
     * before clearing {@code lockedBy} on the job.
     */
    public static JobAttempt record(Job job, int attemptNumber, Outcome outcome, Instant now) {
        JobAttempt attempt = new JobAttempt();
        attempt.jobId = job.id;
        attempt.tenantId = job.tenantId;
        attempt.jobType = job.jobType;
        attempt.attemptNumber = attemptNumber;
        attempt.outcome = outcome;
        attempt.result = job.result == null ? null : new HashMap<>(job.result);
        attempt.error = job.error;
        attempt.errorClass = job.errorClass;
        attempt.workerId = job.lockedBy;
        attempt.startedAt = job.startedAt;
        attempt.finishedAt = now;
        attempt.durationMs = job.startedAt == null ? null : Duration.between(job.startedAt, now).toMillis();
        attempt.persist();
        return attempt;
    }

    /**
     * All attempts of a job, oldest first.
     */
    public static List<JobAttempt> findByJob(Long jobId) {
        return find("jobId = ?1 ORDER BY finishedAt ASC, id ASC", jobId).list();
    }

    /**
     * A tenant's most recent attempts across all jobs, newest first.
     */
    public static List<JobAttempt> findRecentByTenant(String tenantId, int limit) {
        return find("tenantId = ?1 ORDER BY finishedAt DESC, id DESC", tenantId).page(0, limit).list();
    }

    /**
     * Deletes attempts that finished before {@code cutoff}.
     *
     * @return number of rows deleted
     */
    public static long deleteFinishedBefore(Instant cutoff) {
        return delete("finishedAt < ?1", cutoff);
    }
}

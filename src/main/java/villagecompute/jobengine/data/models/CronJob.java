package villagecompute.jobengine.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Page;
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
import villagecompute.jobengine.jobs.JobPriority;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Panache entity for a recurring (or one-time) schedule that produces jobs on a cron cadence.
 *
 * <p>
 * {@code next_run_at} is advanced by the scheduler tick with a conditional update keyed on the old value, so redundant
 * ticks cannot fire the same slot twice. Rows are never hard-deleted while executions reference them; deletion through
 * the API deactivates.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code tenant_id} - Owning tenant, null for system-wide schedules</li>
 * <li>{@code cron_expression} / {@code timezone} - Five-field expression evaluated in the IANA zone</li>
 * <li>{@code job_type} / {@code configuration} - Handler key and payload handed to each firing</li>
 * <li>{@code source_type} / {@code source_id} - Which subsystem owns the schedule</li>
 * <li>{@code is_active} / {@code is_paused} / {@code is_system} - Lifecycle flags</li>
 * <li>{@code run_count}, {@code success_count}, {@code failure_count}, {@code consecutive_failures} - Statistics</li>
 * <li>{@code max_runs}, {@code max_failures}, {@code one_time} - Deactivation and auto-pause thresholds</li>
 * </ul>
 */
@Entity
@Table(
        name = "cron_jobs",
        indexes = {@Index(
                name = "idx_cron_jobs_due",
                columnList = "is_active, next_run_at"),
                @Index(
                        name = "idx_cron_jobs_tenant",
                        columnList = "tenant_id")})
public class CronJob extends PanacheEntityBase {

    public static final int DEFAULT_MAX_FAILURES = 5;

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
            nullable = false)
    public String name;

    @Column(
            length = 2000)
    public String description;

    @Column(
            name = "cron_expression",
            nullable = false)
    public String cronExpression;

    @Column(
            nullable = false)
    public String timezone;

    @Column(
            name = "job_type",
            nullable = false)
    public String jobType;

    @Column(
            name = "configuration")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> configuration;

    @Column(
            name = "source_type",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public SourceType sourceType;

    @Column(
            name = "source_id")
    public String sourceId;

    @Column(
            name = "is_active",
            nullable = false)
    public boolean active;

    @Column(
            name = "is_paused",
            nullable = false)
    public boolean paused;

    @Column(
            name = "paused_reason")
    public String pausedReason;

    @Column(
            name = "is_system",
            nullable = false)
    public boolean system;

    @Column(
            name = "one_time",
            nullable = false)
    public boolean oneTime;

    @Column(
            name = "priority",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobPriority priority;

    @Column(
            name = "max_retries",
            nullable = false)
    public int maxRetries;

    @Column(
            name = "max_runs")
    public Integer maxRuns;

    @Column(
            name = "max_failures",
            nullable = false)
    public int maxFailures;

    @Column(
            name = "last_run_at")
    public Instant lastRunAt;

    @Column(
            name = "next_run_at")
    public Instant nextRunAt;

    @Column(
            name = "run_count",
            nullable = false)
    public long runCount;

    @Column(
            name = "success_count",
            nullable = false)
    public long successCount;

    @Column(
            name = "failure_count",
            nullable = false)
    public long failureCount;

    @Column(
            name = "consecutive_failures",
            nullable = false)
    public int consecutiveFailures;

    @Column(
            name = "last_status")
    public String lastStatus;

    @Column(
            name = "last_error",
            length = 4000)
    public String lastError;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Subsystem that owns a schedule.
     */
    public enum SourceType {
        SYSTEM, INTEGRATION, PLUGIN, USER
    }

    /**
     * Active schedules due at {@code now}, oldest slot first. Paused schedules are included so the tick can advance
     * them.
     */
    public static List<CronJob> findDue(Instant now) {
        return find("active = true AND nextRunAt IS NOT NULL AND nextRunAt <= ?1 ORDER BY nextRunAt ASC, id ASC", now)
                .list();
    }

    public static Optional<CronJob> findByIdForTenant(Long id, String tenantId) {
        return find("id = ?1 AND tenantId = ?2", id, tenantId).firstResultOptional();
    }

    public static List<CronJob> findByTenant(String tenantId, int page, int size) {
        return find("tenantId = ?1 ORDER BY id ASC", tenantId).page(Page.of(page, size)).list();
    }

    public static List<CronJob> listByTenant(String tenantId) {
        return list("tenantId", tenantId);
    }

    public static long countByTenant(String tenantId) {
        return count("tenantId", tenantId);
    }

    /**
     * System schedule with the given job type, used to make bootstrap idempotent.
     */
    public static Optional<CronJob> findSystemByJobType(String jobType) {
        return find("system = true AND jobType = ?1", jobType).firstResultOptional();
    }

    public static List<CronJob> findAllActive() {
        return list("active", true);
    }

    /**
     * Moves {@code next_run_at} forward only if it still holds the value this caller read.
     *
     * @return 1 if this caller owns the slot, 0 if a concurrent tick already advanced it
     */
    public static int advanceNextRun(Long id, Instant expectedNextRunAt, Instant newNextRunAt, Instant now) {
        return update("nextRunAt = ?1, updatedAt = ?2 WHERE id = ?3 AND nextRunAt = ?4", newNextRunAt, now, id,
                expectedNextRunAt);
    }
}

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

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One firing of a {@link CronJob}. Created in RUNNING before dispatch and closed exactly once.
 *
 * <p>
 * Inline firings are closed by the tick itself. Queued firings move to ENQUEUED with {@code job_id} set and are closed
 * when that job reaches a terminal state.
 */
@Entity
@Table(
        name = "cron_job_executions",
        indexes = {@Index(
                name = "idx_cron_exec_cron_job",
                columnList = "cron_job_id, started_at"),
                @Index(
                        name = "idx_cron_exec_job",
                        columnList = "job_id")})
public class CronJobExecution extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "cron_job_id",
            nullable = false)
    public Long cronJobId;

    @Column(
            name = "tenant_id")
    public String tenantId;

    @Column(
            name = "started_at",
            nullable = false)
    public Instant startedAt;

    @Column(
            name = "finished_at")
    public Instant finishedAt;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public ExecutionStatus status;

    @Column(
            name = "output")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> output;

    @Column(
            name = "error",
            length = 4000)
    public String error;

    @Column(
            name = "duration_ms")
    public Long durationMs;

    @Column(
            name = "job_id")
    public Long jobId;

    @Column(
            name = "triggered_by",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public TriggeredBy triggeredBy;

    @Column(
            name = "server_instance")
    public String serverInstance;

    public enum ExecutionStatus {
        RUNNING, ENQUEUED, SUCCESS, FAILED;

        public boolean isOpen() {
            return this == RUNNING || this == ENQUEUED;
        }
    }

    public enum TriggeredBy {
        SCHEDULER, MANUAL
    }

    public static CronJobExecution start(CronJob cronJob, TriggeredBy triggeredBy, String serverInstance,
            Instant now) {
        CronJobExecution execution = new CronJobExecution();
        execution.cronJobId = cronJob.id;
        execution.tenantId = cronJob.tenantId;
        execution.startedAt = now;
        execution.status = ExecutionStatus.RUNNING;
        execution.triggeredBy = triggeredBy;
        execution.serverInstance = serverInstance;
        execution.persist();
        return execution;
    }

    public static List<CronJobExecution> findByCronJob(Long cronJobId, int page, int size) {
        return find("cronJobId = ?1 ORDER BY startedAt DESC, id DESC", cronJobId).page(Page.of(page, size)).list();
    }

    public static long countByCronJob(Long cronJobId) {
        return count("cronJobId", cronJobId);
    }

    /**
     * Purges closed executions older than the cutoff.
     */
    public static long deleteClosedBefore(Instant cutoff) {
        return delete("finishedAt IS NOT NULL AND finishedAt < ?1", cutoff);
    }
}

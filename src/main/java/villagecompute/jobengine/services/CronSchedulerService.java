package villagecompute.jobengine.services;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.LockModeType;
import org.jboss.logging.Logger;
import villagecompute.jobengine.api.types.TickSummaryType;
import villagecompute.jobengine.data.models.CronJob;
import villagecompute.jobengine.data.models.CronJobExecution;
import villagecompute.jobengine.data.models.CronJobExecution.ExecutionStatus;
import villagecompute.jobengine.data.models.CronJobExecution.TriggeredBy;
import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.exceptions.ScheduleMisconfiguredException;
import villagecompute.jobengine.exceptions.ValidationException;
import villagecompute.jobengine.jobs.EnqueueOptions;
import villagecompute.jobengine.jobs.ExecutionMode;
import villagecompute.jobengine.jobs.InlineJobContext;
import villagecompute.jobengine.jobs.JobHandler;
import villagecompute.jobengine.jobs.JobTypeRegistry;
import villagecompute.jobengine.observability.JobEngineMetrics;
import villagecompute.jobengine.observability.LoggingConfig;
import villagecompute.jobengine.scheduling.CronExpression;
import villagecompute.jobengine.tenancy.TenantContext;
import villagecompute.jobengine.util.ServerInstance;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The scheduler tick: turns due schedules into inline executions or queued jobs.
 *
 * <p>
 * {@link #tick(Instant)} is idempotent and safe to invoke redundantly or concurrently. It is driven by the external
 * trigger endpoint and, optionally, by an in-process timer.
 *
 * <p>
 * <b>Per-tick flow:</b>
 * <ol>
 * <li>Load active schedules with {@code next_run_at <= now} across all tenants and group them per tenant</li>
 * <li>Take the tenant's tick lease; skip the tenant if another tick holds it</li>
 * <li>For each schedule, advance {@code next_run_at} with a conditional update on the value read. Losing that update
 * means another tick owns the slot</li>
 * <li>Paused schedules stop there. Others get an execution row (RUNNING) before anything runs</li>
 * <li>INLINE handlers run within the tick and the execution is closed immediately; QUEUED handlers get a job whose
 * terminal state later closes the execution</li>
 * </ol>
 *
 * <p>
 * <b>Missed runs are skipped:</b> the new slot is the first occurrence strictly after
 * {@code max(previous next_run_at, now)}, so a tick after downtime fires once, never a backlog.
 */
@ApplicationScoped
public class CronSchedulerService {

    private static final Logger LOG = Logger.getLogger(CronSchedulerService.class);

    static final String INITIATOR_SCHEDULE = "schedule";

    @Inject
    JobTypeRegistry registry;

    @Inject
    JobQueueService jobQueue;

    @Inject
    ScheduleOutcomeRecorder outcomes;

    @Inject
    TickLeaseService leases;

    @Inject
    JobEngineMetrics metrics;

    @Inject
    Tracer tracer;

    /**
     * What a single due schedule turned into.
     */
    public enum FireResult {
        FIRED_INLINE, ENQUEUED, SKIPPED_PAUSED, CONFLICT, INACTIVE, FAILED
    }

    private record Dispatch(FireResult result, Long cronJobId, Long executionId, String tenantId, String jobType,
            Map<String, Object> configuration, JobHandler inlineHandler) {

        static Dispatch of(FireResult result) {
            return new Dispatch(result, null, null, null, null, null, null);
        }
    }

    /**
     * Runs one tick against {@code now}.
     */
    public TickSummaryType tick(Instant now) {
        Span span = tracer.spanBuilder("scheduler.tick").setAttribute("tick.at", now.toString()).startSpan();
        String owner = ServerInstance.id() + ":" + UUID.randomUUID();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setRequestOrigin("tick");

            List<CronJob> due = QuarkusTransaction.requiringNew().call(() -> CronJob.findDue(now));
            Map<String, List<CronJob>> byTenant = new LinkedHashMap<>();
            for (CronJob cronJob : due) {
                byTenant.computeIfAbsent(TenantContext.keyOf(cronJob.tenantId), key -> new ArrayList<>()).add(cronJob);
            }

            int firedInline = 0;
            int enqueued = 0;
            int skippedPaused = 0;
            int conflicts = 0;
            int failed = 0;
            int tenantsProcessed = 0;
            int tenantsLocked = 0;

            for (Map.Entry<String, List<CronJob>> group : byTenant.entrySet()) {
                String tenantKey = group.getKey();
                if (!leases.tryAcquire(tenantKey, owner, now)) {
                    tenantsLocked++;
                    continue;
                }
                tenantsProcessed++;
                try {
                    LoggingConfig.setTenantId(group.getValue().get(0).tenantId);
                    for (CronJob cronJob : group.getValue()) {
                        FireResult result;
                        try {
                            result = fireDue(cronJob.id, cronJob.nextRunAt, now);
                        } catch (RuntimeException e) {
                            LOG.errorf(e, "Failed to fire schedule %d (%s)", cronJob.id, cronJob.name);
                            result = FireResult.FAILED;
                        }
                        switch (result) {
                            case FIRED_INLINE -> firedInline++;
                            case ENQUEUED -> enqueued++;
                            case SKIPPED_PAUSED -> skippedPaused++;
                            case CONFLICT, INACTIVE -> conflicts++;
                            case FAILED -> failed++;
                        }
                    }
                } finally {
                    leases.release(tenantKey, owner, now);
                    LoggingConfig.setCronJobId(null);
                }
            }

            span.setAttribute("tick.due", due.size());
            span.setAttribute("tick.fired_inline", firedInline);
            span.setAttribute("tick.enqueued", enqueued);
            LOG.infof("Scheduler tick at %s: %d due, %d inline, %d enqueued, %d paused, %d conflicts, %d failed", now,
                    due.size(), firedInline, enqueued, skippedPaused, conflicts, failed);

            return new TickSummaryType(now, due.size(), firedInline, enqueued, skippedPaused, conflicts, failed,
                    tenantsProcessed, tenantsLocked);
        } finally {
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    /**
     * Advances one due schedule and dispatches it unless paused.
     *
     * @param expectedNextRunAt
     *            the {@code next_run_at} value the caller read; the advance only succeeds if it is still current
     */
    public FireResult fireDue(Long cronJobId, Instant expectedNextRunAt, Instant now) {
        LoggingConfig.setCronJobId(cronJobId);
        Dispatch dispatch = QuarkusTransaction.requiringNew()
                .call(() -> advanceAndStart(cronJobId, expectedNextRunAt, now));
        if (dispatch.inlineHandler() != null) {
            return runInline(dispatch, now);
        }
        return dispatch.result();
    }

    /**
     * Fires a schedule immediately without touching {@code next_run_at}. Runs even while the schedule is paused.
     *
     * @return id of the execution row created for this firing
     */
    public Long executeNow(Long cronJobId, Instant now) {
        LoggingConfig.setCronJobId(cronJobId);
        try {
            Dispatch dispatch = QuarkusTransaction.requiringNew().call(() -> {
                CronJob cronJob = CronJob.findById(cronJobId, LockModeType.PESSIMISTIC_WRITE);
                if (cronJob == null || !cronJob.active) {
                    throw new ValidationException("Cron job " + cronJobId + " is not active", true);
                }
                cronJob.updatedAt = now;
                countRun(cronJob, now);
                return startExecution(cronJob, TriggeredBy.MANUAL, now);
            });
            if (dispatch.inlineHandler() != null) {
                runInline(dispatch, now);
            }
            LOG.infof("Manually executed schedule %d (execution %d)", cronJobId, dispatch.executionId());
            return dispatch.executionId();
        } finally {
            LoggingConfig.setCronJobId(null);
        }
    }

    /**
     * Earliest occurrence of the schedule's expression strictly after {@code after} in its timezone.
     *
     * @throws ScheduleMisconfiguredException
     *             for an invalid expression or zone, or an expression with no occurrence
     */
    public static Instant computeNextRun(String cronExpression, String timezone, Instant after) {
        return CronExpression.parse(cronExpression).nextAfter(after, CronExpression.parseZone(timezone));
    }

    private Dispatch advanceAndStart(Long cronJobId, Instant expectedNextRunAt, Instant now) {
        CronJob cronJob = CronJob.findById(cronJobId);
        if (cronJob == null || !cronJob.active) {
            return Dispatch.of(FireResult.INACTIVE);
        }

        Instant base = expectedNextRunAt.isAfter(now) ? expectedNextRunAt : now;
        Instant next;
        String misconfiguration = null;
        try {
            next = computeNextRun(cronJob.cronExpression, cronJob.timezone, base);
        } catch (ScheduleMisconfiguredException e) {
            next = null;
            misconfiguration = e.getMessage();
        }

        if (CronJob.advanceNextRun(cronJobId, expectedNextRunAt, next, now) == 0) {
            LOG.debugf("Schedule %d already advanced past %s by another tick", cronJobId, expectedNextRunAt);
            return Dispatch.of(FireResult.CONFLICT);
        }
        // The conditional update holds the row lock; reload to see the latest committed state.
        CronJob.getEntityManager().refresh(cronJob);

        if (misconfiguration != null) {
            cronJob.paused = true;
            cronJob.pausedReason = "Misconfigured: " + misconfiguration;
            cronJob.lastError = misconfiguration;
            cronJob.lastStatus = ExecutionStatus.FAILED.name();
            LOG.errorf("Paused schedule %d (%s): %s", cronJob.id, cronJob.name, misconfiguration);
            return Dispatch.of(FireResult.FAILED);
        }

        if (cronJob.paused) {
            LOG.debugf("Schedule %d is paused; advanced to %s without firing", cronJob.id, next);
            metrics.recordScheduleFired("skipped_paused");
            return Dispatch.of(FireResult.SKIPPED_PAUSED);
        }

        countRun(cronJob, now);
        return startExecution(cronJob, TriggeredBy.SCHEDULER, now);
    }

    /**
     * Counts a firing, scheduled or manual, and deactivates the schedule once it is one-time or has reached
     * {@code max_runs}.
     */
    private static void countRun(CronJob cronJob, Instant now) {
        cronJob.lastRunAt = now;
        cronJob.runCount++;
        if (cronJob.oneTime || (cronJob.maxRuns != null && cronJob.runCount >= cronJob.maxRuns)) {
            cronJob.active = false;
            LOG.infof("Schedule %d (%s) deactivated after %d runs", cronJob.id, cronJob.name, cronJob.runCount);
        }
    }

    private Dispatch startExecution(CronJob cronJob, TriggeredBy triggeredBy, Instant now) {
        CronJobExecution execution = CronJobExecution.start(cronJob, triggeredBy, ServerInstance.id(), now);

        Optional<JobHandler> handler = registry.find(cronJob.jobType);
        if (handler.isEmpty()) {
            outcomes.close(cronJob.id, execution.id, false, null,
                    "No handler registered for job type '" + cronJob.jobType + "'", now);
            return new Dispatch(FireResult.FAILED, cronJob.id, execution.id, cronJob.tenantId, cronJob.jobType, null,
                    null);
        }

        if (handler.get().executionMode() == ExecutionMode.QUEUED) {
            Map<String, Object> metadata = new HashMap<>();
            metadata.put(Job.META_INITIATED_BY, INITIATOR_SCHEDULE);
            metadata.put(Job.META_CRON_JOB_ID, cronJob.id);
            metadata.put(Job.META_CRON_EXECUTION_ID, execution.id);
            Job job = jobQueue.enqueue(cronJob.tenantId, cronJob.jobType, cronJob.configuration,
                    new EnqueueOptions(cronJob.priority, cronJob.maxRetries, metadata, null), now);
            execution.status = ExecutionStatus.ENQUEUED;
            execution.jobId = job.id;
            metrics.recordScheduleFired("enqueued");
            LOG.infof("Schedule %d (%s) enqueued job %d", cronJob.id, cronJob.name, job.id);
            return new Dispatch(FireResult.ENQUEUED, cronJob.id, execution.id, cronJob.tenantId, cronJob.jobType,
                    null, null);
        }

        Map<String, Object> configuration = cronJob.configuration == null ? Map.of()
                : new HashMap<>(cronJob.configuration);
        return new Dispatch(FireResult.FIRED_INLINE, cronJob.id, execution.id, cronJob.tenantId, cronJob.jobType,
                configuration, handler.get());
    }

    private FireResult runInline(Dispatch dispatch, Instant now) {
        Map<String, Object> metadata = Map.of(Job.META_INITIATED_BY, INITIATOR_SCHEDULE, Job.META_CRON_JOB_ID,
                dispatch.cronJobId(), Job.META_CRON_EXECUTION_ID, dispatch.executionId());
        Job inlineJob = Job.inline(dispatch.tenantId(), dispatch.jobType(), dispatch.configuration(), metadata, now);
        long startNanos = System.nanoTime();

        Map<String, Object> output = null;
        String error = null;
        TenantContext.setTenant(dispatch.tenantId());
        try {
            output = dispatch.inlineHandler().execute(inlineJob,
                    new InlineJobContext(dispatch.tenantId(), dispatch.jobType()));
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            error = JobRecordStore.describe(e);
            LOG.warnf(e, "Inline execution of schedule %d (%s) failed", dispatch.cronJobId(), dispatch.jobType());
        } finally {
            TenantContext.clear();
        }

        Instant finishedAt = now.plus(Duration.ofNanos(System.nanoTime() - startNanos));
        outcomes.close(dispatch.cronJobId(), dispatch.executionId(), error == null, output, error, finishedAt);
        return error == null ? FireResult.FIRED_INLINE : FireResult.FAILED;
    }
}

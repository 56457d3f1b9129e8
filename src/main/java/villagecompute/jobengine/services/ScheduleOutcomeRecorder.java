package villagecompute.jobengine.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import jakarta.persistence.LockModeType;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.jobengine.data.models.CronJob;
import villagecompute.jobengine.data.models.CronJobExecution;
import villagecompute.jobengine.data.models.CronJobExecution.ExecutionStatus;
import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.observability.JobEngineMetrics;
import villagecompute.jobengine.scheduling.ScheduleAutoPausedEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Closes schedule executions and folds their outcome into the schedule's statistics.
 *
 * <p>
 * Inline firings are closed by the scheduler tick right after the handler returns; queued firings are closed here when
 * the produced job reaches a terminal state. Both paths share {@link #close}, so statistics, auto-pause and metrics
 * behave identically.
 *
 * <p>
 * <b>Auto-pause:</b> once {@code consecutive_failures} reaches {@code max_failures} the schedule is paused with a
 * reason and a {@link ScheduleAutoPausedEvent} is fired to observers. A success resets the counter.
 */
@ApplicationScoped
public class ScheduleOutcomeRecorder {

    private static final Logger LOG = Logger.getLogger(ScheduleOutcomeRecorder.class);

    static final String CANCELLED_ERROR = "Job cancelled";

    @Inject
    JobEngineMetrics metrics;

    @Inject
    Event<ScheduleAutoPausedEvent> autoPausedEvents;

    /**
     * Closes the execution that produced {@code job}, if any. No-op for jobs not produced by a schedule and for
     * non-terminal jobs.
     *
     * @return true if this call closed an execution
     */
    @Transactional
    public boolean recordJobOutcome(Job job, Instant now) {
        if (job.status == null || !job.status.isTerminal()) {
            return false;
        }
        Optional<Long> cronJobId = job.cronJobId();
        Optional<Long> executionId = job.cronExecutionId();
        if (cronJobId.isEmpty() || executionId.isEmpty()) {
            return false;
        }

        return switch (job.status) {
            case COMPLETED -> close(cronJobId.get(), executionId.get(), true, job.result, null, now);
            case CANCELLED -> close(cronJobId.get(), executionId.get(), false, null, CANCELLED_ERROR, now);
            default -> close(cronJobId.get(), executionId.get(), false, null, job.error, now);
        };
    }

    /**
     * Closes an execution exactly once and updates the schedule.
     *
     * @return true if this call closed the execution, false if it was already closed or is unknown
     */
    @Transactional
    public boolean close(Long cronJobId, Long executionId, boolean success, Map<String, Object> output, String error,
            Instant now) {
        CronJobExecution execution = CronJobExecution.findById(executionId, LockModeType.PESSIMISTIC_WRITE);
        if (execution == null || !execution.status.isOpen()) {
            LOG.debugf("Execution %d of schedule %d already closed", executionId, cronJobId);
            return false;
        }
        execution.status = success ? ExecutionStatus.SUCCESS : ExecutionStatus.FAILED;
        execution.output = output == null ? null : new HashMap<>(output);
        execution.error = error;
        execution.finishedAt = now;
        execution.durationMs = Math.max(0L, Duration.between(execution.startedAt, now).toMillis());

        CronJob cronJob = CronJob.findById(cronJobId, LockModeType.PESSIMISTIC_WRITE);
        if (cronJob == null) {
            LOG.warnf("Schedule %d vanished before execution %d closed", cronJobId, executionId);
            return true;
        }
        applyOutcome(cronJob, success, error, now);
        metrics.recordScheduleFired(success ? "success" : "failure");
        return true;
    }

    private void applyOutcome(CronJob cronJob, boolean success, String error, Instant now) {
        cronJob.updatedAt = now;
        if (success) {
            cronJob.successCount++;
            cronJob.consecutiveFailures = 0;
            cronJob.lastStatus = ExecutionStatus.SUCCESS.name();
            cronJob.lastError = null;
            LOG.debugf("Schedule %d (%s) succeeded", cronJob.id, cronJob.name);
            return;
        }

        cronJob.failureCount++;
        cronJob.lastStatus = ExecutionStatus.FAILED.name();
        cronJob.lastError = error;
        if (CANCELLED_ERROR.equals(error)) {
            LOG.infof("Schedule %d (%s) firing was cancelled", cronJob.id, cronJob.name);
            return;
        }
        cronJob.consecutiveFailures++;
        LOG.warnf("Schedule %d (%s) failed (%d consecutive): %s", cronJob.id, cronJob.name,
                cronJob.consecutiveFailures, error);

        if (!cronJob.paused && cronJob.consecutiveFailures >= cronJob.maxFailures) {
            cronJob.paused = true;
            cronJob.pausedReason = "Auto-paused after " + cronJob.consecutiveFailures + " consecutive failures";
            LOG.errorf("Auto-paused schedule %d (%s, tenant: %s) after %d consecutive failures", cronJob.id,
                    cronJob.name, cronJob.tenantId, cronJob.consecutiveFailures);
            metrics.recordScheduleAutoPaused();
            autoPausedEvents.fire(new ScheduleAutoPausedEvent(cronJob.id, cronJob.tenantId, cronJob.name,
                    cronJob.jobType, cronJob.sourceType.name(), cronJob.sourceId, cronJob.consecutiveFailures, error));
        }
    }
}

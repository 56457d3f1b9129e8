/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.jobengine.jobs;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.data.models.Job.JobStatus;
import villagecompute.jobengine.observability.JobEngineMetrics;
import villagecompute.jobengine.services.JobRecordStore;
import villagecompute.jobengine.services.ScheduleOutcomeRecorder;
import villagecompute.jobengine.services.WorkerPool;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Periodic housekeeping for the job table.
 *
 * <ul>
 * <li><b>Retry requeue:</b> RETRYING jobs whose backoff elapsed go back to PENDING</li>
 * <li><b>Reaper:</b> RUNNING jobs with a heartbeat older than {@code jobengine.worker.heartbeat-timeout-minutes} are
 * reclaimed, on startup and every {@code jobengine.worker.reaper-interval}</li>
 * <li><b>Execution reconcile:</b> ENQUEUED schedule executions whose job already finished are closed, on startup
 * and every {@code jobengine.schedules.reconcile-interval}</li>
 * <li><b>Backlog gauges:</b> pending and running counts pushed to {@link JobEngineMetrics}</li>
 * </ul>
 *
 * <p>
 * Safe to run on every instance at once: each pass is a set of conditional updates against the database.
 */
@ApplicationScoped
public class JobMaintenanceScheduler {

    private static final Logger LOG = Logger.getLogger(JobMaintenanceScheduler.class);

    @Inject
    JobRecordStore store;

    @Inject
    ScheduleOutcomeRecorder outcomes;

    @Inject
    WorkerPool workerPool;

    @Inject
    JobEngineMetrics metrics;

    static final int RECONCILE_BATCH_SIZE = 500;

    @ConfigProperty(
            name = "jobengine.worker.heartbeat-timeout-minutes",
            defaultValue = "10")
    int heartbeatTimeoutMinutes;

    void reapOnStartup(@Observes StartupEvent event) {
        int reaped = reapStaleJobs(Instant.now());
        if (reaped > 0) {
            LOG.infof("Recovered %d jobs orphaned by a previous shutdown", reaped);
        }
        int closed = closeFinishedExecutions(Instant.now());
        if (closed > 0) {
            LOG.infof("Closed %d schedule executions left open by a previous shutdown", closed);
        }
    }

    @Scheduled(
            every = "${jobengine.worker.retry-requeue-interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduleRetryRequeue() {
        int requeued = requeueRetries(Instant.now());
        if (requeued > 0) {
            workerPool.wakeUp();
        }
    }

    @Scheduled(
            every = "${jobengine.worker.reaper-interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduleReaper() {
        if (reapStaleJobs(Instant.now()) > 0) {
            workerPool.wakeUp();
        }
    }

    @Scheduled(
            every = "${jobengine.schedules.reconcile-interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduleExecutionReconcile() {
        closeFinishedExecutions(Instant.now());
    }

    @Scheduled(
            every = "${jobengine.worker.gauge-refresh-interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduleGaugeRefresh() {
        refreshBacklogGauges();
    }

    /**
     * @return number of jobs moved from RETRYING to PENDING
     */
    public int requeueRetries(Instant now) {
        int requeued = store.requeueDueRetries(now);
        if (requeued > 0) {
            LOG.debugf("Re-queued %d jobs whose retry delay elapsed", requeued);
        }
        return requeued;
    }

    /**
     * Reclaims stale RUNNING jobs. Schedule executions of those that ran out of retries are closed by the store.
     *
     * @return number of reclaimed jobs
     */
    public int reapStaleJobs(Instant now) {
        List<Job> reaped = store.reapStale(now, Duration.ofMinutes(heartbeatTimeoutMinutes));
        for (Job job : reaped) {
            if (job.status == JobStatus.FAILED) {
                metrics.recordFailed(job.jobType, "heartbeat_lost", null);
            } else {
                metrics.recordRetried(job.jobType);
            }
        }
        if (!reaped.isEmpty()) {
            LOG.warnf("Reaper reclaimed %d jobs with heartbeats older than %d minutes", reaped.size(),
                    heartbeatTimeoutMinutes);
        }
        return reaped.size();
    }

    /**
     * Closes ENQUEUED schedule executions whose job is already COMPLETED, FAILED or CANCELLED, folding the job's
     * outcome into the schedule. Each execution is closed in its own transaction.
     *
     * @return number of executions closed
     */
    public int closeFinishedExecutions(Instant now) {
        List<Job> finished = QuarkusTransaction.requiringNew()
                .call(() -> Job.findFinishedWithOpenExecution(RECONCILE_BATCH_SIZE));
        int closed = 0;
        for (Job job : finished) {
            if (QuarkusTransaction.requiringNew().call(() -> outcomes.recordJobOutcome(job, now))) {
                closed++;
            }
        }
        if (closed > 0) {
            LOG.warnf("Closed %d schedule executions whose jobs had already finished", closed);
        }
        return closed;
    }

    public void refreshBacklogGauges() {
        long[] counts = QuarkusTransaction.requiringNew().call(
                () -> new long[] {Job.countInStatus(JobStatus.PENDING), Job.countInStatus(JobStatus.RUNNING)});
        metrics.updateBacklog(counts[0], counts[1]);
    }
}

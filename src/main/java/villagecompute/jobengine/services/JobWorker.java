package villagecompute.jobengine.services;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.data.models.Job.JobStatus;
import villagecompute.jobengine.exceptions.ClaimConflictException;
import villagecompute.jobengine.exceptions.HandlerNotFoundException;
import villagecompute.jobengine.exceptions.JobCancelledException;
import villagecompute.jobengine.exceptions.PermanentExecutionException;
import villagecompute.jobengine.jobs.JobContext;
import villagecompute.jobengine.jobs.JobHandler;
import villagecompute.jobengine.jobs.JobProgressEvent;
import villagecompute.jobengine.jobs.JobTypeRegistry;
import villagecompute.jobengine.observability.JobEngineMetrics;
import villagecompute.jobengine.observability.LoggingConfig;
import villagecompute.jobengine.tenancy.TenantContext;
import villagecompute.jobengine.util.ServerInstance;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Claims and executes one job at a time on the calling thread.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Read a batch of due PENDING candidates in dispatch order (priority rank, then FIFO)</li>
 * <li>Try the conditional claim on each until one succeeds; lost claims are skipped silently</li>
 * <li>Bind tenant and MDC, open a {@code job.execute} span, run the handler</li>
 * <li>Persist the outcome: COMPLETED, RETRYING with backoff, FAILED or CANCELLED. A terminal outcome closes the
 * schedule execution of a scheduled job in the same transaction</li>
 * </ol>
 *
 * <p>
 * <b>Failure classification:</b> {@link PermanentExecutionException} and {@link HandlerNotFoundException} fail the job
 * immediately; {@link JobCancelledException} cancels it; everything else is transient and retried.
 *
 * <p>
 * Concurrency is owned by {@link WorkerPool}; this class only ever works on the thread that calls it, which keeps
 * tests deterministic.
 */
@ApplicationScoped
public class JobWorker {

    private static final Logger LOG = Logger.getLogger(JobWorker.class);

    static final int CLAIM_BATCH_SIZE = 10;

    @Inject
    JobRecordStore store;

    @Inject
    JobTypeRegistry registry;

    @Inject
    JobEngineMetrics metrics;

    @Inject
    Event<JobProgressEvent> progressEvents;

    @Inject
    Tracer tracer;

    /**
     * Claims the next due job and runs it to an outcome.
     *
     * @param now
     *            dispatch time used for candidate selection and the claim
     * @return true if a job was executed, false if nothing was claimable
     */
    public boolean processNext(Instant now) {
        String workerId = ServerInstance.workerId();
        List<Job> candidates = store.findCandidates(now, CLAIM_BATCH_SIZE);
        for (Job candidate : candidates) {
            Job claimed;
            try {
                claimed = store.claim(candidate.id, workerId, now);
            } catch (ClaimConflictException e) {
                LOG.debugf("Skipping job %d: %s", e.getJobId(), e.getMessage());
                continue;
            }
            execute(claimed, workerId);
            return true;
        }
        return false;
    }

    /**
     * Runs a claimed job and records its outcome.
     */
    void execute(Job job, String workerId) {
        Span span = tracer.spanBuilder("job.execute").setAttribute("job.id", job.id)
                .setAttribute("job.type", job.jobType).setAttribute("job.priority", job.priority.name())
                .setAttribute("job.attempt", job.attemptCount + 1)
                .setAttribute("tenant.id", TenantContext.keyOf(job.tenantId)).startSpan();
        long startNanos = System.nanoTime();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setTenantId(job.tenantId);
            LoggingConfig.setJobId(job.id);
            LoggingConfig.setRequestOrigin("job:" + job.jobType);
            TenantContext.setTenant(job.tenantId);

            Optional<Job> outcome;
            String failureReason = null;
            try {
                JobHandler handler = registry.resolve(job.jobType);
                Map<String, Object> result = handler.execute(job, new PersistentJobContext(job, workerId));
                outcome = store.complete(job.id, workerId, result, Instant.now());
                span.addEvent("job.completed");
                LOG.infof("Job %d (type: %s) completed on attempt %d", job.id, job.jobType, job.attemptCount + 1);

            } catch (JobCancelledException e) {
                outcome = store.markCancelled(job.id, workerId, Instant.now());
                failureReason = "cancelled";
                span.addEvent("job.cancelled");
                LOG.infof("Job %d (type: %s) cancelled during execution", job.id, job.jobType);

            } catch (HandlerNotFoundException | PermanentExecutionException e) {
                outcome = store.recordFailure(job.id, workerId, e, true, Instant.now());
                failureReason = e instanceof HandlerNotFoundException ? "handler_not_found" : "permanent";
                span.recordException(e);
                span.setStatus(StatusCode.ERROR);
                LOG.errorf(e, "Job %d (type: %s) failed permanently", job.id, job.jobType);

            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                outcome = store.recordFailure(job.id, workerId, e, false, Instant.now());
                span.recordException(e);
                span.setStatus(StatusCode.ERROR);
                if (outcome.isPresent() && outcome.get().status == JobStatus.RETRYING) {
                    metrics.recordRetried(job.jobType);
                    LOG.warnf(e, "Job %d (type: %s) failed on attempt %d, retrying at %s", job.id, job.jobType,
                            outcome.get().attemptCount, outcome.get().nextAttemptAt);
                } else {
                    failureReason = "exhausted";
                    LOG.errorf(e, "Job %d (type: %s) failed on attempt %d, retries exhausted", job.id, job.jobType,
                            job.attemptCount + 1);
                }
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            outcome.ifPresent(finished -> {
                if (finished.status == JobStatus.COMPLETED) {
                    metrics.recordCompleted(finished.jobType, elapsed);
                } else if (finished.status.isTerminal()) {
                    metrics.recordFailed(finished.jobType, reasonOrDefault(finished), elapsed);
                }
            });
            if (outcome.isEmpty()) {
                LOG.warnf("Outcome of job %d (%s) discarded: ownership lost", job.id,
                        failureReason == null ? "success" : failureReason);
            }
        } finally {
            span.end();
            TenantContext.clear();
            LoggingConfig.clearMDC();
        }
    }

    private static String reasonOrDefault(Job finished) {
        if (finished.status == JobStatus.CANCELLED) {
            return "cancelled";
        }
        if (finished.errorClass != null && finished.errorClass.equals(HandlerNotFoundException.class.getName())) {
            return "handler_not_found";
        }
        if (finished.errorClass != null && finished.errorClass.equals(PermanentExecutionException.class.getName())) {
            return "permanent";
        }
        return "exhausted";
    }

    /**
     * Context whose calls write straight through to the job row owned by this worker.
     */
    private final class PersistentJobContext implements JobContext {

        private final Job job;
        private final String workerId;
        private final Map<String, Object> metadata;

        PersistentJobContext(Job job, String workerId) {
            this.job = job;
            this.workerId = workerId;
            this.metadata = job.metadata == null ? new HashMap<>() : new HashMap<>(job.metadata);
        }

        @Override
        public Long jobId() {
            return job.id;
        }

        @Override
        public String tenantId() {
            return job.tenantId;
        }

        @Override
        public void updateProgress(int percent, String message) {
            int clamped = Math.max(0, Math.min(100, percent));
            Instant now = Instant.now();
            if (!store.recordProgress(job.id, workerId, clamped, message, now)) {
                LOG.warnf("Progress for job %d dropped: worker %s no longer owns it", job.id, workerId);
                return;
            }
            progressEvents.fire(new JobProgressEvent(job.id, job.tenantId, job.jobType, clamped, message, now));
        }

        @Override
        public boolean isCancellationRequested() {
            return store.isCancelRequested(job.id);
        }

        @Override
        public void checkpoint(String key, Object value) {
            if (store.saveCheckpoint(job.id, workerId, key, value, Instant.now())) {
                metadata.put(Job.META_CHECKPOINT_PREFIX + key, value);
            }
        }

        @Override
        public Optional<Object> checkpointValue(String key) {
            return Optional.ofNullable(metadata.get(Job.META_CHECKPOINT_PREFIX + key));
        }
    }
}

package villagecompute.jobengine.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.LockModeType;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.data.models.Job.JobStatus;
import villagecompute.jobengine.data.models.JobAttempt;
import villagecompute.jobengine.data.models.JobAttempt.Outcome;
import villagecompute.jobengine.exceptions.ClaimConflictException;
import villagecompute.jobengine.jobs.RetryBackoffPolicy;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Worker-facing writes against the {@code jobs} table.
 *
 * <p>
 * Every method runs in its own transaction and names the state it expects to find. Claims use a conditional
 * {@code UPDATE ... WHERE status = PENDING}; outcome writes lock the row and verify the job is still RUNNING under the
 * caller's worker id. A worker whose job was reclaimed by the reaper therefore cannot overwrite the new owner's state.
 *
 * <p>
 * Every outcome write appends a {@link JobAttempt} row, and a terminal write also closes the schedule execution that
 * produced the job, both in the same transaction.
 *
 * <p>
 * Returned entities are detached snapshots.
 */
@ApplicationScoped
public class JobRecordStore {

    private static final Logger LOG = Logger.getLogger(JobRecordStore.class);

    static final String HEARTBEAT_LOST_ERROR = "Worker heartbeat lost";

    private static final int MAX_ERROR_LENGTH = 4000;

    @Inject
    ScheduleOutcomeRecorder outcomes;

    @Transactional
    public List<Job> findCandidates(Instant now, int limit) {
        return Job.findDispatchCandidates(now, limit);
    }

    /**
     * Claims a pending job for {@code workerId}.
     *
     * @throws ClaimConflictException
     *             if the row is no longer PENDING (another worker won, or it was cancelled)
     */
    @Transactional
    public Job claim(Long jobId, String workerId, Instant now) {
        int updated = Job.claim(jobId, workerId, now);
        if (updated == 0) {
            throw new ClaimConflictException(jobId);
        }
        Job.getEntityManager().clear();
        Job claimed = Job.findById(jobId);
        LOG.debugf("Worker %s claimed job %d (type: %s, attempt: %d)", workerId, jobId, claimed.jobType,
                claimed.attemptCount + 1);
        return claimed;
    }

    /**
     * Writes progress and refreshes the heartbeat.
     *
     * @return false if the caller no longer owns the job
     */
    @Transactional
    public boolean recordProgress(Long jobId, String workerId, int percent, String message, Instant now) {
        int updated = Job.update(
                "progress = ?1, progressMessage = ?2, heartbeatAt = ?3, updatedAt = ?3 "
                        + "WHERE id = ?4 AND status = ?5 AND lockedBy = ?6",
                percent, message, now, jobId, JobStatus.RUNNING, workerId);
        return updated == 1;
    }

    @Transactional
    public boolean isCancelRequested(Long jobId) {
        return Job.find("id = ?1 AND cancelRequested = true", jobId).count() > 0;
    }

    /**
     * Stores a checkpoint under {@code checkpoint.<key>} in the job's metadata.
     *
     * @return false if the caller no longer owns the job
     */
    @Transactional
    public boolean saveCheckpoint(Long jobId, String workerId, String key, Object value, Instant now) {
        Job job = lockOwned(jobId, workerId);
        if (job == null) {
            return false;
        }
        Map<String, Object> metadata = job.metadata == null ? new HashMap<>() : new HashMap<>(job.metadata);
        metadata.put(Job.META_CHECKPOINT_PREFIX + key, value);
        job.metadata = metadata;
        job.heartbeatAt = now;
        job.updatedAt = now;
        return true;
    }

    /**
     * Marks the job COMPLETED with its result.
     */
    @Transactional
    public Optional<Job> complete(Long jobId, String workerId, Map<String, Object> result, Instant now) {
        Job job = lockOwned(jobId, workerId);
        if (job == null) {
            return Optional.empty();
        }
        job.status = JobStatus.COMPLETED;
        job.result = result == null ? null : new HashMap<>(result);
        job.progress = 100;
        job.error = null;
        job.errorClass = null;
        job.finishedAt = now;
        job.updatedAt = now;
        JobAttempt.record(job, job.attemptCount + 1, Outcome.COMPLETED, now);
        job.lockedBy = null;
        outcomes.recordJobOutcome(job, now);
        return Optional.of(job);
    }

    /**
     * Records a failed attempt.
     *
     * <p>
     * The attempt counter always increments. Permanent failures go straight to FAILED; transient ones go to RETRYING
     * with the backoff delay while the retry budget lasts, then to FAILED.
     *
     * @return the updated job, or empty if the caller no longer owns it
     */
    @Transactional
    public Optional<Job> recordFailure(Long jobId, String workerId, Throwable error, boolean permanent, Instant now) {
        Job job = lockOwned(jobId, workerId);
        if (job == null) {
            return Optional.empty();
        }
        job.attemptCount++;
        job.error = truncate(describe(error));
        job.errorClass = error.getClass().getName();
        job.updatedAt = now;
        JobAttempt.record(job, job.attemptCount, Outcome.FAILED, now);
        job.lockedBy = null;

        if (permanent || job.attemptCount > job.maxRetries) {
            job.status = JobStatus.FAILED;
            job.finishedAt = now;
        } else {
            job.status = JobStatus.RETRYING;
            job.nextAttemptAt = now.plus(RetryBackoffPolicy.delayFor(job.attemptCount));
        }
        outcomes.recordJobOutcome(job, now);
        return Optional.of(job);
    }

    /**
     * Marks a running job CANCELLED after its handler stopped on request.
     */
    @Transactional
    public Optional<Job> markCancelled(Long jobId, String workerId, Instant now) {
        Job job = lockOwned(jobId, workerId);
        if (job == null) {
            return Optional.empty();
        }
        job.status = JobStatus.CANCELLED;
        job.finishedAt = now;
        job.updatedAt = now;
        JobAttempt.record(job, job.attemptCount + 1, Outcome.CANCELLED, now);
        job.lockedBy = null;
        outcomes.recordJobOutcome(job, now);
        return Optional.of(job);
    }

    /**
     * RETRYING -> PENDING for every job whose backoff has elapsed.
     */
    @Transactional
    public int requeueDueRetries(Instant now) {
        return Job.requeueDueRetries(now);
    }

    /**
     * Reclaims RUNNING jobs whose heartbeat is older than {@code timeout}. Each reclaim counts as a failed attempt:
     * the job returns to PENDING for immediate redispatch, or FAILED once the retry budget is spent.
     *
     * @return the reclaimed jobs in their new state
     */
    @Transactional
    public List<Job> reapStale(Instant now, Duration timeout) {
        Instant threshold = now.minus(timeout);
        List<Job> reaped = new ArrayList<>();
        for (Job job : Job.findStaleRunning(threshold)) {
            Job.getEntityManager().refresh(job, LockModeType.PESSIMISTIC_WRITE);
            if (job.status != JobStatus.RUNNING || job.heartbeatAt == null || !job.heartbeatAt.isBefore(threshold)) {
                continue;
            }
            LOG.warnf("Reclaiming job %d (type: %s) from worker %s, last heartbeat %s", job.id, job.jobType,
                    job.lockedBy, job.heartbeatAt);
            job.attemptCount++;
            job.error = HEARTBEAT_LOST_ERROR;
            job.errorClass = null;
            JobAttempt.record(job, job.attemptCount, Outcome.HEARTBEAT_LOST, now);
            job.lockedBy = null;
            job.updatedAt = now;
            if (job.attemptCount > job.maxRetries) {
                job.status = JobStatus.FAILED;
                job.finishedAt = now;
            } else {
                job.status = JobStatus.PENDING;
                job.nextAttemptAt = now;
                job.startedAt = null;
                job.heartbeatAt = null;
            }
            outcomes.recordJobOutcome(job, now);
            reaped.add(job);
        }
        return reaped;
    }

    private Job lockOwned(Long jobId, String workerId) {
        Job job = Job.findById(jobId, LockModeType.PESSIMISTIC_WRITE);
        if (job == null) {
            LOG.warnf("Job %d disappeared while owned by worker %s", jobId, workerId);
            return null;
        }
        if (job.status != JobStatus.RUNNING || !workerId.equals(job.lockedBy)) {
            LOG.warnf("Worker %s lost ownership of job %d (status: %s, locked by: %s)", workerId, jobId, job.status,
                    job.lockedBy);
            return null;
        }
        return job;
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static String truncate(String value) {
        return value.length() <= MAX_ERROR_LENGTH ? value : value.substring(0, MAX_ERROR_LENGTH);
    }
}

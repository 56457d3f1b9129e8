package villagecompute.jobengine.jobs;

import villagecompute.jobengine.exceptions.JobCancelledException;

import java.util.Optional;

/**
 * Execution context passed to a {@link JobHandler}.
 *
 * <p>
 * Implementations write through to the job store immediately; none of these calls are buffered.
 */
public interface JobContext {

    /**
     * Primary key of the executing job, or null for an inline schedule firing.
     */
    Long jobId();

    /**
     * Tenant owning the job, or null for system-wide work. Also bound in
     * {@link villagecompute.jobengine.tenancy.TenantContext} for the duration of the call.
     */
    String tenantId();

    /**
     * Records progress and refreshes the worker heartbeat.
     *
     * @param percent
     *            0-100, clamped
     * @param message
     *            short status line for polling UIs
     */
    void updateProgress(int percent, String message);

    /**
     * Returns true once someone asked for this job to be cancelled.
     */
    boolean isCancellationRequested();

    /**
     * Throws {@link JobCancelledException} if cancellation was requested. Call between units of work.
     */
    default void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new JobCancelledException("Job cancelled at caller's request");
        }
    }

    /**
     * Persists a resume marker into the job's metadata under {@code checkpoint.<key>}. A retried or reclaimed attempt
     * reads it back through {@link #checkpointValue(String)}.
     */
    void checkpoint(String key, Object value);

    /**
     * Returns a marker saved by an earlier attempt.
     */
    Optional<Object> checkpointValue(String key);
}

package villagecompute.jobengine.jobs;

/**
 * Fired when a job row is created. Observers registered for {@code TransactionPhase.AFTER_SUCCESS} only see it once
 * the row is committed; it is a wake-up hint, never a delivery guarantee.
 */
public record JobEnqueuedEvent(Long jobId, String tenantId, String jobType, JobPriority priority) {
}

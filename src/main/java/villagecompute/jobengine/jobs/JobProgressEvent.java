package villagecompute.jobengine.jobs;

import java.time.Instant;

/**
 * Fired synchronously after a handler's progress update has been written. Observe it to build progress listeners.
 */
public record JobProgressEvent(Long jobId, String tenantId, String jobType, int percent, String message,
        Instant reportedAt) {
}

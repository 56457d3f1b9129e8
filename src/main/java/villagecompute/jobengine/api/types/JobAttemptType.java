package villagecompute.jobengine.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.jobengine.data.models.JobAttempt;

import java.time.Instant;
import java.util.Map;

/**
 * One finished attempt, for {@code GET /jobs/{id}/history} and {@code GET /jobs/activity}.
 */
@Schema(
        description = "Job attempt")
public record JobAttemptType(Long id, Long jobId, String type, int attemptNumber, String outcome,
        Map<String, Object> result, String error, String errorClass, String workerId, Instant startedAt,
        Instant finishedAt, Long durationMs) {

    public static JobAttemptType from(JobAttempt attempt) {
        return new JobAttemptType(attempt.id, attempt.jobId, attempt.jobType, attempt.attemptNumber,
                attempt.outcome.name(), attempt.result, attempt.error, attempt.errorClass, attempt.workerId,
                attempt.startedAt, attempt.finishedAt, attempt.durationMs);
    }
}

package villagecompute.jobengine.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.jobengine.data.models.Job;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * Full view of a job for {@code GET /jobs/{id}} and listings.
 */
@Schema(
        description = "Job detail")
public record JobDetailType(Long id, String type, String status, String priority, Map<String, Object> payload,
        int progress, String progressMessage, int attemptCount, int maxRetries, Map<String, Object> result,
        String error, String errorClass, Map<String, Object> metadata, boolean cancelRequested, Instant createdAt,
        Instant startedAt, Instant finishedAt, Instant nextAttemptAt) {

    public static JobDetailType from(Job job) {
        return new JobDetailType(job.id, job.jobType, job.status.name(), job.priority.name().toLowerCase(Locale.ROOT),
                job.payload, job.progress, job.progressMessage, job.attemptCount, job.maxRetries, job.result,
                job.error, job.errorClass, job.metadata, job.cancelRequested, job.createdAt, job.startedAt,
                job.finishedAt, job.nextAttemptAt);
    }
}

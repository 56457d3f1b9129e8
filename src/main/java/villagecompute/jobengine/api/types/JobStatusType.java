package villagecompute.jobengine.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.jobengine.data.models.Job;

import java.util.Map;

/**
 * Polling view of a job.
 *
 * @param status
 *            lifecycle status
 * @param progress
 *            0-100
 * @param progressMessage
 *            last progress message
 * @param result
 *            handler result once completed
 * @param error
 *            last error, if any
 */
@Schema(
        description = "Job status for polling")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusType(String status, int progress, String progressMessage, Map<String, Object> result,
        String error) {

    public static JobStatusType from(Job job) {
        return new JobStatusType(job.status.name(), job.progress, job.progressMessage, job.result, job.error);
    }
}

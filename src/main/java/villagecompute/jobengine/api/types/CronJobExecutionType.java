package villagecompute.jobengine.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.jobengine.data.models.CronJobExecution;

import java.time.Instant;
import java.util.Map;

/**
 * API response type for one schedule firing.
 */
@Schema(
        description = "Execution record of a schedule firing")
public record CronJobExecutionType(Long id, @JsonProperty("cron_job_id") Long cronJobId,
        @JsonProperty("started_at") Instant startedAt, @JsonProperty("finished_at") Instant finishedAt,
        String status, Map<String, Object> output, String error, @JsonProperty("duration_ms") Long durationMs,
        @JsonProperty("job_id") Long jobId, @JsonProperty("triggered_by") String triggeredBy,
        @JsonProperty("server_instance") String serverInstance) {

    public static CronJobExecutionType from(CronJobExecution execution) {
        return new CronJobExecutionType(execution.id, execution.cronJobId, execution.startedAt, execution.finishedAt,
                execution.status.name(), execution.output, execution.error, execution.durationMs, execution.jobId,
                execution.triggeredBy.name(), execution.serverInstance);
    }
}

package villagecompute.jobengine.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.jobengine.data.models.CronJob;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * API response type for a schedule.
 */
@Schema(
        description = "Cron schedule with run statistics")
public record CronJobType(Long id, String name, String description,
        @JsonProperty("cron_expression") String cronExpression, String timezone,
        @JsonProperty("job_type") String jobType, Map<String, Object> configuration,
        @JsonProperty("source_type") String sourceType, @JsonProperty("source_id") String sourceId,
        @JsonProperty("is_active") boolean active, @JsonProperty("is_paused") boolean paused,
        @JsonProperty("paused_reason") String pausedReason, @JsonProperty("is_system") boolean system,
        @JsonProperty("one_time") boolean oneTime, String priority, @JsonProperty("max_retries") int maxRetries,
        @JsonProperty("max_runs") Integer maxRuns, @JsonProperty("max_failures") int maxFailures,
        @JsonProperty("last_run_at") Instant lastRunAt, @JsonProperty("next_run_at") Instant nextRunAt,
        @JsonProperty("run_count") long runCount, @JsonProperty("success_count") long successCount,
        @JsonProperty("failure_count") long failureCount,
        @JsonProperty("consecutive_failures") int consecutiveFailures,
        @JsonProperty("last_status") String lastStatus, @JsonProperty("last_error") String lastError,
        @JsonProperty("created_at") Instant createdAt, @JsonProperty("updated_at") Instant updatedAt) {

    public static CronJobType from(CronJob cronJob) {
        return new CronJobType(cronJob.id, cronJob.name, cronJob.description, cronJob.cronExpression,
                cronJob.timezone, cronJob.jobType, cronJob.configuration, cronJob.sourceType.name(), cronJob.sourceId,
                cronJob.active, cronJob.paused, cronJob.pausedReason, cronJob.system, cronJob.oneTime,
                cronJob.priority.name().toLowerCase(Locale.ROOT), cronJob.maxRetries, cronJob.maxRuns, cronJob.maxFailures,
                cronJob.lastRunAt, cronJob.nextRunAt, cronJob.runCount, cronJob.successCount, cronJob.failureCount,
                cronJob.consecutiveFailures, cronJob.lastStatus, cronJob.lastError, cronJob.createdAt,
                cronJob.updatedAt);
    }
}

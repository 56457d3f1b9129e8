package villagecompute.jobengine.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Summary statistics over a tenant's schedules.
 */
@Schema(
        description = "Schedule summary statistics")
public record ScheduleStatsType(long total, long active, long paused, @JsonProperty("total_runs") long totalRuns,
        @JsonProperty("total_successes") long totalSuccesses, @JsonProperty("total_failures") long totalFailures,
        @JsonProperty("success_rate") Double successRate) {
}

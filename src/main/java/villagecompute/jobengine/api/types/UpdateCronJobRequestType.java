package villagecompute.jobengine.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.Map;

/**
 * API request type for updating a schedule. Null values mean "no change".
 */
@Schema(
        description = "Request to update a cron schedule (partial update)")
public record UpdateCronJobRequestType(@Schema(
        nullable = true) String name,

        @Schema(
                nullable = true) String description,

        @Schema(
                example = "30 3 * * 1-5",
                nullable = true) @JsonProperty("cron_expression") String cronExpression,

        @Schema(
                example = "UTC",
                nullable = true) String timezone,

        @Schema(
                nullable = true) Map<String, Object> configuration,

        @Schema(
                nullable = true) @JsonProperty("is_active") Boolean active,

        @Schema(
                nullable = true) @JsonProperty("max_runs") @Min(1) Integer maxRuns,

        @Schema(
                nullable = true) @JsonProperty("max_failures") @Min(1) @Max(100) Integer maxFailures,

        @Schema(
                nullable = true) String priority,

        @Schema(
                nullable = true) @JsonProperty("max_retries") @Min(0) @Max(25) Integer maxRetries) {
}

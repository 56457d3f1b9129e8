package villagecompute.jobengine.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.Map;

/**
 * API request type for creating a schedule.
 *
 * @param name
 *            display name
 * @param description
 *            optional description
 * @param cronExpression
 *            five-field cron expression or macro
 * @param timezone
 *            IANA zone, defaults to UTC
 * @param jobType
 *            registered job type the schedule fires
 * @param configuration
 *            payload handed to every firing
 * @param active
 *            whether the schedule starts active (default true)
 * @param maxRuns
 *            deactivate after this many runs (null = unlimited)
 * @param maxFailures
 *            consecutive failures before auto-pause (default 5)
 * @param oneTime
 *            deactivate after the first firing
 * @param priority
 *            priority of produced jobs
 * @param maxRetries
 *            retry budget of produced jobs
 * @param sourceType
 *            USER, INTEGRATION or PLUGIN
 * @param sourceId
 *            identifier within the source (integration or plugin id)
 */
@Schema(
        description = "Request to create a cron schedule")
public record CreateCronJobRequestType(@Schema(
        description = "Display name",
        example = "Nightly Shopify import",
        required = true) @NotBlank String name,

        @Schema(
                description = "Optional description",
                nullable = true) String description,

        @Schema(
                description = "Five-field cron expression or macro",
                example = "0 2 * * *",
                required = true) @JsonProperty("cron_expression") @NotBlank String cronExpression,

        @Schema(
                description = "IANA timezone",
                example = "Europe/Amsterdam",
                nullable = true) String timezone,

        @Schema(
                description = "Registered job type",
                example = "catalog:import",
                required = true) @JsonProperty("job_type") @NotBlank String jobType,

        @Schema(
                description = "Payload handed to each firing",
                nullable = true) Map<String, Object> configuration,

        @Schema(
                description = "Start active",
                example = "true",
                nullable = true) @JsonProperty("is_active") Boolean active,

        @Schema(
                description = "Deactivate after this many runs",
                nullable = true) @JsonProperty("max_runs") @Min(1) Integer maxRuns,

        @Schema(
                description = "Consecutive failures before auto-pause",
                example = "5",
                nullable = true) @JsonProperty("max_failures") @Min(1) @Max(100) Integer maxFailures,

        @Schema(
                description = "Deactivate after the first firing",
                nullable = true) @JsonProperty("one_time") Boolean oneTime,

        @Schema(
                description = "Priority of produced jobs",
                example = "normal",
                nullable = true) String priority,

        @Schema(
                description = "Retry budget of produced jobs",
                example = "3",
                nullable = true) @JsonProperty("max_retries") @Min(0) @Max(25) Integer maxRetries,

        @Schema(
                description = "Owning subsystem: USER, INTEGRATION or PLUGIN",
                example = "INTEGRATION",
                nullable = true) @JsonProperty("source_type") String sourceType,

        @Schema(
                description = "Identifier within the owning subsystem",
                nullable = true) @JsonProperty("source_id") String sourceId) {
}

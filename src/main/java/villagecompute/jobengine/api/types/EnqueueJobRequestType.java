package villagecompute.jobengine.api.types;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.Map;

/**
 * API request type for {@code POST /jobs}.
 *
 * @param type
 *            registered job type
 * @param payload
 *            handler parameters
 * @param priority
 *            urgent, high, normal (default) or low
 * @param maxRetries
 *            retry budget, default 3
 * @param metadata
 *            caller metadata such as a correlation id
 * @param delaySeconds
 *            earliest start, relative to now
 */
@Schema(
        description = "Request to enqueue a background job")
public record EnqueueJobRequestType(@Schema(
        description = "Registered job type",
        example = "catalog:import",
        required = true) @NotBlank String type,

        @Schema(
                description = "Handler parameters",
                nullable = true) Map<String, Object> payload,

        @Schema(
                description = "Dispatch priority",
                example = "high",
                nullable = true) String priority,

        @Schema(
                description = "Retry budget for transient failures",
                example = "3",
                nullable = true) @Min(0) @Max(25) Integer maxRetries,

        @Schema(
                description = "Caller metadata",
                nullable = true) Map<String, Object> metadata,

        @Schema(
                description = "Delay before the job becomes eligible, in seconds",
                example = "0",
                nullable = true) @Min(0) Long delaySeconds) {
}

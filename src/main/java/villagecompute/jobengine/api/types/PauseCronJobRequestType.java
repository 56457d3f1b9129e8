package villagecompute.jobengine.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Optional body of a pause request.
 *
 * @param reason
 *            shown as {@code paused_reason}; defaults to "Paused by user"
 */
@Schema(
        description = "Request to pause a schedule")
public record PauseCronJobRequestType(@Schema(
        description = "Why the schedule is paused",
        nullable = true) String reason) {
}

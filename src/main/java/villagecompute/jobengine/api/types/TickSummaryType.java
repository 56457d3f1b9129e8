package villagecompute.jobengine.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;

/**
 * Result of one scheduler tick.
 *
 * @param tickAt
 *            reference time the tick evaluated schedules against
 * @param due
 *            active schedules whose next run was at or before {@code tickAt}
 * @param firedInline
 *            firings executed within the tick
 * @param enqueued
 *            firings handed to the worker pool as jobs
 * @param skippedPaused
 *            paused schedules that were only advanced
 * @param conflicts
 *            schedules already advanced by a concurrent tick
 * @param failed
 *            firings that failed to dispatch or failed inline
 * @param tenantsProcessed
 *            tenant groups this tick held the lease for
 * @param tenantsLocked
 *            tenant groups skipped because another tick held the lease
 */
@Schema(
        description = "Outcome counts of a scheduler tick")
public record TickSummaryType(@JsonProperty("tick_at") Instant tickAt, int due,
        @JsonProperty("fired_inline") int firedInline, int enqueued,
        @JsonProperty("skipped_paused") int skippedPaused, int conflicts, int failed,
        @JsonProperty("tenants_processed") int tenantsProcessed,
        @JsonProperty("tenants_locked") int tenantsLocked) {
}

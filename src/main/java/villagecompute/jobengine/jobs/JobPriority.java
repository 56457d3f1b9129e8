package villagecompute.jobengine.jobs;

import villagecompute.jobengine.exceptions.ValidationException;

import java.util.Locale;

/**
 * Dispatch priority tiers for jobs.
 *
 * <p>
 * Workers claim pending jobs ordered by {@link #getRank()} ascending, then by creation time, so a lower rank always
 * wins and ties are broken FIFO. Priority only affects dispatch order; a running job is never preempted.
 *
 * @see villagecompute.jobengine.data.models.Job#findDispatchCandidates
 */
public enum JobPriority {

    /**
     * Customer-blocking work, e.g. an import the merchant is watching in the admin UI.
     */
    URGENT(1),

    /**
     * Billing and integration maintenance.
     */
    HIGH(2),

    /**
     * Default tier for application-initiated jobs.
     */
    NORMAL(3),

    /**
     * Housekeeping that can wait behind everything else.
     */
    LOW(10);

    private final int rank;

    JobPriority(int rank) {
        this.rank = rank;
    }

    /**
     * Returns the numeric rank persisted in {@code jobs.priority_rank} (lower values = higher priority).
     */
    public int getRank() {
        return rank;
    }

    /**
     * Parses a priority name case-insensitively. A null or blank value yields {@link #NORMAL}.
     *
     * @throws ValidationException
     *             if the value names no tier
     */
    public static JobPriority fromString(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown priority '" + value + "' (expected urgent, high, normal or low)");
        }
    }
}

package villagecompute.jobengine.jobs;

import java.time.Duration;

/**
 * Fixed retry schedule for transient job failures: 5 seconds, 30 seconds, 5 minutes, then 5 minutes for every later
 * attempt.
 *
 * <p>
 * No jitter is applied. Retries are already spread by the poll interval and by claim order.
 */
public final class RetryBackoffPolicy {

    private static final Duration[] DELAYS = {Duration.ofSeconds(5), Duration.ofSeconds(30), Duration.ofMinutes(5)};

    private RetryBackoffPolicy() {
    }

    /**
     * Returns the delay before the next attempt.
     *
     * @param attemptCount
     *            failed attempts so far, including the one just recorded (1-indexed)
     */
    public static Duration delayFor(int attemptCount) {
        if (attemptCount <= 1) {
            return DELAYS[0];
        }
        return DELAYS[Math.min(attemptCount, DELAYS.length) - 1];
    }
}

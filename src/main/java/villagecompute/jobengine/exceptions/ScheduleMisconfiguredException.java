package villagecompute.jobengine.exceptions;

/**
 * Invalid cron expression, unknown timezone or unknown job type on a schedule. Rejected synchronously when the schedule
 * is created or updated (HTTP 400) so a broken definition never reaches the scheduler tick.
 */
public class ScheduleMisconfiguredException extends RuntimeException {

    public ScheduleMisconfiguredException(String message) {
        super(message);
    }

    public ScheduleMisconfiguredException(String message, Throwable cause) {
        super(message, cause);
    }
}

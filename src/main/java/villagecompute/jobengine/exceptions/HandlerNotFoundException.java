package villagecompute.jobengine.exceptions;

/**
 * Raised when a job type string has no registered handler.
 *
 * <p>
 * At enqueue time this is a client error (HTTP 400). At execution time the job is failed immediately without retry so
 * that an unknown type never blocks the queue.
 */
public class HandlerNotFoundException extends RuntimeException {

    private final String jobType;

    public HandlerNotFoundException(String jobType) {
        super("No handler registered for job type '" + jobType + "'");
        this.jobType = jobType;
    }

    public String getJobType() {
        return jobType;
    }
}

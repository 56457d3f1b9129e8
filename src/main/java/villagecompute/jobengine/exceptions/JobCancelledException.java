package villagecompute.jobengine.exceptions;

/**
 * Thrown by a handler (usually via {@code JobContext.throwIfCancellationRequested()}) after it observed a cancellation
 * request between steps. The worker records the job as {@code CANCELLED}.
 */
public class JobCancelledException extends RuntimeException {

    public JobCancelledException(String message) {
        super(message);
    }
}

package villagecompute.jobengine.exceptions;

/**
 * Network, timeout or rate-limit class failure inside a job handler. The worker retries the job on the backoff
 * schedule until {@code max_retries} is exhausted.
 *
 * <p>
 * Handlers are not required to throw this type: any exception that is not a {@link PermanentExecutionException} is
 * treated as transient.
 */
public class TransientExecutionException extends RuntimeException {

    public TransientExecutionException(String message) {
        super(message);
    }

    public TransientExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}

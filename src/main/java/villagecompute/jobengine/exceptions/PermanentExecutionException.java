package villagecompute.jobengine.exceptions;

/**
 * Validation or business-rule failure inside a job handler. The job is marked {@code FAILED} immediately regardless of
 * remaining attempts.
 */
public class PermanentExecutionException extends RuntimeException {

    public PermanentExecutionException(String message) {
        super(message);
    }

    public PermanentExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}

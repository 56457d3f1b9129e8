package villagecompute.jobengine.exceptions;

/**
 * Exception thrown when request input is invalid (missing name, out-of-range retries, illegal state transition).
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 400 Bad Request, or 409 Conflict when the request is
 * well-formed but the target row is in a state that forbids it.
 */
public class ValidationException extends RuntimeException {

    private final boolean conflict;

    public ValidationException(String message) {
        this(message, false);
    }

    public ValidationException(String message, boolean conflict) {
        super(message);
        this.conflict = conflict;
    }

    /**
     * Returns true when the input was valid but the target row's current state rejects the operation.
     */
    public boolean isConflict() {
        return conflict;
    }
}

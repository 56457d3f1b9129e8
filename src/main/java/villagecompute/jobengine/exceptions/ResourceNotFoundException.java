package villagecompute.jobengine.exceptions;

/**
 * Exception thrown when a requested job, schedule or execution does not exist for the calling tenant.
 *
 * <p>
 * Rows owned by a different tenant are reported as not found rather than forbidden so that job ids never leak across
 * tenants. Mapped to HTTP 404 Not Found in REST resources.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}

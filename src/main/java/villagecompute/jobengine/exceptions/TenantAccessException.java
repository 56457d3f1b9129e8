package villagecompute.jobengine.exceptions;

/**
 * Exception thrown when the caller has no tenant context or tries an operation reserved for the platform, such as
 * enqueuing a {@code system:} job type or creating a system schedule. Mapped to HTTP 403 Forbidden.
 */
public class TenantAccessException extends RuntimeException {

    public TenantAccessException(String message) {
        super(message);
    }
}

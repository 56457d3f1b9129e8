package villagecompute.jobengine.tenancy;

import villagecompute.jobengine.exceptions.TenantAccessException;

import java.util.function.Supplier;

/**
 * Thread-bound tenant identity for the current request or job execution.
 *
 * <p>
 * The REST layer binds the tenant from the {@code X-Tenant-Id} header ({@code TenantRequestFilter}); the worker pool
 * and scheduler tick bind the tenant that owns the job or schedule before invoking a handler. Every store query that
 * serves a tenant reads the id from here, so a handler can only see its own tenant's rows.
 *
 * <p>
 * System-wide schedules have no tenant; they run with {@link #SYSTEM_TENANT_KEY} bound only for logging and lease keys.
 */
public final class TenantContext {

    /**
     * Lease and logging key used for schedules whose {@code tenant_id} is null.
     */
    public static final String SYSTEM_TENANT_KEY = "system";

    private static final ThreadLocal<String> CURRENT_TENANT = new ThreadLocal<>();

    private TenantContext() {
    }

    public static void setTenant(String tenantId) {
        CURRENT_TENANT.set(tenantId);
    }

    public static String getTenant() {
        return CURRENT_TENANT.get();
    }

    /**
     * Returns the bound tenant or fails with {@link TenantAccessException} when the caller has none.
     */
    public static String requireTenant() {
        String tenant = CURRENT_TENANT.get();
        if (tenant == null || tenant.isBlank()) {
            throw new TenantAccessException("Tenant context is required");
        }
        return tenant;
    }

    public static void clear() {
        CURRENT_TENANT.remove();
    }

    /**
     * Canonical form of a tenant id taken from a request: surrounding whitespace removed, blank mapped to null.
     */
    public static String normalize(String tenantId) {
        if (tenantId == null) {
            return null;
        }
        String trimmed = tenantId.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Maps a nullable tenant id to the key used by leases and MDC.
     */
    public static String keyOf(String tenantId) {
        return tenantId == null ? SYSTEM_TENANT_KEY : tenantId;
    }

    /**
     * Runs {@code supplier} with {@code tenantId} bound, restoring whatever was bound before.
     */
    public static <T> T callAs(String tenantId, Supplier<T> supplier) {
        String previous = CURRENT_TENANT.get();
        try {
            CURRENT_TENANT.set(tenantId);
            return supplier.get();
        } finally {
            if (previous != null) {
                CURRENT_TENANT.set(previous);
            } else {
                CURRENT_TENANT.remove();
            }
        }
    }

    public static void runAs(String tenantId, Runnable runnable) {
        callAs(tenantId, () -> {
            runnable.run();
            return null;
        });
    }
}

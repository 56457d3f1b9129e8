package villagecompute.jobengine.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Per-tenant advisory lease held by a scheduler tick while it processes that tenant's due schedules.
 *
 * <p>
 * One row per tenant key (tenant id, or {@code system} for platform schedules). A lease is taken by a conditional
 * update that only succeeds when the current lease has expired or is already held by the caller.
 */
@Entity
@Table(
        name = "scheduler_tick_leases")
public class SchedulerTickLease extends PanacheEntityBase {

    @Id
    @Column(
            name = "tenant_key",
            nullable = false)
    public String tenantKey;

    @Column(
            name = "locked_by")
    public String lockedBy;

    @Column(
            name = "locked_until",
            nullable = false)
    public Instant lockedUntil;

    @Column(
            name = "acquired_at")
    public Instant acquiredAt;

    public static int tryAcquire(String tenantKey, String owner, Instant now, Instant until) {
        return update("lockedBy = ?1, lockedUntil = ?2, acquiredAt = ?3 WHERE tenantKey = ?4 AND "
                + "(lockedUntil <= ?3 OR lockedBy = ?1)", owner, until, now, tenantKey);
    }

    public static int release(String tenantKey, String owner, Instant now) {
        return update("lockedUntil = ?1 WHERE tenantKey = ?2 AND lockedBy = ?3", now, tenantKey, owner);
    }
}

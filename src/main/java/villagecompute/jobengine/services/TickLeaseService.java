package villagecompute.jobengine.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.PersistenceException;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.jobengine.data.models.SchedulerTickLease;

import java.time.Instant;

/**
 * Per-tenant advisory lock for the scheduler tick, backed by {@code scheduler_tick_leases}.
 *
 * <p>
 * A lease expires on its own after {@code jobengine.tick.lease-seconds}, so a tick that dies mid-run blocks its
 * tenants for at most that long. Correctness does not depend on the lease: schedule advancement is itself conditional.
 * The lease only keeps two ticks from doing the same tenant's work in parallel.
 */
@ApplicationScoped
public class TickLeaseService {

    private static final Logger LOG = Logger.getLogger(TickLeaseService.class);

    @ConfigProperty(
            name = "jobengine.tick.lease-seconds",
            defaultValue = "300")
    long leaseSeconds;

    /**
     * Takes the lease for {@code tenantKey} if it is free, expired or already held by {@code owner}.
     */
    public boolean tryAcquire(String tenantKey, String owner, Instant now) {
        ensureRow(tenantKey);
        int updated = QuarkusTransaction.requiringNew()
                .call(() -> SchedulerTickLease.tryAcquire(tenantKey, owner, now, now.plusSeconds(leaseSeconds)));
        if (updated == 0) {
            LOG.debugf("Tick lease for tenant %s is held by another tick", tenantKey);
        }
        return updated == 1;
    }

    public void release(String tenantKey, String owner, Instant now) {
        QuarkusTransaction.requiringNew().run(() -> SchedulerTickLease.release(tenantKey, owner, now));
    }

    private void ensureRow(String tenantKey) {
        boolean exists = QuarkusTransaction.requiringNew()
                .call(() -> SchedulerTickLease.findById(tenantKey) != null);
        if (exists) {
            return;
        }
        try {
            QuarkusTransaction.requiringNew().run(() -> {
                SchedulerTickLease lease = new SchedulerTickLease();
                lease.tenantKey = tenantKey;
                lease.lockedUntil = Instant.EPOCH;
                lease.persistAndFlush();
            });
        } catch (PersistenceException e) {
            // Concurrent tick inserted the same key first; the conditional update decides ownership.
            LOG.debugf("Lease row for tenant %s created concurrently: %s", tenantKey, e.getMessage());
        }
    }
}

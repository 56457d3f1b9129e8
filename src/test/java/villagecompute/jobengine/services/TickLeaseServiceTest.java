package villagecompute.jobengine.services;

import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import villagecompute.jobengine.BaseIntegrationTest;
import villagecompute.jobengine.testing.H2TestResource;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class TickLeaseServiceTest extends BaseIntegrationTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");

    @Inject
    TickLeaseService leases;

    @Test
    void testLeaseIsExclusiveUntilReleased() {
        assertTrue(leases.tryAcquire(TENANT, "tick-1", NOW));
        assertFalse(leases.tryAcquire(TENANT, "tick-2", NOW.plusSeconds(10)));
        assertTrue(leases.tryAcquire(OTHER_TENANT, "tick-2", NOW), "leases are per tenant");
        assertTrue(leases.tryAcquire(TENANT, "tick-1", NOW.plusSeconds(10)), "re-entrant for the holder");

        leases.release(TENANT, "tick-2", NOW.plusSeconds(20));
        assertFalse(leases.tryAcquire(TENANT, "tick-2", NOW.plusSeconds(20)), "only the holder can release");

        leases.release(TENANT, "tick-1", NOW.plusSeconds(30));
        assertTrue(leases.tryAcquire(TENANT, "tick-2", NOW.plusSeconds(30)));
    }

    @Test
    void testExpiredLeaseCanBeTaken() {
        assertTrue(leases.tryAcquire(TENANT, "crashed-tick", NOW));

        assertFalse(leases.tryAcquire(TENANT, "tick-2", NOW.plusSeconds(299)));
        assertTrue(leases.tryAcquire(TENANT, "tick-2", NOW.plusSeconds(300)));
    }
}

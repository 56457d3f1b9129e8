package villagecompute.jobengine.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.jobengine.api.types.TickSummaryType;
import villagecompute.jobengine.services.CronSchedulerService;

import java.time.Instant;

/**
 * In-process trigger for the scheduler tick.
 *
 * <p>
 * Off by default ({@code jobengine.tick.internal-every=off}); production drives the tick through
 * {@code POST /internal/scheduler/tick}. Enabling both is safe since ticks are idempotent.
 */
@ApplicationScoped
public class SchedulerTickTrigger {

    private static final Logger LOG = Logger.getLogger(SchedulerTickTrigger.class);

    @Inject
    CronSchedulerService scheduler;

    @Scheduled(
            every = "${jobengine.tick.internal-every}",
            identity = "scheduler-tick",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void tick() {
        TickSummaryType summary = scheduler.tick(Instant.now());
        LOG.debugf("Internal tick processed %d due schedules", summary.due());
    }
}

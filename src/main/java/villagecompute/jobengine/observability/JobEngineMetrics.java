package villagecompute.jobengine.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registers and records the job engine's Micrometer metrics.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Gauges:</b> {@code jobengine_jobs_pending}, {@code jobengine_jobs_running} - Backlog across tenants, refreshed
 * by the maintenance scheduler</li>
 * <li><b>Counters:</b> {@code jobengine_jobs_completed_total{type}}, {@code jobengine_jobs_failed_total{type,reason}},
 * {@code jobengine_jobs_retried_total{type}}</li>
 * <li><b>Counters:</b> {@code jobengine_schedules_fired_total{outcome}},
 * {@code jobengine_schedules_auto_paused_total}</li>
 * <li><b>Timers:</b> {@code jobengine_job_duration{type}} - Handler wall-clock time</li>
 * </ul>
 *
 * <p>
 * Gauges read cached values instead of querying the database at scrape time; the scrape thread has no transaction.
 * Metrics are exported in Prometheus format at {@code /q/metrics}.
 */
@ApplicationScoped
public class JobEngineMetrics {

    private static final Logger LOG = Logger.getLogger(JobEngineMetrics.class);

    @Inject
    MeterRegistry registry;

    private final AtomicLong pendingJobs = new AtomicLong();
    private final AtomicLong runningJobs = new AtomicLong();

    public void registerMetrics(@Observes @Initialized(ApplicationScoped.class) Object init) {
        LOG.info("Registering job engine metrics");

        Gauge.builder("jobengine_jobs_pending", pendingJobs, AtomicLong::get)
                .description("Jobs waiting to be claimed, all tenants").register(registry);
        Gauge.builder("jobengine_jobs_running", runningJobs, AtomicLong::get)
                .description("Jobs currently claimed by a worker, all tenants").register(registry);

        LOG.debug("Registered gauges: jobengine_jobs_pending, jobengine_jobs_running");
    }

    public void updateBacklog(long pending, long running) {
        pendingJobs.set(pending);
        runningJobs.set(running);
    }

    public void recordCompleted(String jobType, Duration duration) {
        Counter.builder("jobengine_jobs_completed_total").tag("type", jobType).register(registry).increment();
        recordDuration(jobType, duration);
    }

    /**
     * @param reason
     *            {@code permanent}, {@code exhausted}, {@code handler_not_found}, {@code heartbeat_lost} or
     *            {@code cancelled}
     */
    public void recordFailed(String jobType, String reason, Duration duration) {
        Counter.builder("jobengine_jobs_failed_total").tag("type", jobType).tag("reason", reason).register(registry)
                .increment();
        if (duration != null) {
            recordDuration(jobType, duration);
        }
    }

    public void recordRetried(String jobType) {
        Counter.builder("jobengine_jobs_retried_total").tag("type", jobType).register(registry).increment();
    }

    /**
     * @param outcome
     *            {@code success}, {@code failure}, {@code enqueued} or {@code skipped_paused}
     */
    public void recordScheduleFired(String outcome) {
        Counter.builder("jobengine_schedules_fired_total").tag("outcome", outcome).register(registry).increment();
    }

    public void recordScheduleAutoPaused() {
        Counter.builder("jobengine_schedules_auto_paused_total").register(registry).increment();
    }

    private void recordDuration(String jobType, Duration duration) {
        Timer.builder("jobengine_job_duration").tag("type", jobType).register(registry).record(duration);
    }
}

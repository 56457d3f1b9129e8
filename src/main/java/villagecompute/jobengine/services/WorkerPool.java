package villagecompute.jobengine.services;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.event.TransactionPhase;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.jobengine.jobs.JobEnqueuedEvent;

import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool of worker threads draining the job table.
 *
 * <p>
 * At most {@code jobengine.worker.concurrency} jobs execute at once in this process. A {@link Semaphore} with that many
 * permits gates a dedicated fixed executor; each permit runs a drain loop that calls {@link JobWorker#processNext}
 * until nothing is claimable.
 *
 * <p>
 * <b>Wake-up sources:</b> the periodic poll and {@link JobEnqueuedEvent} observed after commit. Both are hints only: a
 * missed event just delays a job until the next poll.
 *
 * <p>
 * <b>Shutdown:</b> on {@link ShutdownEvent} the pool stops taking work and waits up to
 * {@code jobengine.worker.shutdown-timeout-seconds} for running handlers. Jobs still running after that are recovered
 * by the reaper on some other process.
 */
@ApplicationScoped
public class WorkerPool {

    private static final Logger LOG = Logger.getLogger(WorkerPool.class);

    @Inject
    JobWorker worker;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "jobengine.worker.enabled",
            defaultValue = "true")
    boolean enabled;

    @ConfigProperty(
            name = "jobengine.worker.concurrency",
            defaultValue = "5")
    int concurrency;

    @ConfigProperty(
            name = "jobengine.worker.shutdown-timeout-seconds",
            defaultValue = "30")
    int shutdownTimeoutSeconds;

    private Semaphore permits;
    private ExecutorService executor;
    private volatile boolean running;

    void onStart(@Observes StartupEvent event) {
        if (!enabled) {
            LOG.info("Worker pool disabled (jobengine.worker.enabled=false)");
            return;
        }
        permits = new Semaphore(concurrency);
        AtomicInteger threadCounter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(concurrency, runnable -> {
            Thread thread = new Thread(runnable, "job-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        running = true;
        Gauge.builder("jobengine_worker_slots_available", permits, Semaphore::availablePermits)
                .description("Idle worker permits in this process").register(meterRegistry);
        LOG.infof("Worker pool started with %d slots", concurrency);
    }

    void onShutdown(@Observes ShutdownEvent event) {
        if (executor == null) {
            return;
        }
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                LOG.warnf("Worker pool did not drain within %d seconds; interrupting remaining handlers",
                        shutdownTimeoutSeconds);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        LOG.info("Worker pool stopped");
    }

    @Scheduled(
            every = "${jobengine.worker.poll-interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void poll() {
        wakeUp();
    }

    void onEnqueued(@Observes(
            during = TransactionPhase.AFTER_SUCCESS) JobEnqueuedEvent event) {
        LOG.debugf("Wake-up for job %d (type: %s)", event.jobId(), event.jobType());
        wakeUp();
    }

    /**
     * Starts a drain loop on every idle slot. Returns immediately.
     */
    public void wakeUp() {
        if (!running) {
            return;
        }
        while (permits.tryAcquire()) {
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                permits.release();
                LOG.debug("Worker pool is shutting down; wake-up ignored");
                return;
            }
        }
    }

    public int availableSlots() {
        return permits == null ? 0 : permits.availablePermits();
    }

    private void drain() {
        try {
            boolean claimed = true;
            while (running && claimed) {
                claimed = worker.processNext(Instant.now());
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Worker drain loop aborted; next poll will retry");
        } finally {
            permits.release();
        }
    }
}

package villagecompute.jobengine.services;

import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import villagecompute.jobengine.BaseIntegrationTest;
import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.data.models.Job.JobStatus;
import villagecompute.jobengine.data.models.JobAttempt;
import villagecompute.jobengine.data.models.JobAttempt.Outcome;
import villagecompute.jobengine.exceptions.ClaimConflictException;
import villagecompute.jobengine.jobs.EnqueueOptions;
import villagecompute.jobengine.jobs.JobMaintenanceScheduler;
import villagecompute.jobengine.testing.H2TestResource;
import villagecompute.jobengine.testing.QueuedTestJobHandler;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class JobRecordStoreTest extends BaseIntegrationTest {

    @Inject
    JobRecordStore store;

    @Inject
    JobQueueService jobQueue;

    @Inject
    JobMaintenanceScheduler maintenance;

    @Test
    void testClaim_exactlyOneWinnerUnderContention() throws Exception {
        Job job = jobQueue.submit(TENANT, QueuedTestJobHandler.TYPE, Map.of(), EnqueueOptions.defaults());
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        int contenders = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(contenders);
        List<Future<String>> attempts = new ArrayList<>();
        try {
            for (int i = 0; i < contenders; i++) {
                String workerId = "worker-" + i;
                attempts.add(executor.submit(() -> {
                    start.await();
                    try {
                        store.claim(job.id, workerId, now);
                        return workerId;
                    } catch (ClaimConflictException e) {
                        return null;
                    }
                }));
            }
            start.countDown();

            List<String> winners = new ArrayList<>();
            for (Future<String> attempt : attempts) {
                String winner = attempt.get(30, TimeUnit.SECONDS);
                if (winner != null) {
                    winners.add(winner);
                }
            }

            assertEquals(1, winners.size(), "exactly one claim must succeed");
            Job stored = reloadJob(job.id);
            assertEquals(JobStatus.RUNNING, stored.status);
            assertEquals(winners.get(0), stored.lockedBy);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testClaim_cancelRequestedJobNotClaimable() {
        Job job = jobQueue.submit(TENANT, QueuedTestJobHandler.TYPE, Map.of(), EnqueueOptions.defaults());
        jobQueue.cancel(TENANT, job.id, Instant.now());

        assertThrows(ClaimConflictException.class, () -> store.claim(job.id, "worker-1", Instant.now()));
    }

    @Test
    void testReaper_reclaimsStaleJob() {
        Job job = jobQueue.submit(TENANT, QueuedTestJobHandler.TYPE, Map.of(), EnqueueOptions.defaults());
        Instant claimedAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        store.claim(job.id, "crashed-worker", claimedAt);

        assertEquals(0, maintenance.reapStaleJobs(claimedAt.plus(Duration.ofMinutes(9))), "heartbeat still fresh");

        Instant reapAt = claimedAt.plus(Duration.ofMinutes(11));
        assertEquals(1, maintenance.reapStaleJobs(reapAt));

        Job stored = reloadJob(job.id);
        assertEquals(JobStatus.PENDING, stored.status);
        assertEquals(1, stored.attemptCount);
        assertEquals(JobRecordStore.HEARTBEAT_LOST_ERROR, stored.error);
        assertNull(stored.lockedBy);
        assertNull(stored.heartbeatAt);
        assertEquals(reapAt, stored.nextAttemptAt);

        List<JobAttempt> attempts = jobQueue.history(TENANT, job.id);
        assertEquals(1, attempts.size());
        assertEquals(Outcome.HEARTBEAT_LOST, attempts.get(0).outcome);
        assertEquals("crashed-worker", attempts.get(0).workerId);
        assertEquals(JobRecordStore.HEARTBEAT_LOST_ERROR, attempts.get(0).error);
        assertEquals(Duration.ofMinutes(11).toMillis(), attempts.get(0).durationMs);
    }

    @Test
    void testReaper_failsJobOutOfRetries() {
        Job job = jobQueue.submit(TENANT, QueuedTestJobHandler.TYPE, Map.of(),
                EnqueueOptions.defaults().withMaxRetries(0));
        Instant claimedAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        store.claim(job.id, "crashed-worker", claimedAt);

        assertEquals(1, maintenance.reapStaleJobs(claimedAt.plus(Duration.ofMinutes(11))));

        Job stored = reloadJob(job.id);
        assertEquals(JobStatus.FAILED, stored.status);
        assertNotNull(stored.finishedAt);
    }

    @Test
    void testStaleWorker_cannotOverwriteReclaimedJob() {
        Job job = jobQueue.submit(TENANT, QueuedTestJobHandler.TYPE, Map.of(), EnqueueOptions.defaults());
        Instant claimedAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        store.claim(job.id, "slow-worker", claimedAt);
        maintenance.reapStaleJobs(claimedAt.plus(Duration.ofMinutes(11)));

        assertTrue(store.complete(job.id, "slow-worker", Map.of("late", true), Instant.now()).isEmpty());
        assertFalse(store.recordProgress(job.id, "slow-worker", 80, "late progress", Instant.now()));
        assertFalse(store.saveCheckpoint(job.id, "slow-worker", "cursor", "x", Instant.now()));

        Job stored = reloadJob(job.id);
        assertEquals(JobStatus.PENDING, stored.status);
        assertNull(stored.result);
    }

    @Test
    void testRecordProgress_refreshesHeartbeat() {
        Job job = jobQueue.submit(TENANT, QueuedTestJobHandler.TYPE, Map.of(), EnqueueOptions.defaults());
        Instant claimedAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        store.claim(job.id, "worker-1", claimedAt);

        Instant later = claimedAt.plus(Duration.ofMinutes(8));
        assertTrue(store.recordProgress(job.id, "worker-1", 40, "page 4", later));

        assertEquals(0, maintenance.reapStaleJobs(claimedAt.plus(Duration.ofMinutes(11))));
        Job stored = reloadJob(job.id);
        assertEquals(40, stored.progress);
        assertEquals("page 4", stored.progressMessage);
        assertEquals(JobStatus.RUNNING, stored.status);
    }
}

package villagecompute.jobengine.jobs;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import villagecompute.jobengine.BaseIntegrationTest;
import villagecompute.jobengine.data.models.CronJob;
import villagecompute.jobengine.data.models.CronJobExecution;
import villagecompute.jobengine.data.models.CronJobExecution.ExecutionStatus;
import villagecompute.jobengine.data.models.CronJobExecution.TriggeredBy;
import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.data.models.Job.JobStatus;
import villagecompute.jobengine.data.models.JobAttempt;
import villagecompute.jobengine.data.models.JobAttempt.Outcome;
import villagecompute.jobengine.services.ScheduleService;
import villagecompute.jobengine.testing.H2TestResource;
import villagecompute.jobengine.testing.QueuedTestJobHandler;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class CleanupJobHandlerTest extends BaseIntegrationTest {

    @Inject
    CleanupJobHandler handler;

    @Inject
    ScheduleService schedules;

    private Long seedJob(JobStatus status, Instant finishedAt) {
        return QuarkusTransaction.requiringNew().call(() -> {
            Instant created = finishedAt == null ? Instant.now() : finishedAt.minusSeconds(60);
            Job job = Job.create(TENANT, QueuedTestJobHandler.TYPE, Map.of(), JobPriority.NORMAL, 3, Map.of(),
                    created, null);
            job.status = status;
            job.finishedAt = finishedAt;
            if (finishedAt != null) {
                JobAttempt.record(job, 1, Outcome.valueOf(status.name()), finishedAt);
            }
            return job.id;
        });
    }

    private Long seedExecution(CronJob cronJob, Instant startedAt, boolean closed) {
        return QuarkusTransaction.requiringNew().call(() -> {
            CronJobExecution execution = CronJobExecution.start(cronJob, TriggeredBy.SCHEDULER, "test", startedAt);
            if (closed) {
                execution.status = ExecutionStatus.SUCCESS;
                execution.finishedAt = startedAt.plusSeconds(1);
            }
            return execution.id;
        });
    }

    private boolean jobExists(Long id) {
        return QuarkusTransaction.requiringNew().call(() -> Job.findById(id) != null);
    }

    private boolean executionExists(Long id) {
        return QuarkusTransaction.requiringNew().call(() -> CronJobExecution.findById(id) != null);
    }

    @Test
    void testPurgesOnlyExpiredFinishedRows() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        Long oldCompleted = seedJob(JobStatus.COMPLETED, now.minus(Duration.ofDays(31)));
        Long oldFailed = seedJob(JobStatus.FAILED, now.minus(Duration.ofDays(40)));
        Long recentCompleted = seedJob(JobStatus.COMPLETED, now.minus(Duration.ofDays(5)));
        Long pending = seedJob(JobStatus.PENDING, null);

        CronJob cronJob = schedules.create(TENANT,
                scheduleRequest("hourly", "0 * * * *", QueuedTestJobHandler.TYPE, null), now);
        Long oldExecution = seedExecution(cronJob, now.minus(Duration.ofDays(100)), true);
        Long openExecution = seedExecution(cronJob, now.minus(Duration.ofDays(100)), false);
        Long recentExecution = seedExecution(cronJob, now.minus(Duration.ofDays(10)), true);

        Job job = Job.inline(null, CleanupJobHandler.TYPE, Map.of(), Map.of(), now);
        Map<String, Object> result = handler.execute(job, new InlineJobContext(null, CleanupJobHandler.TYPE));

        assertEquals(2L, result.get("jobs_deleted"));
        assertEquals(2L, result.get("attempts_deleted"));
        assertEquals(1L, QuarkusTransaction.requiringNew().call(() -> JobAttempt.count()));
        assertEquals(1L, result.get("executions_deleted"));
        assertFalse(jobExists(oldCompleted));
        assertFalse(jobExists(oldFailed));
        assertTrue(jobExists(recentCompleted));
        assertTrue(jobExists(pending));
        assertFalse(executionExists(oldExecution));
        assertTrue(executionExists(openExecution), "open executions are never purged");
        assertTrue(executionExists(recentExecution));
    }

    @Test
    void testPayloadOverridesRetention() {
        Long weekOld = seedJob(JobStatus.CANCELLED, Instant.now().minus(Duration.ofDays(7)));

        Job job = Job.inline(null, CleanupJobHandler.TYPE, Map.of("finished_job_days", 3), Map.of(), Instant.now());
        handler.execute(job, new InlineJobContext(null, CleanupJobHandler.TYPE));

        assertFalse(jobExists(weekOld));
    }
}

package villagecompute.jobengine.services;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import villagecompute.jobengine.BaseIntegrationTest;
import villagecompute.jobengine.api.types.CreateCronJobRequestType;
import villagecompute.jobengine.api.types.TickSummaryType;
import villagecompute.jobengine.data.models.CronJob;
import villagecompute.jobengine.data.models.CronJobExecution;
import villagecompute.jobengine.data.models.CronJobExecution.ExecutionStatus;
import villagecompute.jobengine.data.models.CronJobExecution.TriggeredBy;
import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.data.models.Job.JobStatus;
import villagecompute.jobengine.exceptions.ValidationException;
import villagecompute.jobengine.jobs.JobMaintenanceScheduler;
import villagecompute.jobengine.jobs.JobPriority;
import villagecompute.jobengine.scheduling.ScheduleAutoPausedEvent;
import villagecompute.jobengine.services.CronSchedulerService.FireResult;
import villagecompute.jobengine.tenancy.TenantContext;
import villagecompute.jobengine.testing.H2TestResource;
import villagecompute.jobengine.testing.InlineTestJobHandler;
import villagecompute.jobengine.testing.QueuedTestJobHandler;
import villagecompute.jobengine.testing.ScriptedJobHandler.Step;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class CronSchedulerServiceTest extends BaseIntegrationTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Inject
    CronSchedulerService scheduler;

    @Inject
    ScheduleService schedules;

    @Inject
    JobWorker worker;

    @Inject
    JobQueueService jobQueue;

    @Inject
    TickLeaseService leases;

    @Inject
    JobMaintenanceScheduler maintenance;

    @Inject
    JobRecordStore store;

    private List<CronJobExecution> executionsOf(Long cronJobId) {
        return QuarkusTransaction.requiringNew()
                .call(() -> CronJobExecution.<CronJobExecution> list("cronJobId = ?1 ORDER BY id ASC", cronJobId));
    }

    private CronJob hourly(String jobType) {
        return schedules.create(TENANT, scheduleRequest("hourly " + jobType, "0 * * * *", jobType, Map.of()), T0);
    }

    @Test
    void testTick_firesDueQueuedScheduleAndAdvances() {
        CronJob cronJob = schedules.create(TENANT,
                scheduleRequest("nightly", "0 2 * * *", QueuedTestJobHandler.TYPE, Map.of("sku", "A-1")), T0);
        assertEquals(Instant.parse("2024-01-01T02:00:00Z"), cronJob.nextRunAt);

        TickSummaryType summary = scheduler.tick(Instant.parse("2024-01-01T02:00:01Z"));

        assertEquals(1, summary.due());
        assertEquals(1, summary.enqueued());
        assertEquals(1, summary.tenantsProcessed());
        CronJob stored = reloadSchedule(cronJob.id);
        assertEquals(Instant.parse("2024-01-02T02:00:00Z"), stored.nextRunAt);
        assertEquals(Instant.parse("2024-01-01T02:00:01Z"), stored.lastRunAt);
        assertEquals(1, stored.runCount);

        List<CronJobExecution> executions = executionsOf(cronJob.id);
        assertEquals(1, executions.size());
        CronJobExecution execution = executions.get(0);
        assertEquals(ExecutionStatus.ENQUEUED, execution.status);
        assertEquals(TriggeredBy.SCHEDULER, execution.triggeredBy);
        assertEquals(TENANT, execution.tenantId);
        assertNotNull(execution.jobId);

        Job job = reloadJob(execution.jobId);
        assertEquals(QueuedTestJobHandler.TYPE, job.jobType);
        assertEquals(TENANT, job.tenantId);
        assertEquals("A-1", job.payload.get("sku"));
        assertEquals("schedule", job.metadata.get(Job.META_INITIATED_BY));
        assertEquals(cronJob.id, job.cronJobId().orElseThrow());
        assertEquals(execution.id, job.cronExecutionId().orElseThrow());
    }

    @Test
    void testTick_missedSlotsAreSkippedNotCaughtUp() {
        CronJob cronJob = hourly(QueuedTestJobHandler.TYPE);

        TickSummaryType summary = scheduler.tick(Instant.parse("2024-01-01T05:30:00Z"));

        assertEquals(1, summary.enqueued());
        assertEquals(1, executionsOf(cronJob.id).size());
        assertEquals(Instant.parse("2024-01-01T06:00:00Z"), reloadSchedule(cronJob.id).nextRunAt);
    }

    @Test
    void testTick_repeatedTickDoesNotFireTwice() {
        CronJob cronJob = hourly(QueuedTestJobHandler.TYPE);
        Instant now = Instant.parse("2024-01-01T01:00:00Z");

        scheduler.tick(now);
        TickSummaryType second = scheduler.tick(now);

        assertEquals(0, second.due());
        assertEquals(1, executionsOf(cronJob.id).size());
    }

    @Test
    void testFireDue_staleExpectationConflicts() {
        CronJob cronJob = hourly(QueuedTestJobHandler.TYPE);
        Instant now = Instant.parse("2024-01-01T01:00:00Z");

        assertEquals(FireResult.ENQUEUED, scheduler.fireDue(cronJob.id, cronJob.nextRunAt, now));
        assertEquals(FireResult.CONFLICT, scheduler.fireDue(cronJob.id, cronJob.nextRunAt, now));
        assertEquals(1, executionsOf(cronJob.id).size());
    }

    @Test
    void testTick_pausedScheduleAdvancesWithoutFiring() {
        CronJob cronJob = hourly(QueuedTestJobHandler.TYPE);
        schedules.pause(TENANT, cronJob.id, null, T0);

        TickSummaryType summary = scheduler.tick(Instant.parse("2024-01-01T01:00:00Z"));

        assertEquals(1, summary.skippedPaused());
        CronJob stored = reloadSchedule(cronJob.id);
        assertEquals(Instant.parse("2024-01-01T02:00:00Z"), stored.nextRunAt);
        assertEquals(0, stored.runCount);
        assertTrue(executionsOf(cronJob.id).isEmpty());
    }

    @Test
    void testTick_inactiveScheduleIgnored() {
        CronJob cronJob = hourly(QueuedTestJobHandler.TYPE);
        schedules.deactivate(TENANT, cronJob.id, T0);

        TickSummaryType summary = scheduler.tick(Instant.parse("2024-01-01T01:00:00Z"));

        assertEquals(0, summary.due());
        assertTrue(executionsOf(cronJob.id).isEmpty());
    }

    @Test
    void testTick_inlineScheduleSucceeds() {
        CronJob cronJob = hourly(InlineTestJobHandler.TYPE);

        TickSummaryType summary = scheduler.tick(Instant.parse("2024-01-01T01:00:00Z"));

        assertEquals(1, summary.firedInline());
        assertEquals(1, inlineHandler.invocations());
        CronJobExecution execution = executionsOf(cronJob.id).get(0);
        assertEquals(ExecutionStatus.SUCCESS, execution.status);
        assertNull(execution.jobId);
        assertEquals(1, execution.output.get("invocation"));
        assertEquals(TENANT, execution.output.get("tenant"));
        assertNotNull(execution.finishedAt);
        assertNotNull(execution.durationMs);

        CronJob stored = reloadSchedule(cronJob.id);
        assertEquals(1, stored.successCount);
        assertEquals("SUCCESS", stored.lastStatus);
        long jobs = QuarkusTransaction.requiringNew().call(() -> Job.count());
        assertEquals(0L, jobs, "inline firing creates no job");
    }

    @Test
    void testAutoPause_afterMaxConsecutiveFailures() {
        inlineHandler.script(Step.FAIL_TRANSIENT, Step.FAIL_TRANSIENT, Step.FAIL_TRANSIENT, Step.FAIL_TRANSIENT,
                Step.FAIL_TRANSIENT);
        CronJob cronJob = hourly(InlineTestJobHandler.TYPE);
        assertEquals(5, cronJob.maxFailures);

        for (int hour = 1; hour <= 4; hour++) {
            assertEquals(1, scheduler.tick(T0.plus(Duration.ofHours(hour))).failed());
            assertFalse(reloadSchedule(cronJob.id).paused, "still active after " + hour + " failures");
        }
        scheduler.tick(T0.plus(Duration.ofHours(5)));

        CronJob paused = reloadSchedule(cronJob.id);
        assertTrue(paused.paused);
        assertEquals(5, paused.consecutiveFailures);
        assertEquals(5, paused.failureCount);
        assertTrue(paused.pausedReason.contains("5 consecutive failures"));
        assertTrue(paused.lastError.contains("Scripted transient failure 5"));

        assertEquals(1, autoPauseEvents.events().size());
        ScheduleAutoPausedEvent event = autoPauseEvents.events().get(0);
        assertEquals(cronJob.id, event.cronJobId());
        assertEquals(TENANT, event.tenantId());
        assertEquals(5, event.consecutiveFailures());

        TickSummaryType sixth = scheduler.tick(T0.plus(Duration.ofHours(6)));
        assertEquals(1, sixth.skippedPaused());
        assertEquals(5, inlineHandler.invocations(), "no sixth attempt while paused");

        Instant resumedAt = T0.plus(Duration.ofHours(6)).plusSeconds(30);
        CronJob resumed = schedules.resume(TENANT, cronJob.id, resumedAt);
        assertFalse(resumed.paused);
        assertNull(resumed.pausedReason);
        assertEquals(0, resumed.consecutiveFailures);
        assertEquals(T0.plus(Duration.ofHours(7)), resumed.nextRunAt);

        assertEquals(1, scheduler.tick(T0.plus(Duration.ofHours(7))).firedInline());
        assertEquals(6, inlineHandler.invocations());
        assertEquals(0, reloadSchedule(cronJob.id).consecutiveFailures);
    }

    @Test
    void testAutoPause_successResetsStreak() {
        inlineHandler.script(Step.FAIL_TRANSIENT, Step.FAIL_TRANSIENT, Step.SUCCEED, Step.FAIL_TRANSIENT);
        CronJob cronJob = hourly(InlineTestJobHandler.TYPE);

        for (int hour = 1; hour <= 4; hour++) {
            scheduler.tick(T0.plus(Duration.ofHours(hour)));
        }

        CronJob stored = reloadSchedule(cronJob.id);
        assertEquals(1, stored.consecutiveFailures);
        assertEquals(3, stored.failureCount);
        assertEquals(1, stored.successCount);
        assertFalse(stored.paused);
    }

    @Test
    void testQueuedOutcome_closesExecutionOnCompletion() {
        CronJob cronJob = hourly(QueuedTestJobHandler.TYPE);
        scheduler.tick(Instant.parse("2024-01-01T01:00:00Z"));

        assertTrue(worker.processNext(Instant.now()));

        CronJobExecution execution = executionsOf(cronJob.id).get(0);
        assertEquals(ExecutionStatus.SUCCESS, execution.status);
        assertEquals(1, execution.output.get("invocation"));
        CronJob stored = reloadSchedule(cronJob.id);
        assertEquals(1, stored.successCount);
        assertEquals(0, stored.consecutiveFailures);
    }

    @Test
    void testQueuedOutcome_retryKeepsExecutionOpenUntilFinal() {
        queuedHandler.script(Step.FAIL_TRANSIENT, Step.FAIL_PERMANENT);
        CronJob cronJob = hourly(QueuedTestJobHandler.TYPE);
        scheduler.tick(Instant.parse("2024-01-01T01:00:00Z"));

        assertTrue(worker.processNext(Instant.now()));
        CronJobExecution open = executionsOf(cronJob.id).get(0);
        assertEquals(ExecutionStatus.ENQUEUED, open.status);
        assertEquals(JobStatus.RETRYING, reloadJob(open.jobId).status);

        Job retrying = reloadJob(open.jobId);
        maintenance.requeueRetries(retrying.nextAttemptAt);
        assertTrue(worker.processNext(retrying.nextAttemptAt));

        CronJobExecution closed = executionsOf(cronJob.id).get(0);
        assertEquals(ExecutionStatus.FAILED, closed.status);
        assertTrue(closed.error.contains("Scripted permanent failure"));
        CronJob stored = reloadSchedule(cronJob.id);
        assertEquals(1, stored.failureCount);
        assertEquals(1, stored.consecutiveFailures);
        assertEquals("FAILED", stored.lastStatus);
    }

    @Test
    void testQueuedOutcome_cancelledJobNotCountedInStreak() {
        CronJob cronJob = hourly(QueuedTestJobHandler.TYPE);
        scheduler.tick(Instant.parse("2024-01-01T01:00:00Z"));
        Long jobId = executionsOf(cronJob.id).get(0).jobId;

        jobQueue.cancel(TENANT, jobId, Instant.now());

        CronJobExecution execution = executionsOf(cronJob.id).get(0);
        assertEquals(ExecutionStatus.FAILED, execution.status);
        assertEquals("Job cancelled", execution.error);
        CronJob stored = reloadSchedule(cronJob.id);
        assertEquals(1, stored.failureCount);
        assertEquals(0, stored.consecutiveFailures);
    }

    @Test
    void testReconcile_finishedJobWithOpenExecutionIsClosed() {
        CronJob cronJob = hourly(QueuedTestJobHandler.TYPE);
        scheduler.tick(Instant.parse("2024-01-01T01:00:00Z"));
        Long jobId = executionsOf(cronJob.id).get(0).jobId;
        Instant finishedAt = Instant.parse("2024-01-01T01:05:00Z");
        QuarkusTransaction.requiringNew().run(() -> Job.update("status = ?1, error = ?2, finishedAt = ?3 WHERE id = ?4",
                JobStatus.FAILED, "Connector refused the batch", finishedAt, jobId));

        assertEquals(1, maintenance.closeFinishedExecutions(Instant.parse("2024-01-01T01:10:00Z")));
        assertEquals(0, maintenance.closeFinishedExecutions(Instant.parse("2024-01-01T01:15:00Z")));

        CronJobExecution execution = executionsOf(cronJob.id).get(0);
        assertEquals(ExecutionStatus.FAILED, execution.status);
        assertEquals("Connector refused the batch", execution.error);
        CronJob stored = reloadSchedule(cronJob.id);
        assertEquals(1, stored.failureCount);
        assertEquals(1, stored.consecutiveFailures);
    }

    @Test
    void testReaper_exhaustedScheduledJobClosesExecution() {
        CreateCronJobRequestType request = new CreateCronJobRequestType("no retries", null, "0 * * * *", "UTC",
                QueuedTestJobHandler.TYPE, Map.of(), null, null, null, null, null, 0, null, null);
        CronJob cronJob = schedules.create(TENANT, request, T0);
        scheduler.tick(Instant.parse("2024-01-01T01:00:00Z"));
        Long jobId = executionsOf(cronJob.id).get(0).jobId;
        store.claim(jobId, "vanished-worker", Instant.parse("2024-01-01T01:00:05Z"));

        assertEquals(1, maintenance.reapStaleJobs(Instant.parse("2024-01-01T01:30:00Z")));

        assertEquals(JobStatus.FAILED, reloadJob(jobId).status);
        CronJobExecution execution = executionsOf(cronJob.id).get(0);
        assertEquals(ExecutionStatus.FAILED, execution.status);
        assertEquals("Worker heartbeat lost", execution.error);
        assertEquals(1, reloadSchedule(cronJob.id).consecutiveFailures);
    }

    @Test
    void testExecuteNow_firesWithoutMovingNextRun() {
        CronJob cronJob = hourly(InlineTestJobHandler.TYPE);
        schedules.pause(TENANT, cronJob.id, "maintenance", T0);

        Long executionId = scheduler.executeNow(cronJob.id, Instant.parse("2024-01-01T00:10:00Z"));

        CronJobExecution execution = reloadExecution(executionId);
        assertEquals(TriggeredBy.MANUAL, execution.triggeredBy);
        assertEquals(ExecutionStatus.SUCCESS, execution.status);
        CronJob stored = reloadSchedule(cronJob.id);
        assertEquals(cronJob.nextRunAt, stored.nextRunAt);
        assertEquals(1, stored.runCount);
        assertTrue(stored.paused);
    }

    @Test
    void testOneTimeSchedule_deactivatesAfterFiring() {
        CreateCronJobRequestType request = new CreateCronJobRequestType("once", null, "0 * * * *", "UTC",
                QueuedTestJobHandler.TYPE, Map.of(), null, null, null, true, null, null, null, null);
        CronJob cronJob = schedules.create(TENANT, request, T0);

        scheduler.tick(Instant.parse("2024-01-01T01:00:00Z"));
        assertFalse(reloadSchedule(cronJob.id).active);

        assertEquals(0, scheduler.tick(Instant.parse("2024-01-01T02:00:00Z")).due());
        assertEquals(1, executionsOf(cronJob.id).size());
    }

    @Test
    void testMaxRuns_deactivatesAtLimit() {
        CreateCronJobRequestType request = new CreateCronJobRequestType("twice", null, "0 * * * *", "UTC",
                InlineTestJobHandler.TYPE, Map.of(), null, 2, null, null, null, null, null, null);
        CronJob cronJob = schedules.create(TENANT, request, T0);

        scheduler.tick(Instant.parse("2024-01-01T01:00:00Z"));
        assertTrue(reloadSchedule(cronJob.id).active);
        scheduler.tick(Instant.parse("2024-01-01T02:00:00Z"));
        assertFalse(reloadSchedule(cronJob.id).active);
        scheduler.tick(Instant.parse("2024-01-01T03:00:00Z"));

        assertEquals(2, inlineHandler.invocations());
    }

    @Test
    void testMaxRuns_manualExecutionCountsTowardLimit() {
        CreateCronJobRequestType request = new CreateCronJobRequestType("once by hand", null, "0 * * * *", "UTC",
                InlineTestJobHandler.TYPE, Map.of(), null, 1, null, null, null, null, null, null);
        CronJob cronJob = schedules.create(TENANT, request, T0);

        schedules.execute(TENANT, cronJob.id, Instant.parse("2024-01-01T00:10:00Z"));
        assertFalse(reloadSchedule(cronJob.id).active);

        assertEquals(0, scheduler.tick(Instant.parse("2024-01-01T01:00:00Z")).due());
        ValidationException error = assertThrows(ValidationException.class,
                () -> scheduler.executeNow(cronJob.id, Instant.parse("2024-01-01T01:10:00Z")));
        assertTrue(error.isConflict());

        CronJob stored = reloadSchedule(cronJob.id);
        assertEquals(1, stored.runCount);
        assertEquals(1, inlineHandler.invocations());
        assertEquals(1, executionsOf(cronJob.id).size());
    }

    @Test
    void testTick_unregisteredTypeRecordsFailure() {
        CronJob cronJob = hourly(QueuedTestJobHandler.TYPE);
        QuarkusTransaction.requiringNew()
                .run(() -> CronJob.update("jobType = ?1 WHERE id = ?2", "legacy:removed", cronJob.id));

        TickSummaryType summary = scheduler.tick(Instant.parse("2024-01-01T01:00:00Z"));

        assertEquals(1, summary.failed());
        CronJobExecution execution = executionsOf(cronJob.id).get(0);
        assertEquals(ExecutionStatus.FAILED, execution.status);
        assertTrue(execution.error.contains("legacy:removed"));
        assertEquals(1, reloadSchedule(cronJob.id).consecutiveFailures);
    }

    @Test
    void testTick_invalidStoredExpressionPausesSchedule() {
        CronJob cronJob = hourly(QueuedTestJobHandler.TYPE);
        QuarkusTransaction.requiringNew()
                .run(() -> CronJob.update("cronExpression = ?1 WHERE id = ?2", "61 * * * *", cronJob.id));

        TickSummaryType summary = scheduler.tick(Instant.parse("2024-01-01T01:00:00Z"));

        assertEquals(1, summary.failed());
        CronJob stored = reloadSchedule(cronJob.id);
        assertTrue(stored.paused);
        assertTrue(stored.pausedReason.startsWith("Misconfigured"));
        assertNull(stored.nextRunAt);
        assertTrue(executionsOf(cronJob.id).isEmpty());
    }

    @Test
    void testTick_tenantLeaseHeldElsewhereSkipsTenant() {
        CronJob mine = hourly(QueuedTestJobHandler.TYPE);
        CronJob other = schedules.create(OTHER_TENANT,
                scheduleRequest("other", "0 * * * *", QueuedTestJobHandler.TYPE, Map.of()), T0);
        Instant now = Instant.parse("2024-01-01T01:00:00Z");
        assertTrue(leases.tryAcquire(TenantContext.keyOf(TENANT), "another-tick", now));

        TickSummaryType summary = scheduler.tick(now);

        assertEquals(1, summary.tenantsLocked());
        assertEquals(1, summary.tenantsProcessed());
        assertEquals(T0.plus(Duration.ofHours(1)), reloadSchedule(mine.id).nextRunAt, "locked tenant untouched");
        assertEquals(T0.plus(Duration.ofHours(2)), reloadSchedule(other.id).nextRunAt);

        leases.release(TenantContext.keyOf(TENANT), "another-tick", now);
        assertEquals(1, scheduler.tick(now).enqueued());
    }

    @Test
    void testTick_systemScheduleRunsWithoutTenant() {
        CronJob system = schedules.ensureSystemSchedule("cleanup", "purge", "30 3 * * *", "system:cleanup",
                JobPriority.LOW, T0);
        assertTrue(system.system);
        assertNull(system.tenantId);

        scheduler.tick(Instant.parse("2024-01-01T03:30:00Z"));

        CronJobExecution execution = executionsOf(system.id).get(0);
        Job job = reloadJob(execution.jobId);
        assertNull(job.tenantId);
        assertEquals("system:cleanup", job.jobType);
        assertEquals(JobPriority.LOW, job.priority);
    }

    @Test
    void testComputeNextRun_respectsTimezone() {
        Instant next = CronSchedulerService.computeNextRun("0 2 * * *", "America/New_York", T0);
        assertEquals(Instant.parse("2024-01-01T07:00:00Z"), next);
    }

    @Test
    void testEnqueueOptionsFromSchedule() {
        CreateCronJobRequestType request = new CreateCronJobRequestType("urgent", null, "0 * * * *", "UTC",
                QueuedTestJobHandler.TYPE, Map.of(), null, null, null, null, "urgent", 7, null, null);
        CronJob cronJob = schedules.create(TENANT, request, T0);

        scheduler.tick(Instant.parse("2024-01-01T01:00:00Z"));

        Job job = reloadJob(executionsOf(cronJob.id).get(0).jobId);
        assertEquals(1, job.priorityRank);
        assertEquals(7, job.maxRetries);
    }
}

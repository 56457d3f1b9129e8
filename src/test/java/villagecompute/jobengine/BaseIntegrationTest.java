package villagecompute.jobengine;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import villagecompute.jobengine.api.types.CreateCronJobRequestType;
import villagecompute.jobengine.data.models.CreditAccount;
import villagecompute.jobengine.data.models.CreditTransaction;
import villagecompute.jobengine.data.models.CronJob;
import villagecompute.jobengine.data.models.CronJobExecution;
import villagecompute.jobengine.data.models.IntegrationCredential;
import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.data.models.JobAttempt;
import villagecompute.jobengine.data.models.SchedulerTickLease;
import villagecompute.jobengine.testing.AutoPauseEventCollector;
import villagecompute.jobengine.testing.InMemoryCatalogConnector;
import villagecompute.jobengine.testing.InlineTestJobHandler;
import villagecompute.jobengine.testing.QueuedTestJobHandler;
import villagecompute.jobengine.testing.UppercaseTranslationProvider;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertNotNull;

/**
 * Abstract base class for Quarkus tests that touch the database.
 *
 * <p>
 * Engine code commits in its own transactions (claims, outcomes, schedule advances), so tests cannot rely on
 * {@code @TestTransaction} rollback. Instead every table is emptied before each test and the shared scripted beans are
 * reset.
 */
public abstract class BaseIntegrationTest {

    protected static final String TENANT = "tenant-a";
    protected static final String OTHER_TENANT = "tenant-b";

    @Inject
    protected QueuedTestJobHandler queuedHandler;

    @Inject
    protected InlineTestJobHandler inlineHandler;

    @Inject
    protected InMemoryCatalogConnector catalogConnector;

    @Inject
    protected UppercaseTranslationProvider translationProvider;

    @Inject
    protected AutoPauseEventCollector autoPauseEvents;

    @BeforeEach
    protected void setUp() {
        QuarkusTransaction.requiringNew().run(() -> {
            JobAttempt.deleteAll();
            Job.deleteAll();
            CronJobExecution.deleteAll();
            CronJob.deleteAll();
            SchedulerTickLease.deleteAll();
            CreditTransaction.deleteAll();
            CreditAccount.deleteAll();
            IntegrationCredential.deleteAll();
        });
        queuedHandler.reset();
        inlineHandler.reset();
        catalogConnector.reset(25, 10);
        translationProvider.reset();
        autoPauseEvents.reset();
    }

    @AfterEach
    protected void tearDown() {
        // Subclasses can override for custom teardown
    }

    /**
     * Minimal schedule request in UTC with defaults for everything optional.
     */
    protected static CreateCronJobRequestType scheduleRequest(String name, String cronExpression, String jobType,
            Map<String, Object> configuration) {
        return new CreateCronJobRequestType(name, null, cronExpression, "UTC", jobType, configuration, null, null, null,
                null, null, null, null, null);
    }

    /**
     * Overwrites a schedule's next run, bypassing the service.
     */
    protected void moveNextRun(Long cronJobId, Instant nextRunAt) {
        QuarkusTransaction.requiringNew().run(() -> CronJob.update("nextRunAt = ?1 WHERE id = ?2", nextRunAt,
                cronJobId));
    }

    /**
     * Reads the committed state of a job.
     */
    protected Job reloadJob(Long id) {
        Job job = QuarkusTransaction.requiringNew().call(() -> Job.<Job> findById(id));
        assertNotNull(job, "Job " + id + " should exist");
        return job;
    }

    protected CronJob reloadSchedule(Long id) {
        CronJob cronJob = QuarkusTransaction.requiringNew().call(() -> CronJob.<CronJob> findById(id));
        assertNotNull(cronJob, "Schedule " + id + " should exist");
        return cronJob;
    }

    protected CronJobExecution reloadExecution(Long id) {
        CronJobExecution execution = QuarkusTransaction.requiringNew()
                .call(() -> CronJobExecution.<CronJobExecution> findById(id));
        assertNotNull(execution, "Execution " + id + " should exist");
        return execution;
    }
}

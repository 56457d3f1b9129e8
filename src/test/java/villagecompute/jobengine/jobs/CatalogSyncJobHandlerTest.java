package villagecompute.jobengine.jobs;

import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import villagecompute.jobengine.BaseIntegrationTest;
import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.data.models.Job.JobStatus;
import villagecompute.jobengine.services.JobQueueService;
import villagecompute.jobengine.services.JobWorker;
import villagecompute.jobengine.testing.H2TestResource;
import villagecompute.jobengine.testing.InMemoryCatalogConnector;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Catalog import and export driven through the worker, so checkpoints are persisted between attempts.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
class CatalogSyncJobHandlerTest extends BaseIntegrationTest {

    @Inject
    JobQueueService jobQueue;

    @Inject
    JobWorker worker;

    @Inject
    JobMaintenanceScheduler maintenance;

    private Job runUntilFinished(Long jobId) {
        Instant now = Instant.now();
        for (int attempt = 0; attempt < 5; attempt++) {
            assertTrue(worker.processNext(now));
            Job job = reloadJob(jobId);
            if (job.status != JobStatus.RETRYING) {
                return job;
            }
            now = job.nextAttemptAt;
            maintenance.requeueRetries(now);
        }
        return fail("job " + jobId + " did not finish");
    }

    @Test
    void testImport_pagesThroughCatalog() {
        Job job = jobQueue.submit(TENANT, CatalogImportJobHandler.TYPE,
                Map.of("connector", InMemoryCatalogConnector.NAME), EnqueueOptions.defaults());

        Job done = runUntilFinished(job.id);

        assertEquals(JobStatus.COMPLETED, done.status);
        assertEquals(25, done.result.get("processed"));
        assertEquals(0, done.result.get("failed"));
        assertEquals(3, done.result.get("pages"));
        assertEquals(true, done.result.get("complete"));
        assertEquals(100, done.progress);
        assertEquals(List.of("start", "1", "2"), catalogConnector.cursors());
    }

    @Test
    void testImport_resumesFromCheckpointAfterFailure() {
        catalogConnector.failOnceAtPage(1);
        Job job = jobQueue.submit(TENANT, CatalogImportJobHandler.TYPE,
                Map.of("connector", InMemoryCatalogConnector.NAME), EnqueueOptions.defaults());

        Job done = runUntilFinished(job.id);

        assertEquals(JobStatus.COMPLETED, done.status);
        assertEquals(1, done.attemptCount);
        assertEquals(25, done.result.get("processed"));
        assertEquals(2, done.result.get("pages"), "second attempt only moves the remaining pages");
        assertEquals(List.of("start", "1", "1", "2"), catalogConnector.cursors());
    }

    @Test
    void testExport_countsRejectedItems() {
        Job job = jobQueue.submit(TENANT, CatalogExportJobHandler.TYPE,
                Map.of("connector", InMemoryCatalogConnector.NAME, "options", Map.of("reject_per_page", 2)),
                EnqueueOptions.defaults());

        Job done = runUntilFinished(job.id);

        assertEquals(JobStatus.COMPLETED, done.status);
        assertEquals(19, done.result.get("processed"));
        assertEquals(6, done.result.get("failed"));
    }

    @Test
    void testMaxPagesStopsEarly() {
        Job job = jobQueue.submit(TENANT, CatalogImportJobHandler.TYPE,
                Map.of("connector", InMemoryCatalogConnector.NAME, "max_pages", 1), EnqueueOptions.defaults());

        Job done = runUntilFinished(job.id);

        assertEquals(10, done.result.get("processed"));
        assertEquals(false, done.result.get("complete"));
    }

    @Test
    void testUnknownConnectorFailsPermanently() {
        Job job = jobQueue.submit(TENANT, CatalogImportJobHandler.TYPE, Map.of("connector", "nope"),
                EnqueueOptions.defaults());

        Job done = runUntilFinished(job.id);

        assertEquals(JobStatus.FAILED, done.status);
        assertTrue(done.error.contains("Unknown catalog connector 'nope'"));
    }
}

package villagecompute.jobengine.jobs;

import villagecompute.jobengine.data.models.Job;

import java.util.Map;

/**
 * Contract for job handler implementations.
 *
 * <p>
 * Built-in handlers are CDI beans annotated with {@code @ApplicationScoped}; the {@link JobTypeRegistry} discovers them
 * at startup and routes jobs by the string returned from {@link #handlesType()}. Plugin actions are adapted into
 * handlers and registered under {@code plugin:<pluginId>:<action>}.
 *
 * <p>
 * <b>Execution Model:</b>
 * <ul>
 * <li>Queued handlers run on worker pool threads, at most {@code jobengine.worker.concurrency} at a time per
 * process</li>
 * <li>Delivery is at-least-once: a worker that dies mid-run leaves the job to the reaper, which hands it to another
 * worker. Handlers must be idempotent or resume from a checkpoint ({@link JobContext#checkpoint})</li>
 * <li>Long handlers must call {@link JobContext#updateProgress} periodically; progress doubles as the heartbeat the
 * reaper watches</li>
 * <li>Cancellation is cooperative: poll {@link JobContext#throwIfCancellationRequested()} between steps</li>
 * </ul>
 *
 * <p>
 * <b>Example Implementation:</b>
 *
 * <pre>{@code
 * @ApplicationScoped
 * public class SitemapExportJobHandler implements JobHandler {
 *     @Override
 *     public String handlesType() {
 *         return "catalog:sitemap";
 *     }
 *
 *     @Override
 *     public Map<String, Object> execute(Job job, JobContext context) throws Exception {
 *         context.updateProgress(50, "Rendering sitemap");
 *         return Map.of("urls", 1200);
 *     }
 * }
 * }</pre>
 *
 * @see JobTypeRegistry
 * @see villagecompute.jobengine.services.JobWorker
 */
public interface JobHandler {

    /**
     * Returns the registry key this handler serves, e.g. {@code catalog:import} or {@code system:token_refresh}.
     */
    String handlesType();

    /**
     * Returns how the scheduler tick should run this type. Defaults to {@link ExecutionMode#QUEUED}.
     */
    default ExecutionMode executionMode() {
        return ExecutionMode.QUEUED;
    }

    /**
     * Short human-readable description shown by {@code GET /cron-jobs/types}.
     */
    default String description() {
        return handlesType();
    }

    /**
     * Executes the job.
     *
     * <p>
     * <b>Error Handling:</b> throw {@link villagecompute.jobengine.exceptions.PermanentExecutionException} for
     * failures a retry cannot fix. Anything else is treated as transient and retried with backoff until
     * {@code max_retries} is exhausted.
     *
     * @param job
     *            detached snapshot of the job row; for inline schedule firings an unsaved instance with a null id
     * @param context
     *            progress, cancellation and checkpoint access scoped to the job's tenant
     * @return result persisted into {@code jobs.result}; may be null
     * @throws Exception
     *             any failure; classified by the worker pool
     */
    Map<String, Object> execute(Job job, JobContext context) throws Exception;
}

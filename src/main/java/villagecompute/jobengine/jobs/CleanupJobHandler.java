package villagecompute.jobengine.jobs;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.jobengine.data.models.CronJobExecution;
import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.data.models.JobAttempt;
import villagecompute.jobengine.util.PayloadValues;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Retention purge for finished jobs and closed schedule executions. Queued from the daily {@code system:cleanup}
 * schedule.
 *
 * <p>
 * Payload may override {@code finished_job_days} and {@code execution_days}; otherwise the
 * {@code jobengine.retention.*} settings apply.
 */
@ApplicationScoped
public class CleanupJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(CleanupJobHandler.class);

    public static final String TYPE = "system:cleanup";

    @ConfigProperty(
            name = "jobengine.retention.finished-job-days",
            defaultValue = "30")
    int finishedJobDays;

    @ConfigProperty(
            name = "jobengine.retention.execution-days",
            defaultValue = "90")
    int executionDays;

    @Override
    public String handlesType() {
        return TYPE;
    }

    @Override
    public String description() {
        return "Purges finished jobs and closed schedule executions past their retention";
    }

    @Override
    public Map<String, Object> execute(Job job, JobContext context) {
        Instant now = Instant.now();
        Instant jobCutoff = now.minus(Duration.ofDays(PayloadValues.optionalInt(job.payload, "finished_job_days",
                finishedJobDays)));
        Instant executionCutoff = now.minus(Duration.ofDays(PayloadValues.optionalInt(job.payload, "execution_days",
                executionDays)));

        context.throwIfCancellationRequested();
        long jobsDeleted = QuarkusTransaction.requiringNew().call(() -> Job.deleteFinishedBefore(jobCutoff));
        long attemptsDeleted = QuarkusTransaction.requiringNew()
                .call(() -> JobAttempt.deleteFinishedBefore(jobCutoff));
        context.updateProgress(50, "Deleted " + jobsDeleted + " finished jobs");

        context.throwIfCancellationRequested();
        long executionsDeleted = QuarkusTransaction.requiringNew()
                .call(() -> CronJobExecution.deleteClosedBefore(executionCutoff));
        context.updateProgress(100, "Deleted " + executionsDeleted + " schedule executions");

        LOG.infof("Retention cleanup removed %d jobs and %d attempts finished before %s, %d executions closed before %s",
                jobsDeleted, attemptsDeleted, jobCutoff, executionsDeleted, executionCutoff);
        return Map.of("jobs_deleted", jobsDeleted, "attempts_deleted", attemptsDeleted, "executions_deleted",
                executionsDeleted);
    }
}

package villagecompute.jobengine.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import villagecompute.jobengine.api.types.JobStatsType;
import villagecompute.jobengine.api.types.ScheduleStatsType;
import villagecompute.jobengine.data.models.CronJob;
import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.data.models.Job.JobStatus;
import villagecompute.jobengine.exceptions.ValidationException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only statistics over job and schedule history. Nothing here mutates state.
 */
@ApplicationScoped
public class ExecutionHistoryService {

    static final Map<String, Duration> WINDOWS = Map.of("1h", Duration.ofHours(1), "24h", Duration.ofHours(24),
            "7d", Duration.ofDays(7), "30d", Duration.ofDays(30));

    /**
     * Job statistics for jobs created within {@code window} before {@code now}. Running and backlog figures are
     * current regardless of the window.
     *
     * @param window
     *            one of {@code 1h}, {@code 24h}, {@code 7d}, {@code 30d}; null means {@code 24h}
     */
    @Transactional
    public JobStatsType jobStats(String tenantId, String window, Instant now) {
        String label = window == null || window.isBlank() ? "24h" : window.trim().toLowerCase(Locale.ROOT);
        Duration span = WINDOWS.get(label);
        if (span == null) {
            throw new ValidationException("window must be one of 1h, 24h, 7d, 30d");
        }

        Map<String, Long> countsByStatus = new LinkedHashMap<>();
        for (JobStatus status : JobStatus.values()) {
            countsByStatus.put(status.name(), 0L);
        }
        Map<String, TypeAccumulator> byType = new TreeMap<>();
        long completed = 0;
        long failed = 0;

        for (Object[] row : Job.findStatsRows(tenantId, now.minus(span))) {
            String type = (String) row[0];
            JobStatus status = (JobStatus) row[1];
            Instant startedAt = (Instant) row[2];
            Instant finishedAt = (Instant) row[3];

            countsByStatus.merge(status.name(), 1L, Long::sum);
            TypeAccumulator acc = byType.computeIfAbsent(type, k -> new TypeAccumulator());
            acc.total++;
            if (status == JobStatus.COMPLETED) {
                completed++;
                acc.completed++;
                if (startedAt != null && finishedAt != null) {
                    acc.durationMs += Duration.between(startedAt, finishedAt).toMillis();
                    acc.timed++;
                }
            } else if (status == JobStatus.FAILED) {
                failed++;
                acc.failed++;
            }
        }

        List<JobStatsType.TypeStats> types = new ArrayList<>();
        byType.forEach((type, acc) -> types.add(new JobStatsType.TypeStats(type, acc.total, acc.completed,
                acc.failed, acc.timed == 0 ? null : acc.durationMs / acc.timed)));

        Map<JobStatus, Long> current = Job.countByStatus(tenantId);
        long running = current.get(JobStatus.RUNNING);
        long backlog = current.get(JobStatus.PENDING) + current.get(JobStatus.RETRYING);

        return new JobStatsType(label, countsByStatus, rate(completed, failed), running, backlog, types);
    }

    /**
     * Summary over all of a tenant's schedules, active or not.
     */
    @Transactional
    public ScheduleStatsType scheduleStats(String tenantId) {
        long total = 0;
        long active = 0;
        long paused = 0;
        long runs = 0;
        long successes = 0;
        long failures = 0;
        for (CronJob cronJob : CronJob.listByTenant(tenantId)) {
            total++;
            if (cronJob.active) {
                active++;
            }
            if (cronJob.paused) {
                paused++;
            }
            runs += cronJob.runCount;
            successes += cronJob.successCount;
            failures += cronJob.failureCount;
        }
        return new ScheduleStatsType(total, active, paused, runs, successes, failures, rate(successes, failures));
    }

    private static Double rate(long successes, long failures) {
        long finished = successes + failures;
        return finished == 0 ? null : (double) successes / finished;
    }

    private static final class TypeAccumulator {
        long total;
        long completed;
        long failed;
        long durationMs;
        long timed;
    }
}

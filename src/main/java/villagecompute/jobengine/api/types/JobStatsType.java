package villagecompute.jobengine.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;
import java.util.Map;

/**
 * Job execution statistics of a tenant over a time window.
 *
 * @param window
 *            window label, e.g. {@code 24h}
 * @param countsByStatus
 *            jobs created within the window per status
 * @param successRate
 *            completed / (completed + failed) within the window, null when nothing finished
 * @param running
 *            jobs running now
 * @param pendingBacklog
 *            jobs waiting now (PENDING and RETRYING)
 * @param byType
 *            per job type breakdown
 */
@Schema(
        description = "Job statistics over a time window")
public record JobStatsType(String window, Map<String, Long> countsByStatus, Double successRate, long running,
        long pendingBacklog, List<TypeStats> byType) {

    /**
     * Per-type figures within the window.
     */
    public record TypeStats(String type, long total, long completed, long failed, Long averageDurationMs) {
    }
}

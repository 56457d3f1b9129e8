package villagecompute.jobengine.scheduling;

/**
 * Fired after a schedule was paused for reaching its consecutive failure threshold. Owners of integration or plugin
 * schedules observe it to surface the problem to the tenant.
 */
public record ScheduleAutoPausedEvent(Long cronJobId, String tenantId, String name, String jobType, String sourceType,
        String sourceId, int consecutiveFailures, String lastError) {
}

package villagecompute.jobengine.jobs;

import java.time.Duration;
import java.util.Map;

/**
 * Optional enqueue parameters. Null fields fall back to the engine defaults: NORMAL priority, the configured retry
 * budget, no metadata, no delay.
 */
public record EnqueueOptions(JobPriority priority, Integer maxRetries, Map<String, Object> metadata, Duration delay) {

    public static EnqueueOptions defaults() {
        return new EnqueueOptions(null, null, null, null);
    }

    public EnqueueOptions withPriority(JobPriority newPriority) {
        return new EnqueueOptions(newPriority, maxRetries, metadata, delay);
    }

    public EnqueueOptions withMaxRetries(Integer newMaxRetries) {
        return new EnqueueOptions(priority, newMaxRetries, metadata, delay);
    }

    public EnqueueOptions withMetadata(Map<String, Object> newMetadata) {
        return new EnqueueOptions(priority, maxRetries, newMetadata, delay);
    }

    public EnqueueOptions withDelay(Duration newDelay) {
        return new EnqueueOptions(priority, maxRetries, metadata, newDelay);
    }
}

package villagecompute.jobengine.jobs;

import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Context for handlers run inline by the scheduler tick. Nothing is persisted: there is no job row, progress is logged
 * and checkpoints live only for the duration of the call.
 */
public class InlineJobContext implements JobContext {

    private static final Logger LOG = Logger.getLogger(InlineJobContext.class);

    private final String tenantId;
    private final String jobType;
    private final Map<String, Object> checkpoints = new HashMap<>();

    public InlineJobContext(String tenantId, String jobType) {
        this.tenantId = tenantId;
        this.jobType = jobType;
    }

    @Override
    public Long jobId() {
        return null;
    }

    @Override
    public String tenantId() {
        return tenantId;
    }

    @Override
    public void updateProgress(int percent, String message) {
        LOG.debugf("Inline %s progress %d%%: %s", jobType, Math.max(0, Math.min(100, percent)), message);
    }

    @Override
    public boolean isCancellationRequested() {
        return false;
    }

    @Override
    public void checkpoint(String key, Object value) {
        checkpoints.put(key, value);
    }

    @Override
    public Optional<Object> checkpointValue(String key) {
        return Optional.ofNullable(checkpoints.get(key));
    }
}

package villagecompute.jobengine.jobs;

import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.integration.plugins.PluginJobAction;

import java.util.Map;

/**
 * Adapts a {@link PluginJobAction} to the {@link JobHandler} contract. Not a CDI bean; created by
 * {@link JobTypeRegistry}.
 */
public class PluginActionJobHandler implements JobHandler {

    public static final String TYPE_PREFIX = "plugin:";

    private final PluginJobAction action;
    private final String type;

    public PluginActionJobHandler(PluginJobAction action) {
        this.action = action;
        this.type = typeFor(action.pluginId(), action.action());
    }

    public static String typeFor(String pluginId, String actionName) {
        return TYPE_PREFIX + pluginId + ":" + actionName;
    }

    @Override
    public String handlesType() {
        return type;
    }

    @Override
    public ExecutionMode executionMode() {
        return action.executionMode();
    }

    @Override
    public String description() {
        return action.description();
    }

    @Override
    public Map<String, Object> execute(Job job, JobContext context) throws Exception {
        return action.run(job, context);
    }
}

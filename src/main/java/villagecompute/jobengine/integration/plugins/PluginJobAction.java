package villagecompute.jobengine.integration.plugins;

import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.jobs.ExecutionMode;
import villagecompute.jobengine.jobs.JobContext;

import java.util.Map;

/**
 * Background action contributed by an installed plugin.
 *
 * <p>
 * Plugin runtimes expose each action as a CDI bean; the job type registry adapts it into a handler registered under
 * {@code plugin:<pluginId>:<action>}. How the plugin code itself is sandboxed is up to the runtime behind this
 * interface.
 */
public interface PluginJobAction {

    String pluginId();

    String action();

    default ExecutionMode executionMode() {
        return ExecutionMode.QUEUED;
    }

    default String description() {
        return "Plugin action " + pluginId() + ":" + action();
    }

    Map<String, Object> run(Job job, JobContext context) throws Exception;
}

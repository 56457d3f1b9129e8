package villagecompute.jobengine.testing;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.integration.plugins.PluginJobAction;
import villagecompute.jobengine.jobs.JobContext;

import java.util.Map;

@ApplicationScoped
public class TestPluginAction implements PluginJobAction {

    @Override
    public String pluginId() {
        return "acme";
    }

    @Override
    public String action() {
        return "sync";
    }

    @Override
    public Map<String, Object> run(Job job, JobContext context) {
        return Map.of("synced", true, "tenant", String.valueOf(context.tenantId()));
    }
}

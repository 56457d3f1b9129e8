package villagecompute.jobengine.jobs;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.jobengine.data.models.CronJob;
import villagecompute.jobengine.exceptions.HandlerNotFoundException;
import villagecompute.jobengine.integration.plugins.PluginJobAction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * String-keyed registry of job handlers.
 *
 * <p>
 * Populated once at construction from every CDI {@link JobHandler} bean and every {@link PluginJobAction} bean. Two
 * handlers claiming the same type abort startup. Further handlers can be added at runtime with
 * {@link #register(String, JobHandler)}, under the same uniqueness rule.
 *
 * <p>
 * On startup every active schedule's {@code job_type} is checked against the registry; schedules pointing at an
 * unknown type are logged as misconfigured and will fail each time they fire until fixed.
 */
@ApplicationScoped
public class JobTypeRegistry {

    private static final Logger LOG = Logger.getLogger(JobTypeRegistry.class);

    private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();

    @Inject
    public JobTypeRegistry(Instance<JobHandler> handlerBeans, Instance<PluginJobAction> pluginActions) {
        for (JobHandler handler : handlerBeans) {
            register(handler.handlesType(), handler);
        }
        for (PluginJobAction action : pluginActions) {
            PluginActionJobHandler adapter = new PluginActionJobHandler(action);
            register(adapter.handlesType(), adapter);
        }
        LOG.infof("Initialized JobTypeRegistry with %d registered handlers", handlers.size());
    }

    /**
     * Registers a handler.
     *
     * @throws IllegalStateException
     *             if {@code type} already has a handler
     */
    public void register(String type, JobHandler handler) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Job type must not be blank for " + handler.getClass().getName());
        }
        JobHandler existing = handlers.putIfAbsent(type, handler);
        if (existing != null) {
            throw new IllegalStateException("Duplicate handlers registered for job type '" + type + "': "
                    + existing.getClass().getName() + " and " + handler.getClass().getName());
        }
        LOG.debugf("Registered handler %s for job type %s (mode: %s)", handler.getClass().getSimpleName(), type,
                handler.executionMode());
    }

    /**
     * Returns the handler for {@code type}.
     *
     * @throws HandlerNotFoundException
     *             if nothing is registered under it
     */
    public JobHandler resolve(String type) {
        JobHandler handler = type == null ? null : handlers.get(type);
        if (handler == null) {
            throw new HandlerNotFoundException(type);
        }
        return handler;
    }

    public Optional<JobHandler> find(String type) {
        return Optional.ofNullable(type == null ? null : handlers.get(type));
    }

    public boolean isRegistered(String type) {
        return type != null && handlers.containsKey(type);
    }

    /**
     * Registered handlers sorted by type.
     */
    public List<JobHandler> listHandlers() {
        List<JobHandler> sorted = new ArrayList<>(handlers.values());
        sorted.sort(Comparator.comparing(JobHandler::handlesType));
        return sorted;
    }

    void verifySchedulesOnStartup(@Observes StartupEvent event) {
        List<CronJob> misconfigured = QuarkusTransaction.requiringNew()
                .call(() -> findSchedulesWithUnknownType(CronJob.findAllActive()));
        for (CronJob cronJob : misconfigured) {
            LOG.errorf("Schedule %d (%s, tenant: %s) references unregistered job type '%s'", cronJob.id, cronJob.name,
                    cronJob.tenantId, cronJob.jobType);
        }
        if (misconfigured.isEmpty()) {
            LOG.info("All active schedules reference registered job types");
        }
    }

    /**
     * Returns the schedules whose job type has no handler.
     */
    public List<CronJob> findSchedulesWithUnknownType(List<CronJob> schedules) {
        List<CronJob> unknown = new ArrayList<>();
        for (CronJob cronJob : schedules) {
            if (!isRegistered(cronJob.jobType)) {
                unknown.add(cronJob);
            }
        }
        return unknown;
    }
}

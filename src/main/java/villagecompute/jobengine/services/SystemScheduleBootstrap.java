/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.jobengine.services;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.jobengine.jobs.CleanupJobHandler;
import villagecompute.jobengine.jobs.DailyCreditDeductionJobHandler;
import villagecompute.jobengine.jobs.JobPriority;
import villagecompute.jobengine.jobs.JobTypeRegistry;
import villagecompute.jobengine.jobs.TokenRefreshJobHandler;

import java.time.Instant;
import java.util.List;

/**
 * Creates the platform-wide schedules on startup when they do not exist yet.
 *
 * <ul>
 * <li><b>Token refresh:</b> hourly, {@code 0 * * * *}</li>
 * <li><b>Daily credit deduction:</b> {@code 0 0 * * *} UTC</li>
 * <li><b>Retention cleanup:</b> {@code 30 3 * * *} UTC</li>
 * </ul>
 *
 * Existing system schedules are left untouched, so operators can pause or retime them.
 */
@ApplicationScoped
public class SystemScheduleBootstrap {

    private static final Logger LOG = Logger.getLogger(SystemScheduleBootstrap.class);

    record SystemSchedule(String name, String description, String cronExpression, String jobType,
            JobPriority priority) {
    }

    static final List<SystemSchedule> SYSTEM_SCHEDULES = List.of(
            new SystemSchedule("OAuth token refresh", "Refreshes integration tokens expiring within the hour",
                    "0 * * * *", TokenRefreshJobHandler.TYPE, JobPriority.HIGH),
            new SystemSchedule("Daily credit deduction", "Debits daily credit rates at midnight UTC", "0 0 * * *",
                    DailyCreditDeductionJobHandler.TYPE, JobPriority.HIGH),
            new SystemSchedule("Retention cleanup", "Purges finished jobs and old schedule executions",
                    "30 3 * * *", CleanupJobHandler.TYPE, JobPriority.LOW));

    @Inject
    ScheduleService schedules;

    @Inject
    JobTypeRegistry registry;

    @ConfigProperty(
            name = "jobengine.schedules.bootstrap-system-schedules",
            defaultValue = "true")
    boolean enabled;

    void onStart(@Observes StartupEvent event) {
        if (!enabled) {
            LOG.debug("System schedule bootstrap disabled");
            return;
        }
        bootstrap(Instant.now());
    }

    /**
     * @return number of system schedules present after the call
     */
    public int bootstrap(Instant now) {
        int present = 0;
        for (SystemSchedule schedule : SYSTEM_SCHEDULES) {
            if (!registry.isRegistered(schedule.jobType())) {
                LOG.warnf("Skipping system schedule '%s': no handler for %s", schedule.name(), schedule.jobType());
                continue;
            }
            schedules.ensureSystemSchedule(schedule.name(), schedule.description(), schedule.cronExpression(),
                    schedule.jobType(), schedule.priority(), now);
            present++;
        }
        LOG.infof("System schedules ready: %d of %d", present, SYSTEM_SCHEDULES.size());
        return present;
    }
}

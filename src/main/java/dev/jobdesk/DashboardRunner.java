package dev.jobdesk;

import dev.jobdesk.snapshot.DashboardService;
import dev.jobdesk.snapshot.GlanceCounts;
import dev.jobdesk.store.JobRecordStore;
import dev.jobdesk.store.StorageBootstrap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Connects to shared storage and logs the "jobs at a glance" summary for the
 * configured user.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DashboardRunner {

    private static final String SEPARATOR = "========================================";

    private final StorageBootstrap bootstrap;
    private final JobRecordStore store;
    private final DashboardService dashboardService;

    /**
     * @return number of jobs on the dashboard
     */
    public int execute() {
        log.info(SEPARATOR);
        log.info("Job Desk Starting");
        log.info(SEPARATOR);

        bootstrap.connect(store);
        Map<String, GlanceCounts> glance = dashboardService.jobsAtAGlance();

        log.info(SEPARATOR);
        log.info("Jobs at a glance ({})", dashboardService.seesAllJobs() ? "all jobs" : "my projects");
        glance.forEach((jobNumber, counts) ->
                log.info("  {}  expired: {}  today: {}  approaching: {}",
                        jobNumber, counts.expired(), counts.today(), counts.approaching()));
        if (glance.isEmpty()) {
            log.info("  nothing assigned");
        }
        log.info(SEPARATOR);
        return glance.size();
    }
}

package dev.jobdesk.snapshot;

import dev.jobdesk.config.DeskConfig;
import dev.jobdesk.model.Project;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the home screen shows: supervisors see every job, everyone else sees
 * only the projects they own.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DashboardService {

    private final SnapshotAggregator aggregator;
    private final JobsAtAGlance glance;
    private final DeskConfig deskConfig;

    public Map<String, Project> projectsOwnedBy(String owner) {
        Map<String, Project> mine = new LinkedHashMap<>();
        aggregator.existingProjects().forEach((key, project) -> {
            if (project.getOwner().equals(owner)) {
                mine.put(key, project);
            }
        });
        return mine;
    }

    public Map<String, GlanceCounts> jobsAtAGlance() {
        Map<String, Project> projects = seesAllJobs()
                ? aggregator.existingProjects()
                : projectsOwnedBy(deskConfig.getDisplayName());
        log.debug("Dashboard for {} covers {} projects", deskConfig.getUser(), projects.size());
        return glance.summarize(glance.groupByJob(projects));
    }

    public boolean seesAllJobs() {
        return deskConfig.getSupervisors().contains(deskConfig.getUser());
    }
}

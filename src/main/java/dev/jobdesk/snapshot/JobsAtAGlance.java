package dev.jobdesk.snapshot;

import dev.jobdesk.model.DueDates;
import dev.jobdesk.model.Project;
import dev.jobdesk.model.ProjectKeys;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Due-date summary per job for the dashboard.
 */
@Component
@RequiredArgsConstructor
public class JobsAtAGlance {

    static final int APPROACHING_DAYS = 3;

    private final Clock clock;

    /**
     * Regroups projects under the job number their key starts with. Keys are
     * dropped.
     */
    public Map<String, List<Project>> groupByJob(Map<String, Project> projects) {
        Map<String, List<Project>> byJob = new TreeMap<>();
        projects.forEach((key, project) ->
                byJob.computeIfAbsent(ProjectKeys.jobNumberOf(key), k -> new ArrayList<>()).add(project));
        return byJob;
    }

    public Map<String, GlanceCounts> summarize(Map<String, List<Project>> byJob) {
        return summarize(byJob, LocalDate.now(clock));
    }

    /**
     * Completed projects are ignored. Every job in the input appears in the
     * result, with zero counts if nothing is pressing.
     */
    public Map<String, GlanceCounts> summarize(Map<String, List<Project>> byJob, LocalDate today) {
        Map<String, GlanceCounts> summary = new TreeMap<>();
        byJob.forEach((jobNumber, projects) -> {
            int expired = 0;
            int dueToday = 0;
            int approaching = 0;
            for (Project project : projects) {
                if (project.isCompleted()) {
                    continue;
                }
                long days = DueDates.daysRemaining(project.getDueDate(), today);
                if (days < 0) {
                    expired++;
                } else if (days == 0) {
                    dueToday++;
                } else if (days < APPROACHING_DAYS) {
                    approaching++;
                }
            }
            summary.put(jobNumber, new GlanceCounts(expired, dueToday, approaching));
        });
        return summary;
    }
}

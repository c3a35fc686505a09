package dev.jobdesk.snapshot;

import dev.jobdesk.config.DeskConfig;
import dev.jobdesk.model.Project;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DashboardServiceTest {

    @Mock
    private SnapshotAggregator aggregator;

    private DeskConfig deskConfig;
    private DashboardService dashboardService;

    @BeforeEach
    void setUp() {
        deskConfig = new DeskConfig();
        deskConfig.setUser("jaye");
        deskConfig.setDisplayName("Jaye");
        deskConfig.setSupervisors(List.of("brandon"));
        JobsAtAGlance glance = new JobsAtAGlance(
                Clock.fixed(Instant.parse("2020-01-05T12:00:00Z"), ZoneOffset.UTC));
        dashboardService = new DashboardService(aggregator, glance, deskConfig);

        Map<String, Project> projects = new LinkedHashMap<>();
        projects.put("105000.1", new Project("105000.1", "wi", "Jaye", "01/01/2020"));
        projects.put("105000.2", new Project("105000.2", "wi", "Brandon", "01/01/2020"));
        projects.put("132068.1", new Project("132068.1", "wi", "Brandon", "01/05/2020"));
        when(aggregator.existingProjects()).thenReturn(projects);
    }

    @Test
    void technicianSeesOnlyOwnProjects() {
        Map<String, GlanceCounts> dashboard = dashboardService.jobsAtAGlance();

        assertThat(dashboardService.seesAllJobs()).isFalse();
        assertThat(dashboard).containsOnlyKeys("105000");
        assertThat(dashboard.get("105000")).isEqualTo(new GlanceCounts(1, 0, 0));
    }

    @Test
    void supervisorSeesEveryJob() {
        deskConfig.setUser("brandon");

        Map<String, GlanceCounts> dashboard = dashboardService.jobsAtAGlance();

        assertThat(dashboard).containsEntry("105000", new GlanceCounts(2, 0, 0))
                .containsEntry("132068", new GlanceCounts(0, 1, 0));
    }

    @Test
    void filtersProjectsByOwner() {
        assertThat(dashboardService.projectsOwnedBy("Brandon")).containsOnlyKeys("105000.2", "132068.1");
    }
}

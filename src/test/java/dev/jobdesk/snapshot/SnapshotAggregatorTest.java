package dev.jobdesk.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobdesk.config.DeskConfig;
import dev.jobdesk.config.StorageConfig;
import dev.jobdesk.metrics.DeskMetrics;
import dev.jobdesk.model.Job;
import dev.jobdesk.model.Project;
import dev.jobdesk.store.JobRecordCodec;
import dev.jobdesk.store.JobRecordStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SnapshotAggregatorTest {

    @TempDir
    Path root;

    private StorageConfig storageConfig;
    private DeskConfig deskConfig;
    private JobRecordCodec codec;
    private JobRecordStore store;
    private SimpleMeterRegistry registry;
    private SnapshotAggregator aggregator;

    @BeforeEach
    void setUp() throws IOException {
        storageConfig = new StorageConfig();
        storageConfig.setJobsDir(Files.createDirectories(root.resolve("jobs")));
        storageConfig.setTempDir(root.resolve("temp"));
        deskConfig = new DeskConfig();
        deskConfig.setUser("brandon");
        codec = new JobRecordCodec(new ObjectMapper());
        registry = new SimpleMeterRegistry();
        DeskMetrics metrics = new DeskMetrics(registry);
        store = new JobRecordStore(storageConfig, codec, metrics);
        aggregator = new SnapshotAggregator(store, codec, storageConfig, deskConfig, metrics);
    }

    @Test
    @DisplayName("Should merge the projects of every active job")
    void shouldMergeAllJobs() {
        saveJob("105000", "105000.177-43", "105000.177-44");
        saveJob("132068", "132068.1");

        Map<String, Project> projects = aggregator.existingProjects();

        assertThat(projects).containsOnlyKeys("105000.177-43", "105000.177-44", "132068.1");
        assertThat(registry.get("job_desk_last_snapshot_jobs").gauge().value()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should skip a job whose record is gone but whose lock marker remains")
    void shouldSkipLockOnlyJob() throws IOException {
        saveJob("105000", "105000.177-43");
        Files.createFile(store.lockPath("132068"));

        Map<String, Project> projects = aggregator.existingProjects();

        assertThat(projects).containsOnlyKeys("105000.177-43");
        assertThat(registry.get("job_desk_snapshot_jobs_skipped_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should skip a record caught halfway through a write")
    void shouldSkipCorruptRecord() throws IOException {
        saveJob("105000", "105000.177-43");
        store.create("132068", null);
        Files.write(store.recordPath("132068"), "{\"schemaVersion\":1,\"jobN".getBytes());

        assertThat(aggregator.existingProjects()).containsOnlyKeys("105000.177-43");
    }

    @Test
    @DisplayName("Should skip a job that vanishes between listing and copying")
    void shouldSkipVanishedJob() {
        JobRecordStore racing = mock(JobRecordStore.class);
        when(racing.listActive()).thenReturn(Set.of("132068"));
        when(racing.recordPath("132068")).thenReturn(root.resolve("jobs").resolve("132068.job"));
        SnapshotAggregator racingAggregator = new SnapshotAggregator(racing, codec, storageConfig, deskConfig,
                new DeskMetrics(new SimpleMeterRegistry()));

        assertThat(racingAggregator.existingProjects()).isEmpty();
    }

    @Test
    @DisplayName("Should leave no temp copies behind")
    void shouldDiscardTempCopies() throws IOException {
        saveJob("105000", "105000.177-43");

        aggregator.existingProjects();

        try (var files = Files.list(storageConfig.getTempDir())) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    @DisplayName("Should give each user a separate temp slot")
    void shouldUsePerUserSlot() {
        deskConfig.setUser("DOMAIN\\j doe");

        assertThat(aggregator.tempSlot("105000").getFileName().toString()).isEqualTo("105000.DOMAIN_j_doe");
    }

    private void saveJob(String jobNumber, String... keys) {
        store.create(jobNumber, null);
        Job job = store.load(jobNumber);
        for (String key : keys) {
            job.addProject(key, "wi", "Brandon", "01/01/2020");
        }
        store.save(jobNumber, job);
    }
}

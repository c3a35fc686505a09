package dev.jobdesk.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer meters for record store, snapshot and completion activity.
 */
@Component
public class DeskMetrics {

    private static final String TAG_OUTCOME = "outcome";

    private final MeterRegistry registry;

    // Counters
    private final Counter recordsLoadedCounter;
    private final Counter recordsSavedCounter;
    private final Counter recordsCreatedCounter;
    private final Counter snapshotJobsSkippedCounter;
    private final Counter documentsMovedCounter;
    private final Counter documentsMissingCounter;

    // Gauges
    private final AtomicInteger lastSnapshotJobs = new AtomicInteger(0);
    private final AtomicInteger lastSnapshotProjects = new AtomicInteger(0);

    public DeskMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.recordsLoadedCounter = Counter.builder("job_desk_records_loaded_total")
                .description("Job records deserialized from shared storage")
                .register(registry);

        this.recordsSavedCounter = Counter.builder("job_desk_records_saved_total")
                .description("Job records written to shared storage")
                .register(registry);

        this.recordsCreatedCounter = Counter.builder("job_desk_records_created_total")
                .description("New job records admitted")
                .register(registry);

        this.snapshotJobsSkippedCounter = Counter.builder("job_desk_snapshot_jobs_skipped_total")
                .description("Jobs left out of a snapshot because their record vanished or was unreadable")
                .register(registry);

        this.documentsMovedCounter = Counter.builder("job_desk_documents_moved_total")
                .description("Finished documents routed on completion")
                .register(registry);

        this.documentsMissingCounter = Counter.builder("job_desk_documents_missing_total")
                .description("Expected finished documents that could not be found on completion")
                .register(registry);

        Gauge.builder("job_desk_last_snapshot_jobs", lastSnapshotJobs, AtomicInteger::get)
                .description("Jobs merged into the last snapshot")
                .register(registry);

        Gauge.builder("job_desk_last_snapshot_projects", lastSnapshotProjects, AtomicInteger::get)
                .description("Projects merged into the last snapshot")
                .register(registry);
    }

    public void recordLoad() {
        recordsLoadedCounter.increment();
    }

    public void recordSave() {
        recordsSavedCounter.increment();
    }

    public void recordCreate() {
        recordsCreatedCounter.increment();
    }

    public void recordSnapshotSkip() {
        snapshotJobsSkippedCounter.increment();
    }

    public void recordSnapshot(int jobs, int projects) {
        lastSnapshotJobs.set(jobs);
        lastSnapshotProjects.set(projects);
    }

    public void recordDocuments(int moved, int missing) {
        documentsMovedCounter.increment(moved);
        documentsMissingCounter.increment(missing);
    }

    /**
     * Count a lock attempt by how it turned out.
     */
    public void recordLockAttempt(String outcome) {
        Counter.builder("job_desk_lock_attempts_total")
                .tag(TAG_OUTCOME, outcome)
                .register(registry)
                .increment();
    }
}

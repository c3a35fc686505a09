package dev.jobdesk.snapshot;

import dev.jobdesk.config.DeskConfig;
import dev.jobdesk.config.StorageConfig;
import dev.jobdesk.exception.CorruptRecordException;
import dev.jobdesk.exception.StorageUnavailableException;
import dev.jobdesk.metrics.DeskMetrics;
import dev.jobdesk.model.Job;
import dev.jobdesk.model.Project;
import dev.jobdesk.store.JobRecordCodec;
import dev.jobdesk.store.JobRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of every project in every active job, built without taking
 * any lock.
 *
 * <p>Each record is copied to this user's temp slot ({@code <job>.<user>})
 * and read from the copy, so a writer is never blocked and never sees a
 * reader holding its file open. Each job in the result reflects one complete
 * write of that job; different jobs may be sampled moments apart. Results
 * are for display only: reload under lock before editing anything seen here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotAggregator {

    private final JobRecordStore store;
    private final JobRecordCodec codec;
    private final StorageConfig storageConfig;
    private final DeskConfig deskConfig;
    private final DeskMetrics metrics;

    /**
     * All projects of all active jobs, keyed by project key.
     *
     * <p>A job whose record disappears or cannot be read while the scan is
     * running (someone just closed it, or is halfway through saving it) is
     * left out without error.
     *
     * @throws StorageUnavailableException if the jobs or temp directory cannot be reached
     */
    public Map<String, Project> existingProjects() {
        Set<String> active = store.listActive();
        prepareTempDir();

        Map<String, Project> merged = new LinkedHashMap<>();
        int sampled = 0;
        for (String jobNumber : active) {
            Optional<Job> job = snapshot(jobNumber);
            if (job.isPresent()) {
                merged.putAll(job.get().getProjects());
                sampled++;
            }
        }
        metrics.recordSnapshot(sampled, merged.size());
        log.debug("Snapshot: {} of {} active jobs, {} projects", sampled, active.size(), merged.size());
        return Collections.unmodifiableMap(merged);
    }

    /**
     * A point-in-time copy of one job, or empty if it could not be read.
     */
    public Optional<Job> snapshot(String jobNumber) {
        Path slot = tempSlot(jobNumber);
        try {
            Files.copy(store.recordPath(jobNumber), slot, StandardCopyOption.REPLACE_EXISTING);
            return Optional.of(codec.decode(jobNumber, Files.readAllBytes(slot)));
        } catch (IOException | CorruptRecordException e) {
            log.debug("Job {} skipped in snapshot: {}", jobNumber, e.getMessage());
            metrics.recordSnapshotSkip();
            return Optional.empty();
        } finally {
            discard(slot);
        }
    }

    Path tempSlot(String jobNumber) {
        String user = deskConfig.getUser().replaceAll("[^A-Za-z0-9._-]", "_");
        return storageConfig.getTempDir().resolve(jobNumber + "." + user);
    }

    private void prepareTempDir() {
        try {
            Files.createDirectories(storageConfig.getTempDir());
        } catch (IOException e) {
            throw new StorageUnavailableException("The temp directory " + storageConfig.getTempDir()
                    + " cannot be reached.", e);
        }
    }

    private void discard(Path slot) {
        try {
            Files.deleteIfExists(slot);
        } catch (IOException e) {
            // the next scan overwrites this slot anyway
            log.warn("Could not remove temp copy {}: {}", slot, e.getMessage());
        }
    }
}

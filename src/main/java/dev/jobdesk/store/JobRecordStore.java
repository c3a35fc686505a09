package dev.jobdesk.store;

import dev.jobdesk.config.StorageConfig;
import dev.jobdesk.exception.JobAlreadyExistsException;
import dev.jobdesk.exception.JobNotFoundException;
import dev.jobdesk.exception.StorageUnavailableException;
import dev.jobdesk.metrics.DeskMetrics;
import dev.jobdesk.model.Job;
import dev.jobdesk.model.ProjectKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Maps a job number to its files in the shared jobs directory: a lock marker
 * ({@code <job>.lock}) and the serialized record ({@code <job>.job}).
 *
 * <p>The store does not lock anything itself. {@link #save} trusts that the
 * caller holds the job's lock; {@link JobCheckoutService} is the caller that
 * checks. Saves overwrite the record in place, so a write interrupted halfway
 * leaves a truncated record that later loads as corrupt.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobRecordStore {

    private final StorageConfig storageConfig;
    private final JobRecordCodec codec;
    private final DeskMetrics metrics;

    /**
     * @throws StorageUnavailableException if the jobs directory cannot be listed
     */
    public boolean exists(String jobNumber) {
        return jobFileNames().anyMatch(name -> name.startsWith(jobNumber));
    }

    /**
     * Writes an empty lock marker and an empty job.
     */
    public Job create(String jobNumber, String workspace) {
        ProjectKeys.requireJobNumber(jobNumber);
        if (exists(jobNumber)) {
            throw new JobAlreadyExistsException(jobNumber);
        }
        Job job = new Job(jobNumber, workspace);
        try {
            Files.createDirectories(storageConfig.getJobsDir());
            Files.createFile(lockPath(jobNumber));
        } catch (FileAlreadyExistsException e) {
            throw new JobAlreadyExistsException(jobNumber);
        } catch (IOException e) {
            throw new StorageUnavailableException("Files for job " + jobNumber + " could not be created.", e);
        }
        save(jobNumber, job);
        metrics.recordCreate();
        log.info("Created job {} (workspace: {})", jobNumber, workspace);
        return job;
    }

    public Job load(String jobNumber) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(recordPath(jobNumber));
        } catch (NoSuchFileException e) {
            throw new JobNotFoundException(jobNumber);
        } catch (IOException e) {
            throw new StorageUnavailableException("The record for job " + jobNumber + " could not be read.", e);
        }
        Job job = codec.decode(jobNumber, bytes);
        metrics.recordLoad();
        return job;
    }

    /**
     * Overwrites the record. Callers must hold the job's lock.
     */
    public void save(String jobNumber, Job job) {
        byte[] bytes = codec.encode(job);
        try {
            Files.write(recordPath(jobNumber), bytes);
        } catch (IOException e) {
            throw new StorageUnavailableException("Job " + jobNumber + " could not be saved.", e);
        }
        metrics.recordSave();
        log.debug("Saved job {} ({} projects)", jobNumber, job.getProjects().size());
    }

    /**
     * Job numbers that have files in the jobs directory.
     */
    public Set<String> listActive() {
        return jobFileNames()
                .map(name -> name.substring(0, ProjectKeys.JOB_NUMBER_LENGTH))
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * Removes the record and lock marker of a closed job.
     *
     * @return number of files deleted
     */
    public int delete(String jobNumber) {
        int deleted = 0;
        try {
            if (Files.deleteIfExists(recordPath(jobNumber))) {
                deleted++;
            }
            if (Files.deleteIfExists(lockPath(jobNumber))) {
                deleted++;
            }
        } catch (IOException e) {
            throw new StorageUnavailableException("Files for job " + jobNumber + " could not be removed.", e);
        }
        log.info("Removed {} file(s) for job {}", deleted, jobNumber);
        return deleted;
    }

    public Path recordPath(String jobNumber) {
        return storageConfig.getJobsDir().resolve(jobNumber + storageConfig.getRecordSuffix());
    }

    public Path lockPath(String jobNumber) {
        return storageConfig.getJobsDir().resolve(jobNumber + storageConfig.getLockSuffix());
    }

    private Stream<String> jobFileNames() {
        Path dir = storageConfig.getJobsDir();
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .map(path -> path.getFileName().toString())
                    .filter(this::isJobFile)
                    .toList()
                    .stream();
        } catch (IOException e) {
            throw new StorageUnavailableException("The jobs directory " + dir + " cannot be reached.", e);
        }
    }

    private boolean isJobFile(String name) {
        return name.length() > ProjectKeys.JOB_NUMBER_LENGTH
                && ProjectKeys.isJobNumber(name.substring(0, ProjectKeys.JOB_NUMBER_LENGTH))
                && (name.endsWith(storageConfig.getRecordSuffix()) || name.endsWith(storageConfig.getLockSuffix()));
    }
}

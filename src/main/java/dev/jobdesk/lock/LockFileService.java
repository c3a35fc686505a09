package dev.jobdesk.lock;

import dev.jobdesk.config.StorageConfig;
import dev.jobdesk.exception.JobNotFoundException;
import dev.jobdesk.exception.StorageUnavailableException;
import dev.jobdesk.metrics.DeskMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * {@link LockService} backed by the job's lock marker file: the marker holds
 * the owner's name, or nothing when the job is free.
 *
 * <p>Reading and rewriting the marker happens under an OS file lock held only
 * for that read-modify-write, so two desks polling at the same moment cannot
 * both win.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LockFileService implements LockService {

    private static final Object IN_PROCESS = new Object();

    private final StorageConfig storageConfig;
    private final DeskMetrics metrics;

    @Override
    public LockOutcome acquire(String owner, String jobNumber) {
        LockOutcome outcome = withMarker(jobNumber, channel -> {
            String current = read(channel);
            if (current.isEmpty()) {
                write(channel, owner);
                return LockOutcome.acquired(owner);
            }
            if (current.equals(owner)) {
                return LockOutcome.alreadyHeld(owner);
            }
            return LockOutcome.heldByOther(current);
        });
        log.debug("Lock poll on {} by {}: {}", jobNumber, owner, outcome.result());
        metrics.recordLockAttempt(outcome.result().name().toLowerCase());
        return outcome;
    }

    @Override
    public void release(String owner, String jobNumber) {
        withMarker(jobNumber, channel -> {
            String current = read(channel);
            if (current.equals(owner)) {
                write(channel, "");
                log.debug("Lock on {} released by {}", jobNumber, owner);
            } else {
                log.warn("{} tried to release job {} but the lock belongs to '{}'", owner, jobNumber, current);
            }
            return null;
        });
    }

    @Override
    public Optional<String> currentOwner(String jobNumber) {
        String current = withMarker(jobNumber, LockFileService::read);
        return current.isEmpty() ? Optional.empty() : Optional.of(current);
    }

    private Path markerPath(String jobNumber) {
        return storageConfig.getJobsDir().resolve(jobNumber + storageConfig.getLockSuffix());
    }

    private <T> T withMarker(String jobNumber, MarkerAction<T> action) {
        // FileLock is held per JVM, so threads of this process queue here first
        synchronized (IN_PROCESS) {
            return withFileLock(jobNumber, action);
        }
    }

    private <T> T withFileLock(String jobNumber, MarkerAction<T> action) {
        try (FileChannel channel = FileChannel.open(markerPath(jobNumber),
                StandardOpenOption.READ, StandardOpenOption.WRITE);
             FileLock ignored = channel.lock()) {
            return action.apply(channel);
        } catch (NoSuchFileException e) {
            throw new JobNotFoundException(jobNumber);
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot reach the lock for job " + jobNumber + ".", e);
        }
    }

    private static String read(FileChannel channel) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate((int) channel.size());
        channel.read(buffer, 0);
        return new String(buffer.array(), StandardCharsets.UTF_8).trim();
    }

    private static void write(FileChannel channel, String owner) throws IOException {
        channel.truncate(0);
        channel.write(ByteBuffer.wrap(owner.getBytes(StandardCharsets.UTF_8)), 0);
        channel.force(true);
    }

    @FunctionalInterface
    private interface MarkerAction<T> {
        T apply(FileChannel channel) throws IOException;
    }
}

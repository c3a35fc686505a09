package dev.jobdesk.store;

import dev.jobdesk.config.StorageConfig;
import dev.jobdesk.exception.StartupException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.time.Duration;

/**
 * First contact with the shared drive. Network shares are often slow to
 * answer right after login, so this retries a few times with a fixed delay.
 * Nothing else in the store retries.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StorageBootstrap {

    private final StorageConfig storageConfig;

    /**
     * @return number of active jobs found
     * @throws StartupException once every attempt has failed
     */
    public int connect(JobRecordStore store) {
        int attempts = Math.max(1, storageConfig.getBootstrapAttempts());
        Integer active = Mono.fromCallable(() -> {
                    prepareDirectories();
                    return store.listActive().size();
                })
                .doOnError(e -> log.warn("Shared storage not ready: {}", e.getMessage()))
                .retryWhen(Retry.fixedDelay(attempts - 1L, Duration.ofMillis(storageConfig.getBootstrapDelayMillis()))
                        .onRetryExhaustedThrow((retrySpec, signal) -> new StartupException(signal.failure())))
                .block();
        log.info("Connected to {} ({} active jobs)", storageConfig.getJobsDir(), active);
        return active == null ? 0 : active;
    }

    private void prepareDirectories() {
        try {
            Files.createDirectories(storageConfig.getJobsDir());
            Files.createDirectories(storageConfig.getTempDir());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

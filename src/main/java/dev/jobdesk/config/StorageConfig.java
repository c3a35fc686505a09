package dev.jobdesk.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Where job records live on the shared drive.
 * Loaded from application.yml under 'storage' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "storage")
public class StorageConfig {

    private Path jobsDir = Path.of("data", "jobs");
    private Path tempDir = Path.of("data", "temp");
    private String recordSuffix = ".job";
    private String lockSuffix = ".lock";

    /**
     * Connection attempts made at startup before giving up.
     */
    private int bootstrapAttempts = 3;
    private long bootstrapDelayMillis = 1000;
}

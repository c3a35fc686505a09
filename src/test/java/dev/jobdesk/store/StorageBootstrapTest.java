package dev.jobdesk.store;

import dev.jobdesk.config.StorageConfig;
import dev.jobdesk.exception.StartupException;
import dev.jobdesk.exception.StorageUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StorageBootstrapTest {

    @TempDir
    Path root;

    @Mock
    private JobRecordStore store;

    private StorageConfig storageConfig;
    private StorageBootstrap bootstrap;

    @BeforeEach
    void setUp() {
        storageConfig = new StorageConfig();
        storageConfig.setJobsDir(root.resolve("jobs"));
        storageConfig.setTempDir(root.resolve("temp"));
        storageConfig.setBootstrapAttempts(3);
        storageConfig.setBootstrapDelayMillis(10);
        bootstrap = new StorageBootstrap(storageConfig);
    }

    @Test
    void connectsAndPreparesDirectories() {
        when(store.listActive()).thenReturn(Set.of("105000", "132068"));

        assertThat(bootstrap.connect(store)).isEqualTo(2);
        assertThat(root.resolve("jobs")).isDirectory();
        assertThat(root.resolve("temp")).isDirectory();
    }

    @Test
    void retriesUntilStorageAnswers() {
        when(store.listActive())
                .thenThrow(new StorageUnavailableException("not mounted", new IOException("nope")))
                .thenReturn(Set.of("105000"));

        assertThat(bootstrap.connect(store)).isEqualTo(1);
        verify(store, times(2)).listActive();
    }

    @Test
    void givesUpAfterConfiguredAttempts() {
        when(store.listActive())
                .thenThrow(new StorageUnavailableException("not mounted", new IOException("nope")));

        assertThatThrownBy(() -> bootstrap.connect(store))
                .isInstanceOf(StartupException.class)
                .hasCauseInstanceOf(StorageUnavailableException.class);
        verify(store, times(3)).listActive();
    }
}

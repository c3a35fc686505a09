package dev.jobdesk.status;

import dev.jobdesk.config.DeskConfig;
import dev.jobdesk.exception.DestinationUnresolvedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IssuedDocumentsResolverTest {

    @TempDir
    Path root;

    @Test
    void resolvesExistingJobFolder() throws IOException {
        Path folder = Files.createDirectories(root.resolve("105000"));
        DeskConfig deskConfig = new DeskConfig();
        deskConfig.setIssuedDocumentsRoot(root);

        assertThat(new IssuedDocumentsResolver(deskConfig).resolve("105000")).isEqualTo(folder);
    }

    @Test
    void failsWhenFolderIsMissing() {
        DeskConfig deskConfig = new DeskConfig();
        deskConfig.setIssuedDocumentsRoot(root);

        assertThatThrownBy(() -> new IssuedDocumentsResolver(deskConfig).resolve("105000"))
                .isInstanceOf(DestinationUnresolvedException.class)
                .hasMessageContaining("105000");
    }

    @Test
    void failsWhenNoRootIsConfigured() {
        assertThatThrownBy(() -> new IssuedDocumentsResolver(new DeskConfig()).resolve("105000"))
                .isInstanceOf(DestinationUnresolvedException.class);
    }
}

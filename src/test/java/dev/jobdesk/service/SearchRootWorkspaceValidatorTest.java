package dev.jobdesk.service;

import dev.jobdesk.config.DeskConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class SearchRootWorkspaceValidatorTest {

    @TempDir
    Path root;

    @Test
    void findsJobFolderUnderCustomerFolder() throws IOException {
        Path folder = Files.createDirectories(root.resolve("Draft").resolve("OEM").resolve("105000"));
        DeskConfig deskConfig = new DeskConfig();
        deskConfig.setWorkspaceRoots(List.of(root.resolve("missing"), root));

        assertThat(new SearchRootWorkspaceValidator(deskConfig).locate("105000", null)).contains(folder);
    }

    @Test
    void ignoresFilesNamedAfterJob() throws IOException {
        Files.createFile(root.resolve("105000"));
        DeskConfig deskConfig = new DeskConfig();
        deskConfig.setWorkspaceRoots(List.of(root));

        assertThat(new SearchRootWorkspaceValidator(deskConfig).locate("105000", null)).isEmpty();
    }

    @Test
    void movesOnToNextRootWhenWalkFails() throws IOException {
        Path broken = Files.createDirectories(root.resolve("broken"));
        Path healthy = Files.createDirectories(root.resolve("healthy"));
        Path folder = Files.createDirectories(healthy.resolve("105000"));
        DeskConfig deskConfig = new DeskConfig();
        deskConfig.setWorkspaceRoots(List.of(broken, healthy));
        SearchRootWorkspaceValidator validator = new SearchRootWorkspaceValidator(deskConfig) {
            @Override
            Stream<Path> walk(Path start) throws IOException {
                if (start.equals(broken)) {
                    return Stream.of(start).map(path -> {
                        throw new UncheckedIOException(new AccessDeniedException(path.toString()));
                    });
                }
                return super.walk(start);
            }
        };

        assertThat(validator.locate("105000", null)).contains(folder);
    }
}

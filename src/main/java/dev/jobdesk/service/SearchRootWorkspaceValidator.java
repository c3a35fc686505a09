package dev.jobdesk.service;

import dev.jobdesk.config.DeskConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Looks for a folder named after the job under the configured workspace roots.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SearchRootWorkspaceValidator implements WorkspaceValidator {

    private static final int MAX_DEPTH = 3;

    private final DeskConfig deskConfig;

    @Override
    public Optional<Path> locate(String jobNumber, String recordedWorkspace) {
        for (Path root : deskConfig.getWorkspaceRoots()) {
            if (!Files.isDirectory(root)) {
                continue;
            }
            try (Stream<Path> paths = walk(root)) {
                Optional<Path> match = paths
                        .filter(Files::isDirectory)
                        .filter(path -> path.getFileName() != null
                                && path.getFileName().toString().equals(jobNumber))
                        .findFirst();
                if (match.isPresent()) {
                    return match;
                }
            } catch (IOException | UncheckedIOException e) {
                log.warn("Workspace root {} could not be searched: {}", root, e.getMessage());
            }
        }
        return Optional.empty();
    }

    Stream<Path> walk(Path root) throws IOException {
        return Files.walk(root, MAX_DEPTH);
    }
}

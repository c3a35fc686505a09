package dev.jobdesk.status;

import dev.jobdesk.config.DeskConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Finished documents in a job's workspace and the issued folder they are
 * moved into.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkspaceDocuments {

    private final DeskConfig deskConfig;

    /**
     * Every file under the workspace with the document extension, sorted. A
     * workspace that is unset, unreachable or fails partway through the walk
     * has no documents.
     */
    public List<Path> find(String workspace) {
        if (workspace == null || workspace.isBlank() || !Files.isDirectory(Path.of(workspace))) {
            log.warn("Workspace '{}' is not reachable; no documents to route", workspace);
            return List.of();
        }
        String extension = deskConfig.getDocumentExtension().toLowerCase(Locale.ROOT);
        try (Stream<Path> files = walk(Path.of(workspace))) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(extension))
                    .sorted()
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            // walk errors past the root surface unchecked from the terminal operation
            log.warn("Workspace '{}' could not be searched: {}", workspace, e.getMessage());
            return List.of();
        }
    }

    /**
     * Moves one document into {@code folder}, replacing a file of the same
     * name.
     *
     * @return where the document ended up, or empty if it stayed in place
     */
    public Optional<Path> moveInto(Path document, Path folder) {
        Path target = folder.resolve(document.getFileName().toString());
        try {
            Files.move(document, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Moved {} to {}", document, target);
            return Optional.of(target);
        } catch (IOException e) {
            log.warn("Could not move {} to {}: {}", document, folder, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Files in {@code folder} whose name mentions the job number.
     */
    public int countFor(String jobNumber, Path folder) {
        try (Stream<Path> files = Files.list(folder)) {
            return (int) files
                    .filter(path -> path.getFileName().toString().contains(jobNumber))
                    .count();
        } catch (IOException | UncheckedIOException e) {
            log.warn("Issued folder {} could not be listed: {}", folder, e.getMessage());
            return 0;
        }
    }

    Stream<Path> walk(Path root) throws IOException {
        return Files.walk(root);
    }
}

package dev.jobdesk.status;

import dev.jobdesk.config.DeskConfig;
import dev.jobdesk.exception.DestinationUnresolvedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Resolves {@code <issued-documents-root>/<job number>}; the folder has to
 * exist already.
 */
@Component
@RequiredArgsConstructor
public class IssuedDocumentsResolver implements DocumentDestinationResolver {

    private final DeskConfig deskConfig;

    @Override
    public Path resolve(String jobNumber) {
        Path root = deskConfig.getIssuedDocumentsRoot();
        if (root == null) {
            throw new DestinationUnresolvedException(jobNumber, "no issued documents root is configured");
        }
        Path folder = root.resolve(jobNumber);
        if (!Files.isDirectory(folder)) {
            throw new DestinationUnresolvedException(jobNumber, folder + " does not exist");
        }
        return folder;
    }
}

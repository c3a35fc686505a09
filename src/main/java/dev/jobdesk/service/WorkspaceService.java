package dev.jobdesk.service;

import dev.jobdesk.exception.InvalidInputException;
import dev.jobdesk.model.Job;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Makes sure a checked-out job points at a workspace this machine can reach.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkspaceService {

    private final WorkspaceValidator validator;

    /**
     * Returns the job's workspace, asking the validator for one when the
     * recorded path is unset or unreachable. A path found that way is stored
     * on the job; the caller still has to save it.
     *
     * @throws InvalidInputException if the supplied folder is not named after the job
     */
    public Optional<Path> resolve(Job job) {
        String recorded = job.getWorkspace();
        if (recorded != null && !recorded.isBlank() && Files.isDirectory(Path.of(recorded))) {
            return Optional.of(Path.of(recorded));
        }
        Optional<Path> located = validator.locate(job.getJobNumber(), recorded);
        located.ifPresent(path -> {
            if (path.getFileName() == null || !path.getFileName().toString().endsWith(job.getJobNumber())) {
                throw new InvalidInputException("The project workspace path must end with a matching job number.");
            }
            log.info("Job {}: workspace set to {}", job.getJobNumber(), path);
            job.setWorkspace(path.toString());
        });
        return located;
    }
}

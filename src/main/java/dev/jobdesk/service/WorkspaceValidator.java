package dev.jobdesk.service;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Supplies a workspace for a job whose recorded workspace is missing or not
 * reachable from this machine.
 */
public interface WorkspaceValidator {

    Optional<Path> locate(String jobNumber, String recordedWorkspace);
}

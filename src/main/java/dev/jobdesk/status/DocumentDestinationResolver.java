package dev.jobdesk.status;

import dev.jobdesk.exception.DestinationUnresolvedException;

import java.nio.file.Path;

/**
 * Finds the folder that a job's finished documents are moved into when its
 * projects are completed.
 */
public interface DocumentDestinationResolver {

    /**
     * @throws DestinationUnresolvedException if the folder cannot be determined
     */
    Path resolve(String jobNumber);
}

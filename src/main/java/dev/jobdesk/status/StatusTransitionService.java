package dev.jobdesk.status;

import dev.jobdesk.exception.DestinationUnresolvedException;
import dev.jobdesk.exception.InvalidInputException;
import dev.jobdesk.exception.MultipleJobSelectionException;
import dev.jobdesk.metrics.DeskMetrics;
import dev.jobdesk.model.Job;
import dev.jobdesk.model.ProjectKeys;
import dev.jobdesk.model.ProjectStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Applies a status to a selection of projects in a checked-out job.
 *
 * <p>Completing projects also routes their finished documents: every file in
 * the job's workspace whose name starts with a selected drawing number
 * followed by {@code _} is moved to the job's issued documents folder.
 * Documents that cannot be found are reported back; they never hold up the
 * status change. Running the same completion twice moves nothing the second
 * time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatusTransitionService {

    private static final String TOKEN_SEPARATOR = "_";

    private final DocumentDestinationResolver destinationResolver;
    private final WorkspaceDocuments documents;
    private final DeskMetrics metrics;

    /**
     * @throws MultipleJobSelectionException  if the keys span more than one job
     * @throws DestinationUnresolvedException if completing and the destination
     *                                        cannot be found; no status is changed
     */
    public TransitionReport apply(Job job, Collection<String> keys, ProjectStatus status) {
        String jobNumber = ProjectKeys.singleJobNumber(keys);
        if (!jobNumber.equals(job.getJobNumber())) {
            throw new InvalidInputException("The selected projects do not belong to job " + job.getJobNumber() + ".");
        }
        keys.forEach(job::project);

        List<Path> moved = List.of();
        List<String> missing = List.of();
        if (status.isTerminal()) {
            Set<String> expected = new LinkedHashSet<>(ProjectKeys.drawingNumbers(keys));
            if (!expected.isEmpty()) {
                Path destination = destinationResolver.resolve(jobNumber);
                Set<String> found = new LinkedHashSet<>();
                moved = routeDocuments(job.getWorkspace(), expected, destination, found);
                missing = expected.stream().filter(id -> !found.contains(id)).toList();
                metrics.recordDocuments(moved.size(), missing.size());
                if (!missing.isEmpty()) {
                    log.warn("Job {}: no finished document found for {}", jobNumber, missing);
                }
            }
        }

        keys.forEach(key -> job.project(key).setStatus(status));
        log.info("Job {}: {} project(s) set to {}", jobNumber, keys.size(), status);
        return new TransitionReport(status.getLabel(), moved, missing);
    }

    private List<Path> routeDocuments(String workspace, Set<String> expected, Path destination, Set<String> found) {
        List<Path> moved = new ArrayList<>();
        for (Path document : documents.find(workspace)) {
            String drawingNumber = document.getFileName().toString().split(TOKEN_SEPARATOR, 2)[0];
            if (!expected.contains(drawingNumber)) {
                continue;
            }
            // a document left in place stays missing unless another copy moves
            documents.moveInto(document, destination).ifPresent(target -> {
                moved.add(target);
                found.add(drawingNumber);
            });
        }
        return moved;
    }
}

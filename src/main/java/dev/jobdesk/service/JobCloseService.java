package dev.jobdesk.service;

import dev.jobdesk.config.DeskConfig;
import dev.jobdesk.exception.JobDeskException;
import dev.jobdesk.model.DueDates;
import dev.jobdesk.model.Job;
import dev.jobdesk.model.ProjectKeys;
import dev.jobdesk.notify.CompletionNotice;
import dev.jobdesk.notify.CompletionNotifier;
import dev.jobdesk.status.DocumentDestinationResolver;
import dev.jobdesk.status.WorkspaceDocuments;
import dev.jobdesk.store.JobCheckoutService;
import dev.jobdesk.store.JobRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.List;

/**
 * Closes a finished job: takes its lock, moves every finished document from
 * the workspace into the issued documents folder, removes the job's files
 * from the desk and sends a completion notice. The lock marker goes with the
 * files.
 *
 * <p>If the issued folder cannot be resolved, or the files cannot be removed,
 * the job stays on the desk and its lock is given back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobCloseService {

    private final JobCheckoutService checkoutService;
    private final JobRecordStore store;
    private final CompletionNotifier notifier;
    private final DocumentDestinationResolver destinationResolver;
    private final WorkspaceDocuments documents;
    private final DeskConfig deskConfig;

    public CompletionNotice close(String jobNumber) {
        Job job = checkoutService.checkout(jobNumber);
        CompletionNotice notice;
        try {
            Path issued = destinationResolver.resolve(jobNumber);
            int moved = transferDocuments(job, issued);
            List<String> drawings = ProjectKeys.drawingNumbers(job.getProjects().keySet());
            notice = new CompletionNotice(
                    jobNumber,
                    deskConfig.getUser(),
                    DueDates.latestDueDate(job),
                    drawings.size(),
                    incompleteCount(job, drawings),
                    job.getProjects().size(),
                    documents.countFor(jobNumber, issued));
            log.info("Job {}: moved {} document(s) to {}", jobNumber, moved, issued);

            store.delete(jobNumber);
        } catch (RuntimeException e) {
            giveBack(jobNumber, e);
            throw e;
        }
        log.info("{} completed, due by {}", jobNumber, notice.latestDueDate());

        Boolean delivered = notifier.jobCompleted(notice)
                .onErrorResume(e -> {
                    log.error("Completion notice for {} failed: {}", jobNumber, e.getMessage());
                    return Mono.just(false);
                })
                .block();
        if (!Boolean.TRUE.equals(delivered)) {
            log.warn("Job {} closed but its completion notice was not delivered", jobNumber);
        }
        return notice;
    }

    private int transferDocuments(Job job, Path issued) {
        int moved = 0;
        for (Path document : documents.find(job.getWorkspace())) {
            if (documents.moveInto(document, issued).isPresent()) {
                moved++;
            }
        }
        return moved;
    }

    private static int incompleteCount(Job job, List<String> drawings) {
        return (int) drawings.stream()
                .filter(key -> !job.project(key).isCompleted())
                .count();
    }

    private void giveBack(String jobNumber, RuntimeException cause) {
        log.error("Job {} could not be closed: {}", jobNumber, cause.getMessage());
        try {
            checkoutService.release(jobNumber);
        } catch (JobDeskException e) {
            // the marker may already be gone along with the record
            cause.addSuppressed(e);
        }
    }
}

package dev.jobdesk.service;

import dev.jobdesk.config.DeskConfig;
import dev.jobdesk.exception.InvalidInputException;
import dev.jobdesk.exception.LockViolationException;
import dev.jobdesk.model.DueDates;
import dev.jobdesk.model.Job;
import dev.jobdesk.model.Project;
import dev.jobdesk.model.ProjectKeys;
import dev.jobdesk.store.JobCheckoutService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

/**
 * Edits applied to selected projects of a job the current user has checked
 * out. Every selection must fall within that one job. Changes stay in memory
 * until {@link JobCheckoutService#save} is called.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectEditService {

    private final JobCheckoutService checkoutService;
    private final DeskConfig deskConfig;

    public Project newProject(Job job, String key, String workInstructions, String owner, String dueDate) {
        requireEditable(job, List.of(key));
        Project project = job.addProject(key, workInstructions, owner, dueDate);
        log.debug("Job {}: added project {}", job.getJobNumber(), key);
        return project;
    }

    public void setDueDate(Job job, Collection<String> keys, String dueDate) {
        requireEditable(job, keys);
        String normalized = DueDates.normalize(dueDate);
        keys.forEach(key -> job.project(key).setDueDate(normalized));
    }

    public void setOwner(Job job, Collection<String> keys, String owner) {
        requireEditable(job, keys);
        keys.forEach(key -> job.project(key).setOwner(owner));
    }

    public void setAliasNumber(Job job, Collection<String> keys, String aliasNumber) {
        requireEditable(job, keys);
        keys.forEach(key -> job.project(key).setAliasNumber(aliasNumber));
    }

    public void addNote(Job job, Collection<String> keys, String note) {
        requireEditable(job, keys);
        String author = deskConfig.getDisplayName().isBlank() ? deskConfig.getUser() : deskConfig.getDisplayName();
        keys.forEach(key -> job.project(key).getNotes().add(note, author));
    }

    public void delete(Job job, Collection<String> keys) {
        requireEditable(job, keys);
        keys.forEach(job::removeProject);
        log.debug("Job {}: deleted {}", job.getJobNumber(), keys);
    }

    /**
     * Stores a project under a new key, e.g. once its drawing number is known.
     */
    public void renameKey(Job job, String oldKey, String newKey) {
        requireEditable(job, List.of(oldKey, newKey));
        job.renameProject(oldKey, newKey);
    }

    /**
     * @return the keys of the copies, in selection order
     */
    public List<String> duplicate(Job job, Collection<String> keys) {
        requireEditable(job, keys);
        return keys.stream().map(job::duplicateProject).toList();
    }

    private void requireEditable(Job job, Collection<String> keys) {
        String jobNumber = ProjectKeys.singleJobNumber(keys);
        if (!jobNumber.equals(job.getJobNumber())) {
            throw new InvalidInputException(
                    "The selected projects do not belong to job " + job.getJobNumber() + ".");
        }
        if (!checkoutService.isCheckedOut(job.getJobNumber())) {
            throw new LockViolationException(job.getJobNumber());
        }
    }
}

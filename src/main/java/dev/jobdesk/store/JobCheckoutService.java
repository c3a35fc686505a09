package dev.jobdesk.store;

import dev.jobdesk.config.DeskConfig;
import dev.jobdesk.exception.JobInUseException;
import dev.jobdesk.exception.JobNotFoundException;
import dev.jobdesk.exception.LockViolationException;
import dev.jobdesk.lock.LockOutcome;
import dev.jobdesk.lock.LockService;
import dev.jobdesk.model.Job;
import dev.jobdesk.model.ProjectKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Editing access to job records for the user running this desk.
 *
 * <p>A job is checked out by taking its lock and loading it, edited in
 * memory, then saved while the lock is still ours. The ownership check and
 * the write are two separate calls; nothing stops another desk from clearing
 * the marker in between.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobCheckoutService {

    private final JobRecordStore store;
    private final LockService lockService;
    private final DeskConfig deskConfig;

    /**
     * Creates a job record. The new job is not checked out.
     */
    public Job create(String jobNumber, String workspace) {
        return store.create(ProjectKeys.requireJobNumber(jobNumber), workspace);
    }

    /**
     * Locks the job for this user and loads it.
     *
     * @throws JobNotFoundException if the job has no files
     * @throws JobInUseException    if another user holds the lock
     */
    public Job checkout(String jobNumber) {
        ProjectKeys.requireJobNumber(jobNumber);
        if (!store.exists(jobNumber)) {
            throw new JobNotFoundException(jobNumber);
        }
        String user = deskConfig.getUser();
        LockOutcome outcome = lockService.acquire(user, jobNumber);
        if (!outcome.granted()) {
            throw new JobInUseException(jobNumber, outcome.owner());
        }
        log.info("{} checked out job {}", user, jobNumber);
        return store.load(jobNumber);
    }

    /**
     * @throws LockViolationException if this user no longer holds the lock
     */
    public void save(Job job) {
        String jobNumber = job.getJobNumber();
        if (!lockService.isHeldBy(deskConfig.getUser(), jobNumber)) {
            throw new LockViolationException(jobNumber);
        }
        store.save(jobNumber, job);
    }

    public void saveAndRelease(Job job) {
        save(job);
        release(job.getJobNumber());
    }

    public void release(String jobNumber) {
        lockService.release(deskConfig.getUser(), jobNumber);
        log.info("{} released job {}", deskConfig.getUser(), jobNumber);
    }

    public boolean isCheckedOut(String jobNumber) {
        return lockService.isHeldBy(deskConfig.getUser(), jobNumber);
    }
}

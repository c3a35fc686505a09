package dev.jobdesk.exception;

/**
 * A save was attempted by a user who does not hold the job's lock.
 */
public class LockViolationException extends JobDeskException {

    public LockViolationException(String jobNumber) {
        super(DeskErrorCode.SECURITY_VIOLATION,
                "The rights to job " + jobNumber + " belong to another user. Changes were not saved.");
    }
}

package dev.jobdesk.exception;

/**
 * The job's lock is held by someone else. Carries the holder so the desk can
 * tell the user who to talk to.
 */
public class JobInUseException extends JobDeskException {

    private final String owner;

    public JobInUseException(String jobNumber, String owner) {
        super(DeskErrorCode.IN_USE, "Job " + jobNumber + " is locked by user '" + owner + "'.");
        this.owner = owner;
    }

    public String getOwner() {
        return owner;
    }
}

package dev.jobdesk.exception;

public class JobAlreadyExistsException extends JobDeskException {

    public JobAlreadyExistsException(String jobNumber) {
        super(DeskErrorCode.ALREADY_EXISTS,
                "Job " + jobNumber + " already exists. Try opening the existing job.");
    }
}

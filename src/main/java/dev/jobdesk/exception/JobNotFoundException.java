package dev.jobdesk.exception;

public class JobNotFoundException extends JobDeskException {

    private final String jobNumber;

    public JobNotFoundException(String jobNumber) {
        super(DeskErrorCode.NOT_FOUND,
                "Job " + jobNumber + " cannot be found. Check the job number and try again.");
        this.jobNumber = jobNumber;
    }

    public String getJobNumber() {
        return jobNumber;
    }
}

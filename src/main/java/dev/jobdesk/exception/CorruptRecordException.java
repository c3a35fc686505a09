package dev.jobdesk.exception;

public class CorruptRecordException extends JobDeskException {

    public CorruptRecordException(String jobNumber, String reason) {
        super(DeskErrorCode.CORRUPT, "The record for job " + jobNumber + " is unreadable: " + reason);
    }

    public CorruptRecordException(String jobNumber, Throwable cause) {
        super(DeskErrorCode.CORRUPT, "The record for job " + jobNumber + " is unreadable.", cause);
    }
}

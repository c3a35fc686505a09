package dev.jobdesk.exception;

public class DestinationUnresolvedException extends JobDeskException {

    public DestinationUnresolvedException(String jobNumber, String reason) {
        super(DeskErrorCode.DESTINATION_UNRESOLVED,
                "Cannot determine where finished documents for job " + jobNumber + " belong: " + reason);
    }

    public DestinationUnresolvedException(String jobNumber, Throwable cause) {
        super(DeskErrorCode.DESTINATION_UNRESOLVED,
                "Cannot determine where finished documents for job " + jobNumber + " belong.", cause);
    }
}

package dev.jobdesk.exception;

public class StartupException extends JobDeskException {

    public StartupException(Throwable cause) {
        super(DeskErrorCode.STARTUP_FAILURE,
                "The job storage is temporarily unavailable. If this problem continues, contact admin.", cause);
    }
}

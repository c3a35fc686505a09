package dev.jobdesk.exception;

/**
 * Base class for every failure raised by the job desk core.
 *
 * <p>Messages are written for the person at the desk: they are shown as-is,
 * so keep them short and actionable.
 */
public class JobDeskException extends RuntimeException {

    private final DeskErrorCode code;

    public JobDeskException(DeskErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public JobDeskException(DeskErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public DeskErrorCode getCode() {
        return code;
    }
}

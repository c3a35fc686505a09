package dev.jobdesk.exception;

public class StorageUnavailableException extends JobDeskException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(DeskErrorCode.IO_FAILURE, message, cause);
    }
}

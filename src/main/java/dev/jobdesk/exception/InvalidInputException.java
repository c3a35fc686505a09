package dev.jobdesk.exception;

public class InvalidInputException extends JobDeskException {

    public InvalidInputException(String message) {
        super(DeskErrorCode.INVALID_INPUT, message + " Try again.");
    }
}

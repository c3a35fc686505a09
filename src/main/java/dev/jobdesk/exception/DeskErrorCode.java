package dev.jobdesk.exception;

/**
 * Failure categories surfaced to the caller that triggered a store operation.
 */
public enum DeskErrorCode {
    NOT_FOUND,
    ALREADY_EXISTS,
    IN_USE,
    CORRUPT,
    IO_FAILURE,
    SECURITY_VIOLATION,
    AMBIGUOUS_SELECTION,
    DESTINATION_UNRESOLVED,
    INVALID_INPUT,
    STARTUP_FAILURE
}

package dev.jobdesk.exception;

import java.util.Set;

public class MultipleJobSelectionException extends JobDeskException {

    public MultipleJobSelectionException(Set<String> jobNumbers) {
        super(DeskErrorCode.AMBIGUOUS_SELECTION,
                "Only one job may be modified at a time (selection spans " + jobNumbers + ").");
    }
}

package dev.jobdesk.status;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a status change.
 *
 * @param status                the status every selected project now has
 * @param movedDocuments        where each routed document ended up
 * @param missingDrawingNumbers drawing numbers for which no document was found
 */
public record TransitionReport(String status, List<Path> movedDocuments, List<String> missingDrawingNumbers) {

    public boolean hasMissingDocuments() {
        return !missingDrawingNumbers.isEmpty();
    }
}

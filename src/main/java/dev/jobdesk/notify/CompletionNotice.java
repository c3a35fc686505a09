package dev.jobdesk.notify;

/**
 * Confirmation that a job was closed out, with its document control counts.
 *
 * @param jobNumber          the closed job
 * @param closedBy           desk user who closed it
 * @param latestDueDate      latest project due date, or "not found"
 * @param drawingCount       projects stored under a drawing number
 * @param incompleteDrawings drawings that were not completed when the job closed
 * @param projectCount       all projects in the job
 * @param documentsFound     files for the job in its issued documents folder
 */
public record CompletionNotice(String jobNumber, String closedBy, String latestDueDate,
                               int drawingCount, int incompleteDrawings, int projectCount,
                               int documentsFound) {
}

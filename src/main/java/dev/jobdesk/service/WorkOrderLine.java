package dev.jobdesk.service;

/**
 * One unassigned work order read from the department workbook. Parsing the
 * workbook happens elsewhere.
 */
public record WorkOrderLine(String aliasNumber, String workInstructions, String dueDate) {
}

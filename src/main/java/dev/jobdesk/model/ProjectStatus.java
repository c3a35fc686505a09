package dev.jobdesk.model;

import dev.jobdesk.exception.InvalidInputException;

import java.util.Arrays;

/**
 * Work order status, in workflow order. {@link #COMPLETED} is terminal and is
 * the only status whose assignment routes documents.
 */
public enum ProjectStatus {
    UNASSIGNED("Unassigned"),
    IN_PROCESS("In Process"),
    ON_HOLD("On Hold"),
    AT_REVIEW("At Review"),
    COMPLETED("Completed");

    private final String label;

    ProjectStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isTerminal() {
        return this == COMPLETED;
    }

    public static ProjectStatus fromLabel(String label) {
        return Arrays.stream(values())
                .filter(status -> status.label.equals(label))
                .findFirst()
                .orElseThrow(() -> new InvalidInputException("Unknown project status '" + label + "'."));
    }

    @Override
    public String toString() {
        return label;
    }
}

package dev.jobdesk.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.Objects;

/**
 * One released work order. A project does not know the key it is stored
 * under; the owning {@link Job} does.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Project {

    public static final String UNASSIGNED_OWNER = "Unassigned";

    @Setter
    private String aliasNumber;
    private String owner;
    private String dueDate;
    private ProjectStatus status;
    private final NoteLog notes;

    public Project(String aliasNumber, String workInstructions, String owner, String dueDate) {
        this(aliasNumber, owner, dueDate, ProjectStatus.UNASSIGNED, new NoteLog(workInstructions));
    }

    public Project(String aliasNumber, String owner, String dueDate, ProjectStatus status, NoteLog notes) {
        this.aliasNumber = aliasNumber;
        setOwner(owner);
        this.dueDate = DueDates.normalize(dueDate);
        this.status = Objects.requireNonNull(status, "status");
        this.notes = Objects.requireNonNull(notes, "notes");
    }

    public void setOwner(String owner) {
        this.owner = owner == null ? "" : owner;
    }

    public void setDueDate(String dueDate) {
        this.dueDate = DueDates.normalize(dueDate);
    }

    public void setStatus(ProjectStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    public boolean isCompleted() {
        return status.isTerminal();
    }

    public boolean isUnassigned() {
        return owner.isBlank() || UNASSIGNED_OWNER.equals(owner);
    }

    /**
     * A fresh project carrying this one's instructions, owner, due date,
     * status and alias, with the note history reset.
     */
    public Project copy() {
        return new Project(aliasNumber, owner, dueDate, status, new NoteLog(notes.getWorkInstructions()));
    }
}

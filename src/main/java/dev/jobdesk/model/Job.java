package dev.jobdesk.model;

import dev.jobdesk.exception.InvalidInputException;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The work orders billed under one 6-digit job number.
 *
 * <p>Projects are kept in insertion order under a key that the user may later
 * change (an alias number becomes a drawing number, for instance). Renaming a
 * key moves the same {@link Project} value; nothing else refers to the key.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Job {

    private final String jobNumber;
    @Setter
    private String workspace;
    @Getter(AccessLevel.NONE)
    private final LinkedHashMap<String, Project> projects = new LinkedHashMap<>();

    public Job(String jobNumber, String workspace) {
        this.jobNumber = ProjectKeys.requireJobNumber(jobNumber);
        this.workspace = workspace;
    }

    public Map<String, Project> getProjects() {
        return Collections.unmodifiableMap(projects);
    }

    public Project addProject(String key, String workInstructions, String owner, String dueDate) {
        return putProject(key, new Project(key, workInstructions, owner, dueDate));
    }

    public Project putProject(String key, Project project) {
        if (projects.containsKey(key)) {
            throw new InvalidInputException("Project " + key + " already exists in job " + jobNumber + ".");
        }
        projects.put(key, project);
        return project;
    }

    public boolean hasProject(String key) {
        return projects.containsKey(key);
    }

    public Project project(String key) {
        Project project = projects.get(key);
        if (project == null) {
            throw new InvalidInputException("Project " + key + " does not exist in job " + jobNumber + ".");
        }
        return project;
    }

    public Project removeProject(String key) {
        project(key);
        return projects.remove(key);
    }

    /**
     * Moves a project to a new key. Renaming a key to itself changes nothing.
     */
    public void renameProject(String oldKey, String newKey) {
        Project project = project(oldKey);
        if (oldKey.equals(newKey)) {
            return;
        }
        if (projects.containsKey(newKey)) {
            throw new InvalidInputException("Project " + newKey + " already exists in job " + jobNumber + ".");
        }
        projects.put(newKey, project);
        projects.remove(oldKey);
    }

    /**
     * Copies a project under the first free {@code "<key> (n)"} key, n starting at 2.
     *
     * @return the new key
     */
    public String duplicateProject(String key) {
        Project source = project(key);
        int n = 2;
        while (projects.containsKey(ProjectKeys.copyKey(key, n))) {
            n++;
        }
        String copyKey = ProjectKeys.copyKey(key, n);
        projects.put(copyKey, source.copy());
        return copyKey;
    }
}

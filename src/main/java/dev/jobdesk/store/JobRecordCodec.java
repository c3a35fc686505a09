package dev.jobdesk.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobdesk.exception.CorruptRecordException;
import dev.jobdesk.exception.JobDeskException;
import dev.jobdesk.model.Job;
import dev.jobdesk.model.NoteLog;
import dev.jobdesk.model.Project;
import dev.jobdesk.model.ProjectStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the on-disk form of a {@link Job}.
 *
 * <p>The document is JSON with an explicit {@code schemaVersion}. Projects
 * and notes are written as arrays so their order is part of the data, not an
 * accident of map iteration.
 */
@Component
@RequiredArgsConstructor
public class JobRecordCodec {

    public static final int SCHEMA_VERSION = 1;

    private final ObjectMapper objectMapper;

    record JobDocument(int schemaVersion, String jobNumber, String workspace, List<ProjectDocument> projects) {
    }

    record ProjectDocument(String key, String aliasNumber, String owner, String dueDate, String status,
                           List<NoteDocument> notes) {
    }

    record NoteDocument(String label, String text) {
    }

    public byte[] encode(Job job) {
        List<ProjectDocument> projects = job.getProjects().entrySet().stream()
                .map(entry -> toDocument(entry.getKey(), entry.getValue()))
                .toList();
        JobDocument document = new JobDocument(SCHEMA_VERSION, job.getJobNumber(), job.getWorkspace(), projects);
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Job " + job.getJobNumber() + " could not be serialized", e);
        }
    }

    /**
     * @throws CorruptRecordException if the bytes are empty, not a job
     *                                document, or written by an unknown schema
     */
    public Job decode(String jobNumber, byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new CorruptRecordException(jobNumber, "the record is empty");
        }
        JobDocument document;
        try {
            document = objectMapper.readValue(bytes, JobDocument.class);
        } catch (IOException e) {
            throw new CorruptRecordException(jobNumber, e);
        }
        if (document == null || document.schemaVersion() != SCHEMA_VERSION) {
            throw new CorruptRecordException(jobNumber, "unsupported schema version "
                    + (document == null ? "none" : document.schemaVersion()));
        }
        try {
            return toJob(document);
        } catch (JobDeskException | IllegalArgumentException | NullPointerException e) {
            throw new CorruptRecordException(jobNumber, e);
        }
    }

    private ProjectDocument toDocument(String key, Project project) {
        List<NoteDocument> notes = project.getNotes().entries().entrySet().stream()
                .map(note -> new NoteDocument(note.getKey(), note.getValue()))
                .toList();
        return new ProjectDocument(key, project.getAliasNumber(), project.getOwner(), project.getDueDate(),
                project.getStatus().getLabel(), notes);
    }

    private Job toJob(JobDocument document) {
        Job job = new Job(document.jobNumber(), document.workspace());
        if (document.projects() == null) {
            return job;
        }
        for (ProjectDocument p : document.projects()) {
            Map<String, String> notes = new LinkedHashMap<>();
            for (NoteDocument note : p.notes()) {
                notes.put(note.label(), note.text());
            }
            job.putProject(p.key(), new Project(p.aliasNumber(), p.owner(), p.dueDate(),
                    ProjectStatus.fromLabel(p.status()), NoteLog.restore(notes)));
        }
        return job;
    }
}

package dev.jobdesk.model;

import dev.jobdesk.exception.InvalidInputException;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Chronological project notes. The first entry is always the work
 * instructions; everything after it is appended with a timestamp and author
 * label and is never reordered or removed.
 */
@EqualsAndHashCode
@ToString
public class NoteLog {

    public static final String WORK_INSTRUCTIONS = "Work Instructions";

    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("MM/dd/yyyy @ hh:mm:ss a", Locale.US);

    private final LinkedHashMap<String, String> entries = new LinkedHashMap<>();

    public NoteLog(String workInstructions) {
        entries.put(WORK_INSTRUCTIONS, workInstructions == null ? "" : workInstructions);
    }

    /**
     * Rebuilds a log from persisted entries, in order.
     */
    public static NoteLog restore(Map<String, String> ordered) {
        if (ordered.isEmpty() || !WORK_INSTRUCTIONS.equals(ordered.keySet().iterator().next())) {
            throw new IllegalArgumentException("Note history must start with '" + WORK_INSTRUCTIONS + "'");
        }
        NoteLog log = new NoteLog(ordered.get(WORK_INSTRUCTIONS));
        ordered.forEach(log.entries::putIfAbsent);
        return log;
    }

    public String add(String note, String author) {
        return add(note, author, LocalDateTime.now());
    }

    /**
     * Appends a note and returns the label it was stored under.
     */
    public String add(String note, String author, LocalDateTime at) {
        if (note == null || note.isBlank()) {
            throw new InvalidInputException("No project note was entered.");
        }
        String base = at.format(STAMP) + " by " + author;
        String label = base;
        // two notes by the same author within one second
        for (int n = 2; entries.containsKey(label); n++) {
            label = base + " (" + n + ")";
        }
        entries.put(label, note);
        return label;
    }

    public String getWorkInstructions() {
        return entries.get(WORK_INSTRUCTIONS);
    }

    public Map<String, String> entries() {
        return Collections.unmodifiableMap(entries);
    }

    public int size() {
        return entries.size();
    }
}

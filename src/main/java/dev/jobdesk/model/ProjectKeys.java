package dev.jobdesk.model;

import dev.jobdesk.exception.InvalidInputException;
import dev.jobdesk.exception.MultipleJobSelectionException;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Helpers for the two key shapes a project can be stored under: alias numbers
 * ({@code 105000.177-43}) and drawing numbers ({@code 105000-PART-PROC-DTL}).
 * Both start with the job number.
 */
public final class ProjectKeys {

    public static final int JOB_NUMBER_LENGTH = 6;

    private static final Pattern JOB_NUMBER = Pattern.compile("\\d{6}");

    private ProjectKeys() {
    }

    public static boolean isJobNumber(String text) {
        return text != null && JOB_NUMBER.matcher(text).matches();
    }

    public static String requireJobNumber(String text) {
        if (!isJobNumber(text)) {
            throw new InvalidInputException("The job number must be a 6-digit integer.");
        }
        return text;
    }

    public static boolean isDrawingNumber(String key) {
        return key != null && key.chars().filter(c -> c == '-').count() == 3;
    }

    public static String jobNumberOf(String key) {
        if (key == null || key.length() < JOB_NUMBER_LENGTH) {
            throw new InvalidInputException("'" + key + "' does not start with a job number.");
        }
        return key.substring(0, JOB_NUMBER_LENGTH);
    }

    public static List<String> drawingNumbers(Collection<String> keys) {
        return keys.stream().filter(ProjectKeys::isDrawingNumber).toList();
    }

    /**
     * The job every key belongs to.
     *
     * @throws MultipleJobSelectionException if the keys span more than one job
     */
    public static String singleJobNumber(Collection<String> keys) {
        if (keys.isEmpty()) {
            throw new InvalidInputException("No projects were selected.");
        }
        Set<String> jobNumbers = new TreeSet<>();
        keys.forEach(key -> jobNumbers.add(jobNumberOf(key)));
        if (jobNumbers.size() > 1) {
            throw new MultipleJobSelectionException(jobNumbers);
        }
        return jobNumbers.iterator().next();
    }

    public static String copyKey(String key, int n) {
        return key + " (" + n + ")";
    }
}

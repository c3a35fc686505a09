package dev.jobdesk.model;

import dev.jobdesk.exception.InvalidInputException;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Due dates travel as {@code MM/dd/yyyy} strings. Anything that compares them
 * goes through here so they are always parsed first.
 */
public final class DueDates {

    public static final String NOT_FOUND = "not found";

    private static final DateTimeFormatter PARSER =
            DateTimeFormatter.ofPattern("M/d/uuuu").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter PRINTER = DateTimeFormatter.ofPattern("MM/dd/uuuu");

    private DueDates() {
    }

    public static LocalDate parse(String dueDate) {
        if (dueDate == null || dueDate.isBlank()) {
            throw new InvalidInputException("A due date is required.");
        }
        try {
            return LocalDate.parse(dueDate.trim(), PARSER);
        } catch (DateTimeParseException e) {
            throw new InvalidInputException("'" + dueDate + "' is not a valid MM/DD/YYYY date.");
        }
    }

    public static Optional<LocalDate> tryParse(String dueDate) {
        try {
            return Optional.of(parse(dueDate));
        } catch (InvalidInputException e) {
            return Optional.empty();
        }
    }

    public static String format(LocalDate date) {
        return date.format(PRINTER);
    }

    /**
     * Normalizes any accepted spelling ("1/5/2020") to the stored form ("01/05/2020").
     */
    public static String normalize(String dueDate) {
        return format(parse(dueDate));
    }

    /**
     * Negative when the date has passed.
     */
    public static long daysRemaining(String dueDate, LocalDate today) {
        return ChronoUnit.DAYS.between(today, parse(dueDate));
    }

    /**
     * Latest due date across a job's projects, or {@link #NOT_FOUND} when the
     * job has no project with a readable date.
     */
    public static String latestDueDate(Job job) {
        return job.getProjects().values().stream()
                .map(Project::getDueDate)
                .map(DueDates::tryParse)
                .flatMap(Optional::stream)
                .max(LocalDate::compareTo)
                .map(DueDates::format)
                .orElse(NOT_FOUND);
    }
}

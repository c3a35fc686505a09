package dev.jobdesk.snapshot;

/**
 * Open projects of one job bucketed by how close they are to their due date.
 *
 * @param expired     past due
 * @param today       due today
 * @param approaching due within the next two days
 */
public record GlanceCounts(int expired, int today, int approaching) {

    public static final GlanceCounts NONE = new GlanceCounts(0, 0, 0);

    public int total() {
        return expired + today + approaching;
    }
}

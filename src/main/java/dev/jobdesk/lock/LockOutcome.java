package dev.jobdesk.lock;

/**
 * Result of a single, non-blocking lock poll.
 *
 * @param result what happened
 * @param owner  the identity holding the lock after the poll
 */
public record LockOutcome(Result result, String owner) {

    public enum Result {
        ACQUIRED,
        ALREADY_HELD,
        HELD_BY_OTHER
    }

    public static LockOutcome acquired(String owner) {
        return new LockOutcome(Result.ACQUIRED, owner);
    }

    public static LockOutcome alreadyHeld(String owner) {
        return new LockOutcome(Result.ALREADY_HELD, owner);
    }

    public static LockOutcome heldByOther(String owner) {
        return new LockOutcome(Result.HELD_BY_OTHER, owner);
    }

    /**
     * Acquired now or already ours: either way the caller may edit.
     */
    public boolean granted() {
        return result != Result.HELD_BY_OTHER;
    }
}

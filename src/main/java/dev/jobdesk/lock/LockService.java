package dev.jobdesk.lock;

import java.util.Optional;

/**
 * Advisory single-writer lock per job number.
 *
 * <p>Only cooperating callers are constrained. A grant has no lease: if the
 * holder's process dies the job stays locked until someone clears it by hand.
 */
public interface LockService {

    /**
     * Poll for the lock once. Never waits.
     */
    LockOutcome acquire(String owner, String jobNumber);

    /**
     * Give the lock up. Does nothing if {@code owner} does not hold it.
     */
    void release(String owner, String jobNumber);

    Optional<String> currentOwner(String jobNumber);

    default boolean isHeldBy(String owner, String jobNumber) {
        return currentOwner(jobNumber).filter(owner::equals).isPresent();
    }
}

package medguard.core.service.common;

/**
 * Hook run after a state change is computed and before it is stored.
 *
 * <p>The engines call the guard while holding the entity's write lock. If the guard
 * throws, nothing is stored and the exception propagates. The policy facade uses
 * this to wait for the audit acknowledgement so that no state change becomes
 * visible without a recorded audit trail.
 *
 * @param <T> the entity type
 */
@FunctionalInterface
public interface CommitGuard<T> {

    /**
     * Inspect the pending state.
     *
     * @param previous the stored version, or null when creating
     * @param pending  the version about to be stored
     */
    void beforeCommit(T previous, T pending);

    /**
     * A guard that accepts every change.
     */
    static <T> CommitGuard<T> none() {
        return (previous, pending) -> {};
    }
}

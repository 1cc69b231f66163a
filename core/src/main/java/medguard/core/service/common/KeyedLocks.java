package medguard.core.service.common;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped per-key locks serializing writes to a single entity.
 *
 * <p>Each key hashes to one of a fixed number of stripes, so memory stays bounded
 * no matter how many keys are seen. Two keys may share a stripe; that only costs
 * some concurrency. Reads never take these locks.
 *
 * <p>Locks from different instances must always be acquired in one global order
 * (threat locks before incident locks) to rule out deadlock. Locks are reentrant,
 * so nested acquisition of the same key is safe.
 */
public class KeyedLocks {

    private static final int DEFAULT_STRIPES = 64;

    private final String domain;
    private final ReentrantLock[] stripes;

    public KeyedLocks(String domain) {
        this(domain, DEFAULT_STRIPES);
    }

    public KeyedLocks(String domain, int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("Stripe count must be positive");
        }
        this.domain = domain;
        this.stripes = new ReentrantLock[stripeCount];
        for (var i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    /**
     * Run an action while holding the lock for a key.
     *
     * @param key    the entity key
     * @param action the action to run
     * @param <T>    result type
     * @return the action's result
     */
    public <T> T withLock(String key, Supplier<T> action) {
        final var lock = lockFor(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether the current thread holds the lock for a key.
     */
    public boolean isHeldByCurrentThread(String key) {
        return lockFor(key).isHeldByCurrentThread();
    }

    public String domain() {
        return domain;
    }

    private ReentrantLock lockFor(String key) {
        final var hash = key == null ? 0 : key.hashCode();
        return stripes[Math.floorMod(hash ^ (hash >>> 16), stripes.length)];
    }
}

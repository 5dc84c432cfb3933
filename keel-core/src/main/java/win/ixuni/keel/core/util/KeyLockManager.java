package win.ixuni.keel.core.util;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-key lock manager
 * <p>
 * Work on the same key is serialized; work on different keys runs in parallel.
 * A lock entry lives only while at least one caller holds or waits for it.
 */
@Slf4j
public class KeyLockManager {

    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();

    /**
     * Lock entry with a reference count. The count is only touched inside
     * {@code ConcurrentHashMap.compute*}, which serializes access per key.
     */
    private static class LockEntry {
        final ReentrantLock lock = new ReentrantLock();
        int refCount;
    }

    /**
     * Run an action while holding the lock for a key
     *
     * @param key    lock key
     * @param action action to execute
     * @return the action's result
     */
    public <T> T withLock(String key, Supplier<T> action) {
        LockEntry entry = locks.compute(key, (k, existing) -> {
            LockEntry e = existing != null ? existing : new LockEntry();
            e.refCount++;
            return e;
        });

        entry.lock.lock();
        try {
            log.trace("[KEY_LOCK] Acquired lock for key={}", key);
            return action.get();
        } finally {
            entry.lock.unlock();
            // Clean up locks no longer in use
            locks.computeIfPresent(key, (k, e) -> --e.refCount == 0 ? null : e);
        }
    }

    /**
     * Get the count of currently active locks (for monitoring and tests)
     */
    public int getActiveLockCount() {
        return locks.size();
    }
}

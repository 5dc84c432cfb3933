package win.ixuni.keel.engine.index;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import win.ixuni.keel.core.exception.BucketNotEmptyException;
import win.ixuni.keel.core.exception.BucketNotFoundException;
import win.ixuni.keel.core.util.KeyLockManager;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 单个 Bucket 的对象索引
 * <p>
 * Keys are kept in ascending order. Writers on different keys run in parallel and share the
 * gate; snapshots and retirement take the gate exclusively, so they never observe a half-applied
 * write. Writers on the same key are serialized by a per-key lock, which readers of that key
 * also take while they fetch the blob.
 */
@Slf4j
public class ObjectIndex {

    @Getter
    private final String bucketName;

    private final ConcurrentSkipListMap<String, IndexEntry> entries = new ConcurrentSkipListMap<>();

    private final ReentrantReadWriteLock gate = new ReentrantReadWriteLock();

    private final KeyLockManager keyLocks = new KeyLockManager();

    @Getter
    private volatile boolean retired;

    public ObjectIndex(String bucketName) {
        this.bucketName = bucketName;
    }

    /**
     * Install an entry, replacing any previous one
     *
     * @return the replaced entry, or null
     * @throws BucketNotFoundException if the bucket was deleted meanwhile
     */
    public IndexEntry put(String key, IndexEntry entry) {
        return write(key, () -> entries.put(key, entry));
    }

    /**
     * @return the removed entry, or null if the key was absent
     */
    public IndexEntry remove(String key) {
        return write(key, () -> entries.remove(key));
    }

    /**
     * Lock-free read of the current entry
     */
    public IndexEntry get(String key) {
        return entries.get(key);
    }

    /**
     * Run a reader against the current entry while holding the key lock. The entry passed in
     * stays current, and its blob live, until the reader returns.
     *
     * @param reader receives the entry, or null if the key is absent
     */
    public <T> T read(String key, Function<IndexEntry, T> reader) {
        return keyLocks.withLock(key, () -> reader.apply(entries.get(key)));
    }

    /**
     * Point-in-time view of all entries whose key starts with the prefix, in key order
     */
    public List<IndexEntry> snapshot(String prefix) {
        return exclusive(() -> {
            if (prefix == null || prefix.isEmpty()) {
                return new ArrayList<>(entries.values());
            }
            List<IndexEntry> result = new ArrayList<>();
            for (Map.Entry<String, IndexEntry> e : entries.tailMap(prefix, true).entrySet()) {
                if (!e.getKey().startsWith(prefix)) {
                    break;
                }
                result.add(e.getValue());
            }
            return result;
        });
    }

    /**
     * Mark the index retired if it holds no entries. Later writes fail with NoSuchBucket.
     *
     * @throws BucketNotEmptyException if any entry is present
     * @throws BucketNotFoundException if already retired
     */
    public void retire() {
        exclusive(() -> {
            if (retired) {
                throw new BucketNotFoundException(bucketName);
            }
            if (!entries.isEmpty()) {
                throw new BucketNotEmptyException(bucketName);
            }
            retired = true;
            return null;
        });
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Drop all entries without releasing their blobs
     */
    public void clear() {
        exclusive(() -> {
            entries.clear();
            return null;
        });
    }

    private <T> T write(String key, Supplier<T> action) {
        Lock shared = gate.readLock();
        shared.lock();
        try {
            if (retired) {
                throw new BucketNotFoundException(bucketName);
            }
            return keyLocks.withLock(key, action);
        } finally {
            shared.unlock();
        }
    }

    private <T> T exclusive(Supplier<T> action) {
        Lock exclusive = gate.writeLock();
        exclusive.lock();
        try {
            return action.get();
        } finally {
            exclusive.unlock();
        }
    }
}

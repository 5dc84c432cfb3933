package win.ixuni.keel.engine.registry;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.keel.core.exception.BucketAlreadyExistsException;
import win.ixuni.keel.core.exception.BucketNotFoundException;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bucket 注册表
 * <p>
 * Name uniqueness is enforced by a single atomic compute, so of two concurrent creates for the
 * same name exactly one wins. A retired entry still awaiting removal counts as absent.
 */
@Slf4j
public class BucketRegistry {

    /**
     * bucketName -> BucketEntry
     */
    private final Map<String, BucketEntry> buckets = new ConcurrentHashMap<>();

    public BucketEntry create(String name) {
        BucketEntry created = buckets.compute(name, (n, existing) -> {
            if (existing != null && !existing.getIndex().isRetired()) {
                throw new BucketAlreadyExistsException(n);
            }
            return new BucketEntry(n, Instant.now());
        });
        log.debug("Bucket registered: {}", name);
        return created;
    }

    /**
     * @throws BucketNotFoundException if no live bucket has this name
     */
    public BucketEntry get(String name) {
        BucketEntry entry = buckets.get(name);
        if (entry == null || entry.getIndex().isRetired()) {
            throw new BucketNotFoundException(name);
        }
        return entry;
    }

    public boolean exists(String name) {
        BucketEntry entry = buckets.get(name);
        return entry != null && !entry.getIndex().isRetired();
    }

    /**
     * Remove an empty bucket. The index is retired first so that puts racing with the delete
     * fail instead of landing in an unregistered index.
     */
    public void delete(String name) {
        BucketEntry entry = get(name);
        entry.getIndex().retire();
        buckets.remove(name, entry);
        log.debug("Bucket removed: {}", name);
    }

    /**
     * Live buckets ordered by name
     */
    public List<BucketEntry> list() {
        return buckets.values().stream()
                .filter(b -> !b.getIndex().isRetired())
                .sorted(Comparator.comparing(BucketEntry::getName))
                .toList();
    }

    public int size() {
        return buckets.size();
    }

    public void clear() {
        buckets.values().forEach(b -> b.getIndex().clear());
        buckets.clear();
    }
}

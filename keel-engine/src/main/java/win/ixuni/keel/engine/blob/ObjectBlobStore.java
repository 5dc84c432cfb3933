package win.ixuni.keel.engine.blob;

/**
 * Content storage for raw object bytes
 * <p>
 * Knows nothing about buckets or keys. Failures reading or writing the underlying medium are
 * reported as {@link win.ixuni.keel.core.exception.StorageFailureException}.
 */
public interface ObjectBlobStore {

    /**
     * Prepare the store for use
     */
    default void initialize() {
    }

    /**
     * Persist a payload
     *
     * @param data payload bytes, owned by the store after the call
     * @return handle carrying the content length and fingerprint
     */
    BlobReference store(byte[] data);

    /**
     * @param ref a live reference
     * @return the exact bytes previously stored
     */
    byte[] fetch(BlobReference ref);

    /**
     * Reclaim the storage behind a reference
     *
     * @throws IllegalStateException if the reference is unknown or was already released
     */
    void release(BlobReference ref);

    /**
     * Number of live blobs
     */
    int blobCount();

    default void close() {
    }
}

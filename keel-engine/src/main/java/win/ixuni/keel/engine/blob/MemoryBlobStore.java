package win.ixuni.keel.engine.blob;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.keel.core.exception.StorageFailureException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory blob store
 */
@Slf4j
public class MemoryBlobStore extends AbstractBlobStore {

    /**
     * blobId -> payload
     */
    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public BlobReference store(byte[] data) {
        BlobReference ref = newReference(data);
        blobs.put(ref.getBlobId(), data);
        return ref;
    }

    @Override
    public byte[] fetch(BlobReference ref) {
        byte[] data = blobs.get(ref.getBlobId());
        if (data == null) {
            throw new StorageFailureException("Blob not found: " + ref.getBlobId());
        }
        return data;
    }

    @Override
    public void release(BlobReference ref) {
        if (blobs.remove(ref.getBlobId()) == null) {
            throw new IllegalStateException("Blob released twice or never stored: " + ref.getBlobId());
        }
    }

    @Override
    public int blobCount() {
        return blobs.size();
    }

    @Override
    public void close() {
        log.debug("Dropping {} in-memory blobs", blobs.size());
        blobs.clear();
    }
}

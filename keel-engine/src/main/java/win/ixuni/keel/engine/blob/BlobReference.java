package win.ixuni.keel.engine.blob;

import lombok.Builder;
import lombok.Value;

/**
 * Opaque handle to bytes held by an {@link ObjectBlobStore}
 * <p>
 * Owned by at most one index entry at a time and released exactly once.
 */
@Value
@Builder
public class BlobReference {

    /**
     * Store-internal identifier
     */
    String blobId;

    long contentLength;

    /**
     * Lower-case hex MD5 of the content
     */
    String etag;
}

package win.ixuni.keel.engine.blob;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Shared id and fingerprint generation for blob stores
 */
public abstract class AbstractBlobStore implements ObjectBlobStore {

    protected BlobReference newReference(byte[] data) {
        return BlobReference.builder()
                .blobId(UUID.randomUUID().toString().replace("-", ""))
                .contentLength(data.length)
                .etag(calculateMd5(data))
                .build();
    }

    static String calculateMd5(byte[] data) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(data);
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}

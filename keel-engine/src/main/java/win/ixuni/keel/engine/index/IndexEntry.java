package win.ixuni.keel.engine.index;

import lombok.Builder;
import lombok.Value;
import win.ixuni.keel.core.model.S3Object;
import win.ixuni.keel.engine.blob.BlobReference;

import java.time.Instant;
import java.util.Map;

/**
 * Current version of one object: its blob plus the metadata recorded at put time
 */
@Value
@Builder
public class IndexEntry {

    String key;

    BlobReference blob;

    String contentType;

    Instant lastModified;

    Map<String, String> userMetadata;

    public S3Object toS3Object(String bucketName) {
        return S3Object.builder()
                .bucketName(bucketName)
                .key(key)
                .size(blob.getContentLength())
                .etag(blob.getEtag())
                .lastModified(lastModified)
                .contentType(contentType)
                .userMetadata(userMetadata)
                .build();
    }
}

package win.ixuni.keel.engine.registry;

import lombok.Getter;
import win.ixuni.keel.core.model.S3Bucket;
import win.ixuni.keel.engine.index.ObjectIndex;

import java.time.Instant;

/**
 * Registered bucket with its object index
 */
@Getter
public class BucketEntry {

    private final String name;

    private final Instant creationDate;

    private final ObjectIndex index;

    public BucketEntry(String name, Instant creationDate) {
        this.name = name;
        this.creationDate = creationDate;
        this.index = new ObjectIndex(name);
    }

    public S3Bucket toS3Bucket() {
        return S3Bucket.builder()
                .name(name)
                .creationDate(creationDate)
                .build();
    }
}

package win.ixuni.keel.core.operation.bucket;

import lombok.Value;
import win.ixuni.keel.core.operation.Operation;

/**
 * 删除 Bucket 操作
 * <p>
 * Only empty buckets can be deleted; there is no recursive variant.
 */
@Value
public class DeleteBucketOperation implements Operation<Void> {

    String bucketName;
}

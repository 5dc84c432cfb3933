package win.ixuni.keel.core.operation.bucket;

import lombok.Value;
import win.ixuni.keel.core.model.S3Bucket;
import win.ixuni.keel.core.operation.Operation;

/**
 * 创建 Bucket 操作
 * <p>
 * Fails with BucketAlreadyExists if the name is taken; retries are not silently accepted.
 */
@Value
public class CreateBucketOperation implements Operation<S3Bucket> {

    /**
     * Bucket 名称
     */
    String bucketName;
}

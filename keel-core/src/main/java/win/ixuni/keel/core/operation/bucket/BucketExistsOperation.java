package win.ixuni.keel.core.operation.bucket;

import lombok.Value;
import win.ixuni.keel.core.operation.Operation;

/**
 * 检查 Bucket 是否存在
 */
@Value
public class BucketExistsOperation implements Operation<Boolean> {

    String bucketName;
}

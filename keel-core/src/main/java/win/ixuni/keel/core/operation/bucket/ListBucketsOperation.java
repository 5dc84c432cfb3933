package win.ixuni.keel.core.operation.bucket;

import lombok.Value;
import win.ixuni.keel.core.model.S3Bucket;
import win.ixuni.keel.core.operation.Operation;

import java.util.List;

/**
 * List all buckets operation, ordered by name
 */
@Value
public class ListBucketsOperation implements Operation<List<S3Bucket>> {
    // 无参数
}

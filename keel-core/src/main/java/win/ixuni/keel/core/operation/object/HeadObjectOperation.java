package win.ixuni.keel.core.operation.object;

import lombok.Value;
import win.ixuni.keel.core.model.S3Object;
import win.ixuni.keel.core.operation.Operation;

/**
 * 获取对象元数据操作
 */
@Value
public class HeadObjectOperation implements Operation<S3Object> {

    String bucketName;

    String key;
}

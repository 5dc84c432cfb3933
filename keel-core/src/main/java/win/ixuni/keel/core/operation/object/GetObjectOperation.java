package win.ixuni.keel.core.operation.object;

import lombok.Value;
import win.ixuni.keel.core.model.S3ObjectData;
import win.ixuni.keel.core.operation.Operation;

/**
 * 获取对象操作（包含数据流）
 */
@Value
public class GetObjectOperation implements Operation<S3ObjectData> {

    String bucketName;

    String key;
}

package win.ixuni.keel.core.operation.object;

import lombok.Value;
import win.ixuni.keel.core.model.ListObjectsRequest;
import win.ixuni.keel.core.model.ListObjectsResult;
import win.ixuni.keel.core.operation.Operation;

/**
 * 列出对象操作
 */
@Value
public class ListObjectsOperation implements Operation<ListObjectsResult> {

    /**
     * 列出请求参数
     */
    ListObjectsRequest request;

    public static ListObjectsOperation of(String bucketName) {
        return new ListObjectsOperation(ListObjectsRequest.builder().bucketName(bucketName).build());
    }
}

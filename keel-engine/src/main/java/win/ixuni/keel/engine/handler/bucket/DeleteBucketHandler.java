package win.ixuni.keel.engine.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.keel.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.keel.engine.context.StandardEngineContext;
import win.ixuni.keel.engine.handler.AbstractEngineHandler;

/**
 * 删除 Bucket 处理器
 */
public class DeleteBucketHandler extends AbstractEngineHandler<DeleteBucketOperation, Void> {

    @Override
    protected Mono<Void> doHandle(DeleteBucketOperation operation, StandardEngineContext context) {
        return Mono.fromRunnable(() -> context.getBucketRegistry().delete(operation.getBucketName()));
    }

    @Override
    public Class<DeleteBucketOperation> getOperationType() {
        return DeleteBucketOperation.class;
    }
}

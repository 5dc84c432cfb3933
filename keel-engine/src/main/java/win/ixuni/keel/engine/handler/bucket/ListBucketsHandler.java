package win.ixuni.keel.engine.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.keel.core.model.S3Bucket;
import win.ixuni.keel.core.operation.bucket.ListBucketsOperation;
import win.ixuni.keel.engine.context.StandardEngineContext;
import win.ixuni.keel.engine.handler.AbstractEngineHandler;
import win.ixuni.keel.engine.registry.BucketEntry;

import java.util.List;

/**
 * 列出所有 Bucket 处理器
 */
public class ListBucketsHandler extends AbstractEngineHandler<ListBucketsOperation, List<S3Bucket>> {

    @Override
    protected Mono<List<S3Bucket>> doHandle(ListBucketsOperation operation, StandardEngineContext context) {
        return Mono.fromSupplier(() -> context.getBucketRegistry().list().stream()
                .map(BucketEntry::toS3Bucket)
                .toList());
    }

    @Override
    public Class<ListBucketsOperation> getOperationType() {
        return ListBucketsOperation.class;
    }
}

package win.ixuni.keel.engine.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.keel.core.exception.InvalidArgumentException;
import win.ixuni.keel.core.model.S3Bucket;
import win.ixuni.keel.core.operation.bucket.CreateBucketOperation;
import win.ixuni.keel.core.util.S3ValidationUtils;
import win.ixuni.keel.engine.context.StandardEngineContext;
import win.ixuni.keel.engine.handler.AbstractEngineHandler;

/**
 * 创建 Bucket 处理器
 */
public class CreateBucketHandler extends AbstractEngineHandler<CreateBucketOperation, S3Bucket> {

    @Override
    protected Mono<S3Bucket> doHandle(CreateBucketOperation operation, StandardEngineContext context) {
        String error = S3ValidationUtils.validateBucketName(operation.getBucketName());
        if (error != null) {
            return Mono.error(new InvalidArgumentException(error));
        }
        return Mono.fromCallable(() -> context.getBucketRegistry().create(operation.getBucketName()).toS3Bucket());
    }

    @Override
    public Class<CreateBucketOperation> getOperationType() {
        return CreateBucketOperation.class;
    }
}

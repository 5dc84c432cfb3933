package win.ixuni.keel.engine.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.keel.core.operation.bucket.BucketExistsOperation;
import win.ixuni.keel.engine.context.StandardEngineContext;
import win.ixuni.keel.engine.handler.AbstractEngineHandler;

public class BucketExistsHandler extends AbstractEngineHandler<BucketExistsOperation, Boolean> {

    @Override
    protected Mono<Boolean> doHandle(BucketExistsOperation operation, StandardEngineContext context) {
        return Mono.fromSupplier(() -> context.getBucketRegistry().exists(operation.getBucketName()));
    }

    @Override
    public Class<BucketExistsOperation> getOperationType() {
        return BucketExistsOperation.class;
    }
}

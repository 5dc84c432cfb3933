package win.ixuni.keel.engine.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.keel.core.exception.ObjectNotFoundException;
import win.ixuni.keel.core.model.S3Object;
import win.ixuni.keel.core.operation.object.HeadObjectOperation;
import win.ixuni.keel.engine.context.StandardEngineContext;
import win.ixuni.keel.engine.handler.AbstractEngineHandler;
import win.ixuni.keel.engine.index.IndexEntry;

public class HeadObjectHandler extends AbstractEngineHandler<HeadObjectOperation, S3Object> {

    @Override
    protected Mono<S3Object> doHandle(HeadObjectOperation operation, StandardEngineContext context) {
        String bucketName = operation.getBucketName();
        String key = operation.getKey();

        return Mono.fromCallable(() -> {
            IndexEntry entry = context.getBucketRegistry().get(bucketName).getIndex().get(key);
            if (entry == null) {
                throw new ObjectNotFoundException(bucketName, key);
            }
            return entry.toS3Object(bucketName);
        });
    }

    @Override
    public Class<HeadObjectOperation> getOperationType() {
        return HeadObjectOperation.class;
    }
}

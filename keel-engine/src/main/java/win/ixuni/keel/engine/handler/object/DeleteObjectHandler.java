package win.ixuni.keel.engine.handler.object;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.keel.core.operation.object.DeleteObjectOperation;
import win.ixuni.keel.engine.context.StandardEngineContext;
import win.ixuni.keel.engine.handler.AbstractEngineHandler;
import win.ixuni.keel.engine.index.IndexEntry;

/**
 * DeleteObject 处理器
 * <p>
 * Deleting an absent key succeeds without touching the blob store.
 */
@Slf4j
public class DeleteObjectHandler extends AbstractEngineHandler<DeleteObjectOperation, Void> {

    @Override
    protected Mono<Void> doHandle(DeleteObjectOperation operation, StandardEngineContext context) {
        String bucketName = operation.getBucketName();
        String key = operation.getKey();

        return context.<Void>blocking(() -> {
            IndexEntry removed = context.getBucketRegistry().get(bucketName).getIndex().remove(key);
            if (removed == null) {
                log.debug("Delete of absent key {}/{} is a no-op", bucketName, key);
            } else {
                releaseUnreferenced(context, removed.getBlob());
            }
            return null;
        });
    }

    @Override
    public Class<DeleteObjectOperation> getOperationType() {
        return DeleteObjectOperation.class;
    }
}

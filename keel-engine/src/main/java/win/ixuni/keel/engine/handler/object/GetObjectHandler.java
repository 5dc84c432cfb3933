package win.ixuni.keel.engine.handler.object;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.keel.core.exception.ObjectNotFoundException;
import win.ixuni.keel.core.model.S3ObjectData;
import win.ixuni.keel.core.operation.object.GetObjectOperation;
import win.ixuni.keel.engine.context.StandardEngineContext;
import win.ixuni.keel.engine.handler.AbstractEngineHandler;

import java.nio.ByteBuffer;

/**
 * GetObject 处理器
 */
public class GetObjectHandler extends AbstractEngineHandler<GetObjectOperation, S3ObjectData> {

    @Override
    protected Mono<S3ObjectData> doHandle(GetObjectOperation operation, StandardEngineContext context) {
        String bucketName = operation.getBucketName();
        String key = operation.getKey();

        return context.blocking(() -> context.getBucketRegistry().get(bucketName).getIndex()
                .read(key, entry -> {
                    if (entry == null) {
                        throw new ObjectNotFoundException(bucketName, key);
                    }
                    byte[] data = context.getBlobStore().fetch(entry.getBlob());
                    return S3ObjectData.builder()
                            .metadata(entry.toS3Object(bucketName))
                            .content(Flux.defer(() -> Flux.just(ByteBuffer.wrap(data).asReadOnlyBuffer())))
                            .build();
                }));
    }

    @Override
    public Class<GetObjectOperation> getOperationType() {
        return GetObjectOperation.class;
    }
}

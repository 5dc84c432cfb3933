package win.ixuni.keel.engine.handler.object;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.keel.core.exception.InvalidArgumentException;
import win.ixuni.keel.core.model.S3Object;
import win.ixuni.keel.core.operation.object.PutObjectOperation;
import win.ixuni.keel.core.util.S3ValidationUtils;
import win.ixuni.keel.engine.blob.BlobReference;
import win.ixuni.keel.engine.context.StandardEngineContext;
import win.ixuni.keel.engine.handler.AbstractEngineHandler;
import win.ixuni.keel.engine.index.IndexEntry;
import win.ixuni.keel.engine.index.ObjectIndex;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Map;

/**
 * PutObject 处理器
 * <p>
 * The payload is collected in full before anything is stored. The blob is written first and
 * then installed in the index; if the install fails the new blob is released, and on success
 * the replaced blob is released.
 */
@Slf4j
public class PutObjectHandler extends AbstractEngineHandler<PutObjectOperation, S3Object> {

    static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    @Override
    protected Mono<S3Object> doHandle(PutObjectOperation operation, StandardEngineContext context) {
        String bucketName = operation.getBucketName();
        String key = operation.getKey();

        String error = S3ValidationUtils.validateKey(key);
        if (error == null) {
            error = S3ValidationUtils.validateMetadata(operation.getMetadata());
        }
        if (error != null) {
            return Mono.error(new InvalidArgumentException(error));
        }

        return Mono.fromCallable(() -> context.getBucketRegistry().get(bucketName).getIndex())
                .flatMap(index -> collect(operation.getContent())
                        .flatMap(data -> {
                            Long declared = operation.getDeclaredLength();
                            if (declared != null && declared != data.length) {
                                return Mono.error(new InvalidArgumentException(
                                        "Declared length " + declared + " does not match received " + data.length + " bytes"));
                            }
                            return context.blocking(() -> store(operation, index, data, context));
                        }));
    }

    private S3Object store(PutObjectOperation operation, ObjectIndex index, byte[] data,
                           StandardEngineContext context) {
        BlobReference blob = context.getBlobStore().store(data);
        IndexEntry entry = IndexEntry.builder()
                .key(operation.getKey())
                .blob(blob)
                .contentType(operation.getContentType() != null ? operation.getContentType() : DEFAULT_CONTENT_TYPE)
                .lastModified(Instant.now())
                .userMetadata(operation.getMetadata() != null ? Map.copyOf(operation.getMetadata()) : Map.of())
                .build();

        IndexEntry previous;
        try {
            previous = index.put(operation.getKey(), entry);
        } catch (RuntimeException e) {
            releaseUnreferenced(context, blob);
            throw e;
        }
        if (previous != null) {
            log.debug("Replaced {}/{} (old blob {})", index.getBucketName(), operation.getKey(),
                    previous.getBlob().getBlobId());
            releaseUnreferenced(context, previous.getBlob());
        }
        return entry.toS3Object(index.getBucketName());
    }

    private Mono<byte[]> collect(Flux<ByteBuffer> content) {
        if (content == null) {
            return Mono.just(new byte[0]);
        }
        return content
                .reduce(new ByteArrayOutputStream(), (baos, buf) -> {
                    byte[] bytes = new byte[buf.remaining()];
                    buf.get(bytes);
                    baos.write(bytes, 0, bytes.length);
                    return baos;
                })
                .map(ByteArrayOutputStream::toByteArray);
    }

    @Override
    public Class<PutObjectOperation> getOperationType() {
        return PutObjectOperation.class;
    }
}

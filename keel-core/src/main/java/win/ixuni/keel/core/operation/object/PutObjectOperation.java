package win.ixuni.keel.core.operation.object;

import lombok.Builder;
import lombok.Value;
import reactor.core.publisher.Flux;
import win.ixuni.keel.core.model.S3Object;
import win.ixuni.keel.core.operation.Operation;

import java.nio.ByteBuffer;
import java.util.Map;

/**
 * 上传对象
 * <p>
 * The body is consumed once. {@code declaredLength} is what the client announced (decoded
 * length for aws-chunked bodies); the engine rejects the put when the received byte count differs.
 * A null content type falls back to application/octet-stream.
 */
@Value
@Builder
public class PutObjectOperation implements Operation<S3Object> {

    String bucketName;

    String key;

    Flux<ByteBuffer> content;

    /**
     * null: not announced, nothing to check
     */
    Long declaredLength;

    String contentType;

    /**
     * x-amz-meta-* values keyed by the lower-case suffix
     */
    Map<String, String> metadata;
}

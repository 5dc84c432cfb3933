package win.ixuni.keel.core.model;

import lombok.Builder;
import lombok.Data;
import reactor.core.publisher.Flux;

import java.nio.ByteBuffer;

/**
 * GetObject 结果：元数据 + 内容
 * <p>
 * The content Flux replays the same bytes on every subscription.
 */
@Data
@Builder
public class S3ObjectData {

    private S3Object metadata;

    private Flux<ByteBuffer> content;

    public long getContentLength() {
        return metadata.getSize();
    }
}

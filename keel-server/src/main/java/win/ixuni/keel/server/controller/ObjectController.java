package win.ixuni.keel.server.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.keel.core.exception.InvalidArgumentException;
import win.ixuni.keel.core.model.S3Object;
import win.ixuni.keel.server.service.S3Service;
import win.ixuni.keel.server.util.AwsChunkedDecoder;

import java.nio.ByteBuffer;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Object 操作控制器
 * <p>
 * 处理 S3 Object 相关的 API 请求
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ObjectController {

    private final S3Service s3Service;

    private static final DateTimeFormatter HTTP_DATE_FORMATTER = DateTimeFormatter
            .ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US)
            .withZone(ZoneOffset.UTC);

    private static final String META_PREFIX = "x-amz-meta-";

    private static final String DECODED_CONTENT_LENGTH = "x-amz-decoded-content-length";

    /**
     * 上传对象
     * PUT /{bucket}/{key}
     */
    @PutMapping("/{bucket}/{*key}")
    public Mono<ResponseEntity<Void>> putObject(
            @PathVariable String bucket,
            @PathVariable String key,
            @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType,
            @RequestHeader HttpHeaders headers,
            @RequestHeader(value = "x-amz-content-sha256", required = false) String contentSha256,
            @RequestBody(required = false) Flux<DataBuffer> body) {

        Map<String, String> metadata = new HashMap<>();
        headers.forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.startsWith(META_PREFIX) && !values.isEmpty()) {
                metadata.put(lower.substring(META_PREFIX.length()), values.get(0));
            }
        });

        boolean chunked = AwsChunkedDecoder.isAwsChunkedEncoding(contentSha256);
        Long declaredLength;
        try {
            declaredLength = declaredLength(headers, chunked);
        } catch (NumberFormatException e) {
            return Mono.error(new InvalidArgumentException("Invalid content length header: " + e.getMessage()));
        }

        // 处理空body的情况（如0字节文件）
        Flux<DataBuffer> safeBody = body != null ? body : Flux.empty();

        Flux<ByteBuffer> content;
        if (chunked) {
            content = AwsChunkedDecoder.decode(safeBody);
        } else {
            content = safeBody.map(dataBuffer -> {
                byte[] bytes = new byte[dataBuffer.readableByteCount()];
                dataBuffer.read(bytes);
                DataBufferUtils.release(dataBuffer);
                return ByteBuffer.wrap(bytes);
            });
        }

        return s3Service.putObject(bucket, normalizeKey(key), content, declaredLength, contentType, metadata)
                .map(obj -> ResponseEntity.ok()
                        .header(HttpHeaders.ETAG, quote(obj.getEtag()))
                        .<Void>build());
    }

    /**
     * 获取对象
     * GET /{bucket}/{key}
     */
    @GetMapping("/{bucket}/{*key}")
    public Mono<ResponseEntity<Flux<DataBuffer>>> getObject(
            @PathVariable String bucket,
            @PathVariable String key) {

        return s3Service.getObject(bucket, normalizeKey(key))
                .map(objectData -> {
                    S3Object metadata = objectData.getMetadata();
                    Flux<DataBuffer> dataBufferFlux = objectData.getContent()
                            .map(byteBuffer -> DefaultDataBufferFactory.sharedInstance.wrap(byteBuffer));

                    return objectHeaders(metadata).body(dataBufferFlux);
                });
    }

    /**
     * 获取对象元数据
     * HEAD /{bucket}/{key}
     */
    @RequestMapping(value = "/{bucket}/{*key}", method = RequestMethod.HEAD)
    public Mono<ResponseEntity<Void>> headObject(
            @PathVariable String bucket,
            @PathVariable String key) {

        return s3Service.headObject(bucket, normalizeKey(key))
                .map(obj -> objectHeaders(obj).<Void>build());
    }

    /**
     * 删除对象
     * DELETE /{bucket}/{key}
     */
    @DeleteMapping("/{bucket}/{*key}")
    public Mono<ResponseEntity<Void>> deleteObject(
            @PathVariable String bucket,
            @PathVariable String key) {

        return s3Service.deleteObject(bucket, normalizeKey(key))
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    private ResponseEntity.BodyBuilder objectHeaders(S3Object metadata) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_TYPE, metadata.getContentType())
                .header(HttpHeaders.CONTENT_LENGTH, String.valueOf(metadata.getSize()))
                .header(HttpHeaders.ETAG, quote(metadata.getEtag()))
                .header(HttpHeaders.LAST_MODIFIED, HTTP_DATE_FORMATTER.format(metadata.getLastModified()));
        if (metadata.getUserMetadata() != null) {
            metadata.getUserMetadata().forEach((k, v) -> builder.header(META_PREFIX + k, v));
        }
        return builder;
    }

    /**
     * Payload length the client announced: the decoded length when sent, otherwise Content-Length
     * for plain bodies. Null when unknown.
     */
    private Long declaredLength(HttpHeaders headers, boolean chunked) {
        String decoded = headers.getFirst(DECODED_CONTENT_LENGTH);
        if (decoded != null) {
            return Long.parseLong(decoded.trim());
        }
        if (chunked) {
            // Content-Length covers the chunk framing
            return null;
        }
        String contentLength = headers.getFirst(HttpHeaders.CONTENT_LENGTH);
        return contentLength != null ? Long.parseLong(contentLength.trim()) : null;
    }

    private String quote(String etag) {
        return "\"" + etag + "\"";
    }

    /**
     * 规范化对象Key（去除开头的斜杠）
     */
    private String normalizeKey(String key) {
        if (key != null && key.startsWith("/")) {
            return key.substring(1);
        }
        return key;
    }
}

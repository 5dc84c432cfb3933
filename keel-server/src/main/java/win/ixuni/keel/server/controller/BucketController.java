package win.ixuni.keel.server.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import win.ixuni.keel.core.model.ListAllBucketsResult;
import win.ixuni.keel.core.model.ListObjectsRequest;
import win.ixuni.keel.server.service.S3Service;

/**
 * Bucket 操作控制器
 * <p>
 * 处理 S3 Bucket 相关的 API 请求. Errors propagate to {@link GlobalExceptionHandler}.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class BucketController {

    private final S3Service s3Service;

    private static final String APPLICATION_XML = "application/xml";

    /**
     * List all buckets
     * GET /
     */
    @GetMapping(value = "/", produces = APPLICATION_XML)
    public Mono<ResponseEntity<ListAllBucketsResult>> listBuckets() {
        return s3Service.listBuckets()
                .map(buckets -> ResponseEntity.ok(ListAllBucketsResult.of(buckets)));
    }

    /**
     * 创建Bucket
     * PUT /{bucket}
     * <p>
     * A CreateBucketConfiguration body is ignored, there is a single region.
     */
    @PutMapping("/{bucket}")
    public Mono<ResponseEntity<Void>> createBucket(@PathVariable String bucket) {
        return s3Service.createBucket(bucket)
                .map(b -> ResponseEntity.ok()
                        .header(HttpHeaders.LOCATION, "/" + b.getName())
                        .<Void>build());
    }

    /**
     * 删除Bucket
     * DELETE /{bucket}
     */
    @DeleteMapping("/{bucket}")
    public Mono<ResponseEntity<Void>> deleteBucket(@PathVariable String bucket) {
        return s3Service.deleteBucket(bucket)
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    /**
     * 检查Bucket是否存在 (HEAD)
     * HEAD /{bucket}
     */
    @RequestMapping(value = "/{bucket}", method = RequestMethod.HEAD)
    public Mono<ResponseEntity<Void>> headBucket(@PathVariable String bucket) {
        return s3Service.bucketExists(bucket)
                .map(exists -> exists
                        ? ResponseEntity.ok().<Void>build()
                        : ResponseEntity.notFound().<Void>build());
    }

    /**
     * 列出Bucket中的对象 (V1 & V2)
     * GET /{bucket}
     * <p>
     * Paging parameters are not accepted; every matching key is returned in one page.
     */
    @GetMapping(value = "/{bucket}", produces = APPLICATION_XML)
    public Mono<ResponseEntity<?>> listObjects(
            @PathVariable String bucket,
            @RequestParam(required = false) String prefix,
            @RequestParam(required = false) String delimiter,
            @RequestParam(name = "list-type", required = false) Integer listType) {

        ListObjectsRequest request = ListObjectsRequest.builder()
                .bucketName(bucket)
                .prefix(prefix)
                .delimiter(delimiter)
                .build();

        if (listType != null && listType == 2) {
            return s3Service.listObjectsV2(request).map(ResponseEntity::ok);
        }
        return s3Service.listObjects(request).map(ResponseEntity::ok);
    }
}

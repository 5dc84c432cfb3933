package win.ixuni.keel.server.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.keel.core.model.ListObjectsRequest;
import win.ixuni.keel.core.model.ListObjectsResult;
import win.ixuni.keel.core.model.ListObjectsV2Result;
import win.ixuni.keel.core.model.S3Bucket;
import win.ixuni.keel.core.model.S3Object;
import win.ixuni.keel.core.model.S3ObjectData;
import win.ixuni.keel.core.operation.bucket.BucketExistsOperation;
import win.ixuni.keel.core.operation.bucket.CreateBucketOperation;
import win.ixuni.keel.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.keel.core.operation.bucket.ListBucketsOperation;
import win.ixuni.keel.core.operation.object.DeleteObjectOperation;
import win.ixuni.keel.core.operation.object.GetObjectOperation;
import win.ixuni.keel.core.operation.object.HeadObjectOperation;
import win.ixuni.keel.core.operation.object.ListObjectsOperation;
import win.ixuni.keel.core.operation.object.PutObjectOperation;
import win.ixuni.keel.server.registry.EngineManager;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

/**
 * S3 service layer
 * <p>
 * Translates controller calls into engine operations. All operations are executed via the
 * execute(Operation) pattern.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class S3Service {

    private final EngineManager engineManager;

    // ==================== Bucket 操作 ====================

    public Mono<S3Bucket> createBucket(String bucketName) {
        log.info("Creating bucket: {}", bucketName);
        return engineManager.getEngine().execute(new CreateBucketOperation(bucketName));
    }

    public Mono<Void> deleteBucket(String bucketName) {
        log.info("Deleting bucket: {}", bucketName);
        return engineManager.getEngine().execute(new DeleteBucketOperation(bucketName));
    }

    public Mono<Boolean> bucketExists(String bucketName) {
        return engineManager.getEngine().execute(new BucketExistsOperation(bucketName));
    }

    public Mono<List<S3Bucket>> listBuckets() {
        return engineManager.getEngine().execute(new ListBucketsOperation());
    }

    // ==================== Object 操作 ====================

    public Mono<S3Object> putObject(String bucketName, String key, Flux<ByteBuffer> content, Long declaredLength,
                                    String contentType, Map<String, String> metadata) {
        log.debug("Putting object: {}/{} (declared length: {})", bucketName, key, declaredLength);
        return engineManager.getEngine().execute(PutObjectOperation.builder()
                .bucketName(bucketName)
                .key(key)
                .content(content)
                .declaredLength(declaredLength)
                .contentType(contentType)
                .metadata(metadata)
                .build());
    }

    public Mono<S3ObjectData> getObject(String bucketName, String key) {
        return engineManager.getEngine().execute(new GetObjectOperation(bucketName, key));
    }

    public Mono<S3Object> headObject(String bucketName, String key) {
        return engineManager.getEngine().execute(new HeadObjectOperation(bucketName, key));
    }

    public Mono<Void> deleteObject(String bucketName, String key) {
        log.debug("Deleting object: {}/{}", bucketName, key);
        return engineManager.getEngine().execute(new DeleteObjectOperation(bucketName, key));
    }

    public Mono<ListObjectsResult> listObjects(ListObjectsRequest request) {
        return engineManager.getEngine().execute(new ListObjectsOperation(request));
    }

    public Mono<ListObjectsV2Result> listObjectsV2(ListObjectsRequest request) {
        return listObjects(request).map(ListObjectsV2Result::from);
    }
}

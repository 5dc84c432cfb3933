package win.ixuni.keel.engine.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.keel.core.model.ListObjectsRequest;
import win.ixuni.keel.core.model.ListObjectsResult;
import win.ixuni.keel.core.model.S3Object;
import win.ixuni.keel.core.operation.object.ListObjectsOperation;
import win.ixuni.keel.engine.context.StandardEngineContext;
import win.ixuni.keel.engine.handler.AbstractEngineHandler;
import win.ixuni.keel.engine.index.IndexEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * ListObjects 处理器
 * <p>
 * Single page: every matching key is returned and the result is never truncated.
 */
public class ListObjectsHandler extends AbstractEngineHandler<ListObjectsOperation, ListObjectsResult> {

    /**
     * Reported in MaxKeys for client compatibility
     */
    static final int REPORTED_MAX_KEYS = 1000;

    @Override
    protected Mono<ListObjectsResult> doHandle(ListObjectsOperation operation, StandardEngineContext context) {
        ListObjectsRequest request = operation.getRequest();
        String bucketName = request.getBucketName();
        String prefix = request.getPrefix() != null ? request.getPrefix() : "";
        String delimiter = request.getDelimiter();

        return Mono.fromCallable(() -> {
            List<IndexEntry> snapshot = context.getBucketRegistry().get(bucketName).getIndex().snapshot(prefix);

            List<S3Object> objects = new ArrayList<>();
            Set<String> commonPrefixStrings = new TreeSet<>();
            for (IndexEntry entry : snapshot) {
                String key = entry.getKey();
                if (delimiter != null && !delimiter.isEmpty()) {
                    int delimIndex = key.indexOf(delimiter, prefix.length());
                    if (delimIndex >= 0) {
                        commonPrefixStrings.add(key.substring(0, delimIndex + delimiter.length()));
                        continue;
                    }
                }
                objects.add(entry.toS3Object(bucketName));
            }

            List<ListObjectsResult.CommonPrefix> commonPrefixes = commonPrefixStrings.stream()
                    .map(p -> ListObjectsResult.CommonPrefix.builder().prefix(p).build())
                    .toList();

            return ListObjectsResult.builder()
                    .bucketName(bucketName)
                    .prefix(request.getPrefix())
                    .delimiter(delimiter)
                    .maxKeys(REPORTED_MAX_KEYS)
                    .isTruncated(false)
                    .contents(objects)
                    .commonPrefixes(commonPrefixes)
                    .build();
        });
    }

    @Override
    public Class<ListObjectsOperation> getOperationType() {
        return ListObjectsOperation.class;
    }
}

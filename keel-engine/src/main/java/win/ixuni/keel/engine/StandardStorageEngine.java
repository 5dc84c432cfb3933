package win.ixuni.keel.engine;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.keel.core.config.EngineConfig;
import win.ixuni.keel.core.engine.AbstractStorageEngine;
import win.ixuni.keel.core.operation.EngineContext;
import win.ixuni.keel.engine.blob.LocalBlobStore;
import win.ixuni.keel.engine.blob.MemoryBlobStore;
import win.ixuni.keel.engine.blob.ObjectBlobStore;
import win.ixuni.keel.engine.context.StandardEngineContext;
import win.ixuni.keel.engine.handler.bucket.BucketExistsHandler;
import win.ixuni.keel.engine.handler.bucket.CreateBucketHandler;
import win.ixuni.keel.engine.handler.bucket.DeleteBucketHandler;
import win.ixuni.keel.engine.handler.bucket.ListBucketsHandler;
import win.ixuni.keel.engine.handler.object.DeleteObjectHandler;
import win.ixuni.keel.engine.handler.object.GetObjectHandler;
import win.ixuni.keel.engine.handler.object.HeadObjectHandler;
import win.ixuni.keel.engine.handler.object.ListObjectsHandler;
import win.ixuni.keel.engine.handler.object.PutObjectHandler;

import java.nio.file.Path;

/**
 * Standard 存储引擎
 * <p>
 * Bucket registry and per-bucket object indexes in memory, payloads in a pluggable blob store
 * selected by the {@code blob-store} property ({@code memory} or {@code local}).
 */
@Slf4j
public class StandardStorageEngine extends AbstractStorageEngine {

    public static final String PROP_BLOB_STORE = "blob-store";
    public static final String PROP_ROOT_DIR = "root-dir";

    @Getter
    private final EngineConfig config;

    private final StandardEngineContext engineContext;

    public StandardStorageEngine(EngineConfig config) {
        this(config, createBlobStore(config));
    }

    public StandardStorageEngine(EngineConfig config, ObjectBlobStore blobStore) {
        this.config = config;
        this.engineContext = StandardEngineContext.builder()
                .config(config)
                .blobStore(blobStore)
                .scheduler(blobStore instanceof MemoryBlobStore ? Schedulers.immediate() : Schedulers.boundedElastic())
                .build();
        registerHandlers();
        engineContext.setHandlerRegistry(getHandlerRegistry());
    }

    static ObjectBlobStore createBlobStore(EngineConfig config) {
        String kind = config.getString(PROP_BLOB_STORE, "memory");
        switch (kind) {
            case "memory":
                return new MemoryBlobStore();
            case "local":
                return new LocalBlobStore(Path.of(config.getString(PROP_ROOT_DIR, "./data")));
            default:
                throw new IllegalArgumentException("Unknown blob store: " + kind);
        }
    }

    private void registerHandlers() {
        getHandlerRegistry().register(new CreateBucketHandler());
        getHandlerRegistry().register(new DeleteBucketHandler());
        getHandlerRegistry().register(new BucketExistsHandler());
        getHandlerRegistry().register(new ListBucketsHandler());

        getHandlerRegistry().register(new PutObjectHandler());
        getHandlerRegistry().register(new GetObjectHandler());
        getHandlerRegistry().register(new HeadObjectHandler());
        getHandlerRegistry().register(new DeleteObjectHandler());
        getHandlerRegistry().register(new ListObjectsHandler());

        log.info("Registered {} operation handlers for engine {}", getHandlerRegistry().size(), config.getName());
    }

    @Override
    public EngineContext getEngineContext() {
        return engineContext;
    }

    public ObjectBlobStore getBlobStore() {
        return engineContext.getBlobStore();
    }

    @Override
    public String getEngineType() {
        return StandardEngineContext.ENGINE_TYPE;
    }

    @Override
    public String getEngineName() {
        return config.getName();
    }

    @Override
    public Mono<Void> initialize() {
        return Mono.fromRunnable(() -> {
            log.info("Initializing storage engine {} ({})", config.getName(),
                    engineContext.getBlobStore().getClass().getSimpleName());
            engineContext.getBlobStore().initialize();
        });
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(() -> {
            log.info("Shutting down storage engine {}", config.getName());
            engineContext.getBucketRegistry().clear();
            engineContext.getBlobStore().close();
        });
    }
}

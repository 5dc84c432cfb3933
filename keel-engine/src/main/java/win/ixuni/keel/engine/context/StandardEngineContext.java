package win.ixuni.keel.engine.context;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import win.ixuni.keel.core.config.EngineConfig;
import win.ixuni.keel.core.operation.EngineContext;
import win.ixuni.keel.core.operation.OperationHandlerRegistry;
import win.ixuni.keel.engine.blob.ObjectBlobStore;
import win.ixuni.keel.engine.registry.BucketRegistry;

import java.util.concurrent.Callable;

/**
 * Standard 引擎上下文
 * <p>
 * Shared state of one engine instance: the bucket registry, the blob store and the scheduler
 * that blocking store work runs on.
 */
@Getter
@Builder
public class StandardEngineContext implements EngineContext {

    public static final String ENGINE_TYPE = "standard";

    private final EngineConfig config;

    @Builder.Default
    private final BucketRegistry bucketRegistry = new BucketRegistry();

    private final ObjectBlobStore blobStore;

    @Builder.Default
    private final Scheduler scheduler = Schedulers.immediate();

    /**
     * Operation handler registry (injected at runtime)
     */
    @Setter
    private OperationHandlerRegistry handlerRegistry;

    @Override
    public String getEngineName() {
        return config.getName();
    }

    @Override
    public String getEngineType() {
        return ENGINE_TYPE;
    }

    /**
     * Run a blocking section on the engine scheduler. A null result completes empty.
     */
    public <T> Mono<T> blocking(Callable<T> work) {
        return Mono.fromCallable(work).subscribeOn(scheduler);
    }
}

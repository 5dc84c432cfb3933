package win.ixuni.keel.core.engine;

import reactor.core.publisher.Mono;
import win.ixuni.keel.core.operation.EngineContext;
import win.ixuni.keel.core.operation.Operation;
import win.ixuni.keel.core.operation.OperationHandlerRegistry;

/**
 * Storage engine interface
 * <p>
 * All bucket and object operations are executed via {@link #execute(Operation)}. Each call is
 * atomic on its own; there are no multi-call transactions.
 * <p>
 * An engine is an explicit handle built from an {@code EngineConfig}: there is no
 * process-wide default instance.
 */
public interface StorageEngine {

    // ==================== Core Methods ====================

    OperationHandlerRegistry getHandlerRegistry();

    EngineContext getEngineContext();

    /**
     * Execute an operation
     * <p>
     * Unified entry point for all operations, with interceptor chain support.
     *
     * @param operation the operation instance
     * @param <O>       operation type
     * @param <R>       return type
     * @return operation result
     */
    default <O extends Operation<R>, R> Mono<R> execute(O operation) {
        return getHandlerRegistry().execute(operation, getEngineContext());
    }

    // ==================== Metadata ====================

    /**
     * @return engine type (e.g. "standard")
     */
    String getEngineType();

    /**
     * @return instance name (as specified in configuration)
     */
    String getEngineName();

    // ==================== Lifecycle ====================

    default Mono<Void> initialize() {
        return Mono.empty();
    }

    /**
     * Shut down the engine and release resources
     */
    default Mono<Void> shutdown() {
        return Mono.empty();
    }
}

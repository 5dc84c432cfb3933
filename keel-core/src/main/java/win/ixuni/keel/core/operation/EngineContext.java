package win.ixuni.keel.core.operation;

import reactor.core.publisher.Mono;
import win.ixuni.keel.core.config.EngineConfig;

/**
 * Engine context interface
 * <p>
 * Provides the shared state and infrastructure handlers need to execute operations.
 */
public interface EngineContext {

    EngineConfig getConfig();

    /**
     * Get the engine instance name
     */
    String getEngineName();

    /**
     * Get the engine type, e.g. "standard"
     */
    String getEngineType();

    OperationHandlerRegistry getHandlerRegistry();

    /**
     * Called during engine construction to inject the handler registry.
     */
    void setHandlerRegistry(OperationHandlerRegistry registry);

    /**
     * Execute an operation
     * <p>
     * Allows handlers to invoke other operations without depending on other handler instances.
     *
     * @param operation the operation instance
     * @param <O>       operation type
     * @param <R>       return type
     * @return operation result
     */
    default <O extends Operation<R>, R> Mono<R> execute(O operation) {
        return getHandlerRegistry().execute(operation, this);
    }
}

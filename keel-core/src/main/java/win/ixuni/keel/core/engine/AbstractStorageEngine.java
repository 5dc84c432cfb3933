package win.ixuni.keel.core.engine;

import lombok.Getter;
import win.ixuni.keel.core.operation.OperationHandlerRegistry;
import win.ixuni.keel.core.operation.interceptor.LoggingInterceptor;

/**
 * Abstract base class for storage engines
 * <p>
 * Owns the handler registry with the logging interceptor installed; subclasses register their
 * handlers and provide the context.
 */
public abstract class AbstractStorageEngine implements StorageEngine {

    @Getter
    protected final OperationHandlerRegistry handlerRegistry = new OperationHandlerRegistry();

    protected AbstractStorageEngine() {
        handlerRegistry.addInterceptor(new LoggingInterceptor());
    }
}

package win.ixuni.keel.engine.handler;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.keel.core.operation.EngineContext;
import win.ixuni.keel.core.operation.Operation;
import win.ixuni.keel.core.operation.OperationHandler;
import win.ixuni.keel.engine.blob.BlobReference;
import win.ixuni.keel.engine.context.StandardEngineContext;

/**
 * Standard Handler 抽象基类
 * <p>
 * 提供类型安全的 Context 访问，子类无需手动强制转换。
 *
 * @param <O> 操作类型
 * @param <R> 返回类型
 */
@Slf4j
public abstract class AbstractEngineHandler<O extends Operation<R>, R> implements OperationHandler<O, R> {

    @Override
    public final Mono<R> handle(O operation, EngineContext context) {
        if (!(context instanceof StandardEngineContext)) {
            return Mono.error(new IllegalArgumentException(
                    "Expected StandardEngineContext but got: " + context.getClass().getName()));
        }
        return doHandle(operation, (StandardEngineContext) context);
    }

    /**
     * @param operation 操作
     * @param context   engine context
     * @return operation result
     */
    protected abstract Mono<R> doHandle(O operation, StandardEngineContext context);

    /**
     * Release a blob that is no longer referenced by the index. The owning operation has already
     * taken effect, so a failure here only leaks storage and is logged.
     */
    protected void releaseUnreferenced(StandardEngineContext context, BlobReference blob) {
        try {
            context.getBlobStore().release(blob);
        } catch (RuntimeException e) {
            log.warn("Failed to release blob {}: {}", blob.getBlobId(), e.getMessage());
        }
    }
}

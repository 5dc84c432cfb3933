package win.ixuni.keel.core.operation;

import reactor.core.publisher.Mono;

/**
 * Wraps every handler call made through {@link OperationHandlerRegistry}
 * <p>
 * 实现类调用 {@code chain.proceed(...)} 继续执行，可在前后附加逻辑。
 */
public interface HandlerInterceptor {

    <O extends Operation<R>, R> Mono<R> intercept(
            O operation,
            EngineContext context,
            InterceptorChain<O, R> chain);

    /**
     * Sort key; the lowest value is the outermost interceptor
     */
    default int getOrder() {
        return 0;
    }
}

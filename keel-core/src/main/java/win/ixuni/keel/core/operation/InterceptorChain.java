package win.ixuni.keel.core.operation;

import reactor.core.publisher.Mono;

/**
 * Handler 拦截器链接口
 * <p>
 * Used in interceptors to invoke the next interceptor or the final handler.
 *
 * @param <O> 操作类型
 * @param <R> 返回类型
 */
public interface InterceptorChain<O extends Operation<R>, R> {

    Mono<R> proceed(O operation, EngineContext context);
}

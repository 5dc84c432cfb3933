package win.ixuni.keel.core.operation.interceptor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.keel.core.exception.ErrorCode;
import win.ixuni.keel.core.exception.KeelException;
import win.ixuni.keel.core.operation.EngineContext;
import win.ixuni.keel.core.operation.HandlerInterceptor;
import win.ixuni.keel.core.operation.InterceptorChain;
import win.ixuni.keel.core.operation.Operation;

/**
 * 日志拦截器
 * <p>
 * 在操作执行前后记录日志，包括执行时间和结果状态。
 * Client-facing engine errors (NoSuchKey, BucketNotEmpty, ...) are logged at debug, anything else at warn.
 */
@Slf4j
public class LoggingInterceptor implements HandlerInterceptor {

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(
            O operation,
            EngineContext context,
            InterceptorChain<O, R> chain) {

        final long startTime = System.currentTimeMillis();
        final String operationName = operation.getOperationName();
        final String engineName = context.getEngineName();

        log.debug("[{}] Starting operation: {}", engineName, operationName);

        return chain.proceed(operation, context)
                .doOnSuccess(result -> {
                    long duration = System.currentTimeMillis() - startTime;
                    log.debug("[{}] Operation {} completed successfully in {}ms",
                            engineName, operationName, duration);
                })
                .doOnError(error -> {
                    long duration = System.currentTimeMillis() - startTime;
                    if (error instanceof KeelException keelError
                            && keelError.getErrorCode() != ErrorCode.INTERNAL_STORAGE_FAILURE) {
                        log.debug("[{}] Operation {} rejected after {}ms: {} - {}",
                                engineName, operationName, duration, keelError.getS3Code(), error.getMessage());
                    } else {
                        log.warn("[{}] Operation {} failed after {}ms: {}",
                                engineName, operationName, duration, error.getMessage());
                    }
                });
    }

    @Override
    public int getOrder() {
        return -100; // 最外层拦截器
    }
}

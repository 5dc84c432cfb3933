package win.ixuni.keel.core.operation;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 操作处理器注册表
 * <p>
 * One handler per operation class, registered while the engine is built. Every
 * {@link #execute} call runs through the interceptors, lowest order outermost.
 */
@Slf4j
public class OperationHandlerRegistry {

    private final Map<Class<?>, OperationHandler<?, ?>> handlers = new ConcurrentHashMap<>();

    /**
     * Sorted by order; replaced wholesale on every add
     */
    private volatile List<HandlerInterceptor> interceptors = List.of();

    /**
     * @throws IllegalStateException if the operation type already has a handler
     */
    public <O extends Operation<R>, R> void register(OperationHandler<O, R> handler) {
        Class<O> operationType = handler.getOperationType();
        OperationHandler<?, ?> existing = handlers.putIfAbsent(operationType, handler);
        if (existing != null) {
            throw new IllegalStateException("Operation " + operationType.getSimpleName()
                    + " already handled by " + existing.getClass().getSimpleName());
        }
        log.debug("Registered {} for {}", handler.getClass().getSimpleName(), operationType.getSimpleName());
    }

    public synchronized void addInterceptor(HandlerInterceptor interceptor) {
        List<HandlerInterceptor> next = new ArrayList<>(interceptors);
        next.add(interceptor);
        next.sort(Comparator.comparingInt(HandlerInterceptor::getOrder));
        interceptors = List.copyOf(next);
        log.debug("Added interceptor {} (order {})", interceptor.getClass().getSimpleName(), interceptor.getOrder());
    }

    /**
     * Dispatch to the handler registered for the operation's class
     *
     * @return the handler's result, or an {@link UnsupportedOperationException} signal if none is registered
     */
    @SuppressWarnings("unchecked")
    public <O extends Operation<R>, R> Mono<R> execute(O operation, EngineContext context) {
        OperationHandler<O, R> handler = (OperationHandler<O, R>) handlers.get(operation.getClass());
        if (handler == null) {
            return Mono.error(new UnsupportedOperationException(
                    "No handler registered for operation: " + operation.getOperationName()));
        }

        InterceptorChain<O, R> chain = handler::handle;
        List<HandlerInterceptor> current = interceptors;
        for (int i = current.size() - 1; i >= 0; i--) {
            HandlerInterceptor interceptor = current.get(i);
            InterceptorChain<O, R> next = chain;
            chain = (op, ctx) -> interceptor.intercept(op, ctx, next);
        }
        return chain.proceed(operation, context);
    }

    public boolean supports(Class<? extends Operation<?>> operationType) {
        return handlers.containsKey(operationType);
    }

    public int size() {
        return handlers.size();
    }

    public int interceptorCount() {
        return interceptors.size();
    }
}

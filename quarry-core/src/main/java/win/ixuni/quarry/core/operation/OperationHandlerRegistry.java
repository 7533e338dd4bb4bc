package win.ixuni.quarry.core.operation;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.driver.DriverCapabilities.Capability;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dispatch table from operation class to handler, wrapped by an ordered interceptor chain
 * <p>
 * 驱动在构造时注册处理器与拦截器；之后只读。
 */
@Slf4j
public class OperationHandlerRegistry {

    private final Map<Class<?>, OperationHandler<?, ?>> handlers = new ConcurrentHashMap<>();

    /**
     * Sorted by {@link HandlerInterceptor#getOrder()}, replaced as a whole on every addition
     */
    private volatile List<HandlerInterceptor> interceptors = List.of();

    public void register(OperationHandler<?, ?> handler) {
        OperationHandler<?, ?> previous = handlers.put(handler.getOperationType(), handler);
        if (previous != null) {
            log.warn("Handler for {} replaced: {} -> {}", handler.getOperationType().getSimpleName(),
                    previous.getClass().getSimpleName(), handler.getClass().getSimpleName());
        }
    }

    public synchronized void addInterceptor(HandlerInterceptor interceptor) {
        List<HandlerInterceptor> next = new ArrayList<>(interceptors);
        next.add(interceptor);
        next.sort(Comparator.comparingInt(HandlerInterceptor::getOrder));
        interceptors = List.copyOf(next);
    }

    /**
     * Run {@code operation} through the interceptors (lowest order outermost) and its handler
     *
     * @return the handler's result, or an {@link UnsupportedOperationException} error if nothing handles it
     */
    @SuppressWarnings("unchecked")
    public <O extends Operation<R>, R> Mono<R> execute(O operation, DriverContext context) {
        OperationHandler<O, R> handler = (OperationHandler<O, R>) handlers.get(operation.getClass());
        if (handler == null) {
            return Mono.error(new UnsupportedOperationException(
                    "No handler registered for operation: " + operation.getOperationName()));
        }

        // 从最内层的 handler 开始向外包装
        InterceptorChain<O, R> chain = (op, ctx) -> Mono.defer(() -> handler.handle(op, ctx));
        List<HandlerInterceptor> snapshot = interceptors;
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            HandlerInterceptor interceptor = snapshot.get(i);
            InterceptorChain<O, R> next = chain;
            chain = (op, ctx) -> interceptor.intercept(op, ctx, next);
        }

        InterceptorChain<O, R> head = chain;
        return Mono.defer(() -> head.proceed(operation, context));
    }

    public boolean supports(Class<? extends Operation<?>> operationType) {
        return handlers.containsKey(operationType);
    }

    /**
     * Union of the capabilities declared by all registered handlers
     */
    public Set<Capability> getAggregatedCapabilities() {
        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        handlers.values().forEach(handler -> capabilities.addAll(handler.getProvidedCapabilities()));
        return capabilities;
    }
}

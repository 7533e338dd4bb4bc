package win.ixuni.quarry.core.operation;

import reactor.core.publisher.Mono;

/**
 * Handler 拦截器接口
 * <p>
 * Chain-of-responsibility hook around handler execution (logging, error translation).
 */
public interface HandlerInterceptor {

    <O extends Operation<R>, R> Mono<R> intercept(
            O operation,
            DriverContext context,
            InterceptorChain<O, R> chain);

    /**
     * Lower values run further out in the chain
     */
    default int getOrder() {
        return 0;
    }
}

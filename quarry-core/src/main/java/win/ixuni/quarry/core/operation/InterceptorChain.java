package win.ixuni.quarry.core.operation;

import reactor.core.publisher.Mono;

/**
 * Invokes the next interceptor, or the handler at the end of the chain
 *
 * @param <O> 操作类型
 * @param <R> 返回类型
 */
@FunctionalInterface
public interface InterceptorChain<O extends Operation<R>, R> {

    Mono<R> proceed(O operation, DriverContext context);
}

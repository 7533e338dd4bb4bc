package win.ixuni.quarry.driver.memory.handler;

import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.exception.BucketNotFoundException;
import win.ixuni.quarry.core.operation.DriverContext;
import win.ixuni.quarry.core.operation.Operation;
import win.ixuni.quarry.core.operation.OperationHandler;
import win.ixuni.quarry.driver.memory.context.MemoryDriverContext;

/**
 * Memory Handler 抽象基类
 * <p>
 * 提供类型安全的 Context 访问，子类无需手动强制转换。
 *
 * @param <O> 操作类型
 * @param <R> 返回类型
 */
public abstract class AbstractMemoryHandler<O extends Operation<R>, R> implements OperationHandler<O, R> {

    @Override
    public final Mono<R> handle(O operation, DriverContext context) {
        if (!(context instanceof MemoryDriverContext)) {
            return Mono.error(new IllegalArgumentException(
                    "Expected MemoryDriverContext but got: " + context.getClass().getName()));
        }
        return doHandle(operation, (MemoryDriverContext) context);
    }

    protected abstract Mono<R> doHandle(O operation, MemoryDriverContext context);

    protected static <T> Mono<T> requireBucket(MemoryDriverContext context, String bucketName, Mono<T> then) {
        if (!context.getBuckets().containsKey(bucketName)) {
            return Mono.error(new BucketNotFoundException(bucketName));
        }
        return then;
    }
}

package win.ixuni.quarry.driver.local.handler;

import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.operation.DriverContext;
import win.ixuni.quarry.core.operation.Operation;
import win.ixuni.quarry.core.operation.OperationHandler;
import win.ixuni.quarry.driver.local.context.LocalDriverContext;

/**
 * Local Handler 抽象基类
 * <p>
 * 提供类型安全的 Context 访问。Filesystem calls block, so subclasses run them on the bounded elastic scheduler.
 *
 * @param <O> 操作类型
 * @param <R> 返回类型
 */
public abstract class AbstractLocalHandler<O extends Operation<R>, R> implements OperationHandler<O, R> {

    @Override
    public final Mono<R> handle(O operation, DriverContext context) {
        if (!(context instanceof LocalDriverContext)) {
            return Mono.error(new IllegalArgumentException(
                    "Expected LocalDriverContext but got: " + context.getClass().getName()));
        }
        return doHandle(operation, (LocalDriverContext) context);
    }

    protected abstract Mono<R> doHandle(O operation, LocalDriverContext context);
}

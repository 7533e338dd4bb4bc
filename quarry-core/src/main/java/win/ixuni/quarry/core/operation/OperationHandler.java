package win.ixuni.quarry.core.operation;

import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.driver.DriverCapabilities.Capability;

import java.util.Collections;
import java.util.Set;

/**
 * Operation handler interface
 *
 * @param <O> 操作类型
 * @param <R> 返回类型
 */
public interface OperationHandler<O extends Operation<R>, R> {

    /**
     * Handle the operation
     *
     * @param operation the operation instance
     * @param context   驱动上下文
     * @return operation result
     */
    Mono<R> handle(O operation, DriverContext context);

    /**
     * 获取此处理器支持的操作类型
     */
    Class<O> getOperationType();

    /**
     * Capabilities this handler contributes to its driver
     *
     * @return 能力集合，默认为空
     */
    default Set<Capability> getProvidedCapabilities() {
        return Collections.emptySet();
    }
}

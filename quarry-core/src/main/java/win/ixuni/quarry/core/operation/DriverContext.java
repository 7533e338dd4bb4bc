package win.ixuni.quarry.core.operation;

import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.config.DriverConfig;

/**
 * State a driver's handlers share: configuration, storage structures, and the registry for running nested
 * operations. 每个驱动实现自己的上下文类。
 */
public interface DriverContext {

    DriverConfig getConfig();

    default String getDriverName() {
        return getConfig().getName();
    }

    default String getDriverType() {
        return getConfig().getType();
    }

    OperationHandlerRegistry getHandlerRegistry();

    /**
     * Called during driver initialization to inject the handler registry
     */
    void setHandlerRegistry(OperationHandlerRegistry registry);

    /**
     * Runs a nested operation through the same interceptor chain
     */
    default <O extends Operation<R>, R> Mono<R> execute(O operation) {
        return getHandlerRegistry().execute(operation, this);
    }
}

package win.ixuni.quarry.core.driver;

import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.operation.DriverContext;
import win.ixuni.quarry.core.operation.Operation;
import win.ixuni.quarry.core.operation.OperationHandlerRegistry;

/**
 * A storage backend: one metadata index plus the object store behind it
 * <p>
 * Callers never touch the index or the store directly. They build an {@link Operation} and hand it to
 * {@link #execute(Operation)}, which dispatches to whatever handler the driver registered for that class.
 */
public interface StorageDriver extends DriverCapabilities {

    OperationHandlerRegistry getHandlerRegistry();

    DriverContext getDriverContext();

    default <O extends Operation<R>, R> Mono<R> execute(O operation) {
        return getHandlerRegistry().execute(operation, getDriverContext());
    }

    /**
     * Factory type this instance was created by, e.g. {@code memory} or {@code local}
     */
    String getDriverType();

    /**
     * Instance name from {@code quarry.drivers[].name}
     */
    String getDriverName();

    /**
     * Called once by the registry before the driver serves requests
     */
    default Mono<Void> initialize() {
        return Mono.empty();
    }

    default Mono<Void> shutdown() {
        return Mono.empty();
    }
}

package win.ixuni.quarry.core.driver;

import lombok.Getter;
import win.ixuni.quarry.core.config.DriverConfig;
import win.ixuni.quarry.core.driver.DriverCapabilities.Capability;
import win.ixuni.quarry.core.operation.OperationHandler;
import win.ixuni.quarry.core.operation.OperationHandlerRegistry;
import win.ixuni.quarry.core.operation.interceptor.IOExceptionTranslationInterceptor;
import win.ixuni.quarry.core.operation.interceptor.LoggingInterceptor;

import java.util.EnumSet;
import java.util.Set;

/**
 * Base for handler-backed drivers. Every operation runs through the logging and I/O translation
 * interceptors; subclasses register their handlers and supply a {@link win.ixuni.quarry.core.operation.DriverContext}.
 */
public abstract class AbstractStorageDriver implements StorageDriver {

    @Getter
    protected final OperationHandlerRegistry handlerRegistry = new OperationHandlerRegistry();

    protected AbstractStorageDriver() {
        handlerRegistry.addInterceptor(new LoggingInterceptor());
        handlerRegistry.addInterceptor(new IOExceptionTranslationInterceptor());
    }

    protected final void registerHandlers(OperationHandler<?, ?>... handlers) {
        for (OperationHandler<?, ?> handler : handlers) {
            handlerRegistry.register(handler);
        }
    }

    @Override
    public String getDriverName() {
        return getDriverContext().getConfig().getName();
    }

    /**
     * Union of the handler capabilities, plus {@link Capability#VERSIONING} when the instance keeps versions
     */
    @Override
    public Set<Capability> getCapabilities() {
        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        capabilities.addAll(handlerRegistry.getAggregatedCapabilities());
        DriverConfig config = getDriverContext().getConfig();
        if (config != null && config.isVersioningEnabled()) {
            capabilities.add(Capability.VERSIONING);
        }
        return capabilities;
    }
}

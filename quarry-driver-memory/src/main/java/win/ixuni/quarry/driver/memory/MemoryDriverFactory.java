package win.ixuni.quarry.driver.memory;

import org.springframework.stereotype.Component;
import win.ixuni.quarry.core.config.DriverConfig;
import win.ixuni.quarry.core.driver.DriverFactory;
import win.ixuni.quarry.core.driver.StorageDriver;

/**
 * In-memory driver factory
 */
@Component
public class MemoryDriverFactory implements DriverFactory {

    public static final String DRIVER_TYPE = "memory";

    @Override
    public String getDriverType() {
        return DRIVER_TYPE;
    }

    @Override
    public StorageDriver createDriver(DriverConfig config) {
        return new MemoryStorageDriver(config);
    }

    @Override
    public String getDescription() {
        return "In-memory storage driver for development and tests";
    }
}

package win.ixuni.quarry.core.driver;

import win.ixuni.quarry.core.config.DriverConfig;

/**
 * Builds driver instances of one type. Any number of instances may come from the same factory, each with
 * its own {@link DriverConfig}.
 */
public interface DriverFactory {

    /**
     * Value matched against {@code quarry.drivers[].type}
     */
    String getDriverType();

    StorageDriver createDriver(DriverConfig config);

    default String getDescription() {
        return getDriverType();
    }
}

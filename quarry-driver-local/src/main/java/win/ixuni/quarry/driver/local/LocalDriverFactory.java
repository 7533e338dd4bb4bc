package win.ixuni.quarry.driver.local;

import org.springframework.stereotype.Component;
import win.ixuni.quarry.core.config.DriverConfig;
import win.ixuni.quarry.core.driver.DriverFactory;
import win.ixuni.quarry.core.driver.StorageDriver;

/**
 * 本地文件系统驱动工厂
 */
@Component
public class LocalDriverFactory implements DriverFactory {

    public static final String DRIVER_TYPE = "local";

    @Override
    public String getDriverType() {
        return DRIVER_TYPE;
    }

    @Override
    public StorageDriver createDriver(DriverConfig config) {
        return new LocalStorageDriver(config);
    }

    @Override
    public String getDescription() {
        return "Local filesystem storage driver";
    }
}

package win.ixuni.quarry.server.registry;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.config.DriverConfig;
import win.ixuni.quarry.core.config.QuarryProperties;
import win.ixuni.quarry.core.driver.DriverFactory;
import win.ixuni.quarry.core.driver.StorageDriver;
import win.ixuni.quarry.core.exception.DriverNotFoundException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 驱动注册表
 * <p>
 * One live instance per enabled {@code quarry.drivers[]} entry, looked up by name. A misconfigured entry
 * (unknown type, reused name) stops the application from starting.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DriverRegistry {

    private final QuarryProperties properties;
    private final List<DriverFactory> driverFactories;

    // 启动后只读
    private volatile Map<String, StorageDriver> instances = Map.of();

    @PostConstruct
    public void initialize() {
        Map<String, DriverFactory> factoriesByType = driverFactories.stream()
                .collect(Collectors.toMap(DriverFactory::getDriverType, Function.identity()));
        log.debug("Available driver types: {}", factoriesByType.keySet());

        Map<String, StorageDriver> created = new LinkedHashMap<>();
        for (DriverConfig config : properties.getDrivers()) {
            if (!config.isEnabled()) {
                log.info("Skipping disabled driver entry '{}'", config.getName());
                continue;
            }
            if (created.containsKey(config.getName())) {
                throw new IllegalStateException("Driver name '" + config.getName() + "' is configured twice");
            }
            created.put(config.getName(), start(factoriesByType.get(config.getType()), config));
        }

        instances = Map.copyOf(created);
        log.info("{} storage driver(s) ready: {}", created.size(), created.keySet());
    }

    private StorageDriver start(DriverFactory factory, DriverConfig config) {
        if (factory == null) {
            throw new IllegalStateException(
                    "Driver '" + config.getName() + "' has unsupported type '" + config.getType() + "'");
        }
        StorageDriver driver = factory.createDriver(config);
        driver.initialize().block();
        log.info("Started driver '{}' ({})", config.getName(), factory.getDescription());
        return driver;
    }

    @PreDestroy
    public void shutdown() {
        Flux.fromIterable(instances.values())
                .flatMap(driver -> driver.shutdown()
                        .onErrorResume(e -> {
                            log.warn("Driver '{}' did not stop cleanly: {}", driver.getDriverName(), e.getMessage());
                            return Mono.empty();
                        }))
                .blockLast();
        log.info("Storage drivers stopped");
    }

    /**
     * @throws DriverNotFoundException when no instance carries this name
     */
    public StorageDriver getDriver(String name) {
        StorageDriver driver = instances.get(name);
        if (driver == null) {
            throw new DriverNotFoundException(name);
        }
        return driver;
    }

    public Map<String, StorageDriver> getAllDrivers() {
        return instances;
    }
}

package win.ixuni.quarry.driver.memory;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.config.DriverConfig;
import win.ixuni.quarry.core.driver.AbstractStorageDriver;
import win.ixuni.quarry.core.driver.ReclaimableDriver;
import win.ixuni.quarry.core.operation.DriverContext;
import win.ixuni.quarry.driver.memory.context.MemoryDriverContext;
import win.ixuni.quarry.driver.memory.handler.bucket.MemoryBucketExistsHandler;
import win.ixuni.quarry.driver.memory.handler.bucket.MemoryCreateBucketHandler;
import win.ixuni.quarry.driver.memory.handler.bucket.MemoryDeleteBucketHandler;
import win.ixuni.quarry.driver.memory.handler.object.MemoryLookupObjectHandler;
import win.ixuni.quarry.driver.memory.handler.object.MemoryPutObjectHandler;
import win.ixuni.quarry.driver.memory.handler.object.MemoryReadObjectHandler;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Memory 存储驱动
 * <p>
 * Index and object store are heap maps; nothing survives {@link #shutdown()}.
 */
@Slf4j
public class MemoryStorageDriver extends AbstractStorageDriver implements ReclaimableDriver {

    private final MemoryDriverContext driverContext;

    public MemoryStorageDriver(DriverConfig config) {
        driverContext = MemoryDriverContext.builder().config(config).build();
        driverContext.setHandlerRegistry(handlerRegistry);
        registerHandlers(
                new MemoryCreateBucketHandler(),
                new MemoryDeleteBucketHandler(),
                new MemoryBucketExistsHandler(),
                new MemoryPutObjectHandler(),
                new MemoryLookupObjectHandler(),
                new MemoryReadObjectHandler());
    }

    @Override
    public DriverContext getDriverContext() {
        return driverContext;
    }

    @Override
    public String getDriverType() {
        return MemoryDriverFactory.DRIVER_TYPE;
    }

    /**
     * Drops blobs whose supersede time is past the grace period. A concurrent second pass cannot count
     * the same blob twice since removal is conditional on the recorded time.
     */
    @Override
    public Mono<Long> reclaimSuperseded(Duration gracePeriod) {
        return Mono.fromSupplier(() -> {
            Instant cutoff = Instant.now().minus(gracePeriod);
            Map<String, Instant> superseded = driverContext.getSuperseded();
            long reclaimed = 0;
            for (String locationId : superseded.keySet()) {
                Instant supersededAt = superseded.get(locationId);
                if (supersededAt != null && !supersededAt.isAfter(cutoff)
                        && superseded.remove(locationId, supersededAt)) {
                    driverContext.getBlobs().remove(locationId);
                    reclaimed++;
                }
            }
            log.debug("[{}] reclaimed {} blob(s)", getDriverName(), reclaimed);
            return reclaimed;
        });
    }

    @Override
    public Mono<Void> initialize() {
        log.info("Memory driver '{}' ready (versioning={})", getDriverName(), driverContext.isVersioningEnabled());
        return Mono.empty();
    }

    @Override
    public Mono<Void> shutdown() {
        driverContext.getBuckets().clear();
        driverContext.getIndex().clear();
        driverContext.getBlobs().clear();
        driverContext.getSuperseded().clear();
        return Mono.empty();
    }
}

package win.ixuni.quarry.server.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import win.ixuni.quarry.core.config.QuarryProperties;
import win.ixuni.quarry.core.driver.ReclaimableDriver;
import win.ixuni.quarry.server.registry.DriverRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduled reclamation of superseded storage locations
 * <p>
 * 只回收超过宽限期的旧位置，保证与覆盖写并发的读取仍可完成。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StorageReclaimService {

    private final DriverRegistry driverRegistry;
    private final QuarryProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(cron = "${quarry.reclaim.cron:0 */5 * * * *}")
    public void scheduledReclaim() {
        if (!properties.getReclaim().isEnabled()) {
            log.debug("Reclaim is disabled, skipping scheduled run");
            return;
        }
        reclaim();
    }

    /**
     * Run one reclamation pass over every reclaimable driver
     *
     * @return locations reclaimed, or -1 if a pass was already running
     */
    public long reclaim() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Previous reclaim is still running, skipping this run");
            return -1;
        }

        try {
            Duration grace = properties.getReclaim().getGracePeriod();
            long total = 0;
            for (var driver : driverRegistry.getAllDrivers().values()) {
                if (driver instanceof ReclaimableDriver reclaimable) {
                    try {
                        Long count = reclaimable.reclaimSuperseded(grace).block();
                        if (count != null && count > 0) {
                            log.info("Reclaimed {} superseded locations from driver {}", count, driver.getDriverName());
                            total += count;
                        }
                    } catch (Exception e) {
                        log.error("Reclaim failed for driver {}: {}", driver.getDriverName(), e.getMessage(), e);
                    }
                }
            }
            return total;
        } finally {
            running.set(false);
        }
    }
}

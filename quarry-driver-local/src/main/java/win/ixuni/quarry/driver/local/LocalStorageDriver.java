package win.ixuni.quarry.driver.local;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.quarry.core.config.DriverConfig;
import win.ixuni.quarry.core.driver.AbstractStorageDriver;
import win.ixuni.quarry.core.driver.ReclaimableDriver;
import win.ixuni.quarry.core.operation.DriverContext;
import win.ixuni.quarry.core.util.SidecarMetadata;
import win.ixuni.quarry.driver.local.context.LocalDriverContext;
import win.ixuni.quarry.driver.local.context.SidecarIndex;
import win.ixuni.quarry.driver.local.handler.LocalFileUtils;
import win.ixuni.quarry.driver.local.handler.bucket.LocalBucketExistsHandler;
import win.ixuni.quarry.driver.local.handler.bucket.LocalCreateBucketHandler;
import win.ixuni.quarry.driver.local.handler.bucket.LocalDeleteBucketHandler;
import win.ixuni.quarry.driver.local.handler.object.LocalLookupObjectHandler;
import win.ixuni.quarry.driver.local.handler.object.LocalPutObjectHandler;
import win.ixuni.quarry.driver.local.handler.object.LocalReadObjectHandler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 本地文件系统存储驱动
 * <p>
 * Objects are immutable blob files addressed by location id; the metadata index is one sidecar JSON file per
 * key. Survives restarts.
 */
@Slf4j
public class LocalStorageDriver extends AbstractStorageDriver implements ReclaimableDriver {

    private final LocalDriverContext driverContext;

    public LocalStorageDriver(DriverConfig config) {
        driverContext = LocalDriverContext.builder()
                .config(config)
                .basePath(Path.of(config.getString("base-path", "/tmp/quarry")))
                .build();
        driverContext.setHandlerRegistry(handlerRegistry);
        registerHandlers(
                new LocalCreateBucketHandler(),
                new LocalDeleteBucketHandler(),
                new LocalBucketExistsHandler(),
                new LocalPutObjectHandler(),
                new LocalLookupObjectHandler(),
                new LocalReadObjectHandler());
    }

    @Override
    public DriverContext getDriverContext() {
        return driverContext;
    }

    @Override
    public String getDriverType() {
        return LocalDriverFactory.DRIVER_TYPE;
    }

    /**
     * Creates the blob, metadata and temp directories under the base path
     */
    @Override
    public Mono<Void> initialize() {
        return Mono.fromCallable(() -> {
                    for (Path dir : List.of(driverContext.getBlobRoot(), driverContext.getMetaRoot(),
                            driverContext.getTmpRoot())) {
                        Files.createDirectories(dir);
                    }
                    log.info("Local driver '{}' ready at {}", getDriverName(), driverContext.getRoot());
                    return true;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    // ============ ReclaimableDriver 实现 ============

    /**
     * Delete blob files no sidecar references whose mtime is older than the grace period, plus stale
     * in-flight upload files
     * <p>
     * The mtime of a superseded blob is its supersede time (see {@link LocalDriverContext#commit}).
     */
    @Override
    public Mono<Long> reclaimSuperseded(Duration gracePeriod) {
        return Mono.fromCallable(() -> {
            Instant cutoff = Instant.now().minus(gracePeriod);
            Set<String> referenced = collectReferencedLocations();
            long reclaimed = 0;

            Path blobRoot = driverContext.getBlobRoot();
            if (Files.isDirectory(blobRoot)) {
                for (Path blob : listFiles(blobRoot)) {
                    String locationId = blob.getFileName().toString();
                    if (!referenced.contains(locationId) && olderThan(blob, cutoff)) {
                        Files.deleteIfExists(blob);
                        reclaimed++;
                    }
                }
            }

            Path tmpRoot = driverContext.getTmpRoot();
            if (Files.isDirectory(tmpRoot)) {
                for (Path temp : listFiles(tmpRoot)) {
                    if (olderThan(temp, cutoff)) {
                        LocalFileUtils.deleteQuietly(temp);
                    }
                }
            }

            if (reclaimed > 0) {
                log.info("[{}] Reclaimed {} superseded blobs", getDriverName(), reclaimed);
            }
            return reclaimed;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private Set<String> collectReferencedLocations() throws IOException {
        Set<String> referenced = new HashSet<>();
        Path metaRoot = driverContext.getMetaRoot();
        if (!Files.isDirectory(metaRoot)) {
            return referenced;
        }
        for (Path sidecar : listFiles(metaRoot)) {
            if (!SidecarMetadata.isSidecarFile(sidecar.getFileName().toString())) {
                continue;
            }
            SidecarIndex index = LocalFileUtils.readIndex(sidecar);
            if (index == null) {
                continue;
            }
            if (index.getCurrent() != null) {
                referenced.add(index.getCurrent().getLocationId());
            }
            index.getVersions().forEach(v -> referenced.add(v.getLocationId()));
        }
        return referenced;
    }

    private static List<Path> listFiles(Path root) throws IOException {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile).toList();
        }
    }

    private static boolean olderThan(Path path, Instant cutoff) throws IOException {
        return !Files.getLastModifiedTime(path).toInstant().isAfter(cutoff);
    }
}

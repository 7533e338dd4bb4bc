package win.ixuni.quarry.driver.local.context;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import win.ixuni.quarry.core.config.DriverConfig;
import win.ixuni.quarry.core.model.ObjectMetadata;
import win.ixuni.quarry.core.operation.DriverContext;
import win.ixuni.quarry.core.operation.OperationHandlerRegistry;
import win.ixuni.quarry.core.util.KeyLockManager;
import win.ixuni.quarry.core.util.SidecarMetadata;
import win.ixuni.quarry.driver.local.handler.LocalFileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

/**
 * 本地文件系统驱动上下文
 * <p>
 * Path layout and the index commit. Blobs are immutable files named by location id; each key's metadata lives
 * in a sidecar JSON file that is only ever replaced by an atomic rename.
 */
@Slf4j
@Getter
@Builder
public class LocalDriverContext implements DriverContext {

    private final DriverConfig config;

    /**
     * 存储根路径
     */
    private final Path basePath;

    /**
     * Serializes sidecar read-modify-write per key
     */
    @Builder.Default
    private final KeyLockManager lockManager = new KeyLockManager();

    @Setter
    private OperationHandlerRegistry handlerRegistry;

    public boolean isVersioningEnabled() {
        return config.isVersioningEnabled();
    }

    public int getReadBufferSize() {
        return config.getReadBufferSize();
    }

    public Path getRoot() {
        return basePath.resolve(SidecarMetadata.QUARRY_ROOT);
    }

    public Path getBlobRoot() {
        return getRoot().resolve(SidecarMetadata.BLOB_DIR);
    }

    public Path getMetaRoot() {
        return getRoot().resolve(SidecarMetadata.META_DIR);
    }

    public Path getTmpRoot() {
        return getRoot().resolve(SidecarMetadata.TMP_DIR);
    }

    /**
     * A bucket exists when its metadata directory exists
     */
    public Path getBucketMetaPath(String bucketName) {
        return confined(getMetaRoot(), bucketName);
    }

    public Path getBucketBlobPath(String bucketName) {
        return confined(getBlobRoot(), bucketName);
    }

    public Path getBlobPath(String bucketName, String locationId) {
        return confined(getBucketBlobPath(bucketName), locationId);
    }

    public Path getMetadataPath(String bucketName, String key) {
        return confined(getBucketMetaPath(bucketName), key + SidecarMetadata.SIDECAR_SUFFIX);
    }

    /**
     * Resolve {@code name} strictly below {@code root}
     *
     * @throws IllegalArgumentException for absolute names and names that normalize to {@code root} or outside it
     */
    static Path confined(Path root, String name) {
        Path normalizedRoot = root.normalize();
        Path resolved = normalizedRoot.resolve(name).normalize();
        if (resolved.equals(normalizedRoot) || !resolved.startsWith(normalizedRoot)) {
            throw new IllegalArgumentException("Name resolves outside the storage root: " + name);
        }
        return resolved;
    }

    public boolean bucketExists(String bucketName) {
        return Files.isDirectory(getBucketMetaPath(bucketName));
    }

    /**
     * Make {@code metadata} the key's current version; caller holds the key lock
     * <p>
     * Without versioning the replaced blob's mtime is set to now, so reclamation measures its grace period
     * from the moment it was superseded rather than from when it was written.
     */
    public ObjectMetadata commit(ObjectMetadata metadata) throws IOException {
        String bucketName = metadata.getBucketName();
        Path metaPath = getMetadataPath(bucketName, metadata.getKey());
        SidecarMetadata record = LocalFileUtils.toSidecar(metadata);

        SidecarIndex previous = LocalFileUtils.readIndex(metaPath);
        SidecarIndex next;
        if (previous != null && isVersioningEnabled()) {
            next = previous.withVersion(record);
        } else {
            next = SidecarIndex.of(record);
        }
        LocalFileUtils.writeIndexAtomically(metaPath, next);

        if (previous != null && !isVersioningEnabled() && previous.getCurrent() != null) {
            markSuperseded(getBlobPath(bucketName, previous.getCurrent().getLocationId()));
        }
        return metadata;
    }

    private void markSuperseded(Path blobPath) {
        try {
            if (Files.exists(blobPath)) {
                Files.setLastModifiedTime(blobPath, FileTime.from(Instant.now()));
            }
        } catch (IOException e) {
            // reclamation then falls back to the write time
            log.warn("Failed to mark superseded blob {}: {}", blobPath, e.getMessage());
        }
    }
}

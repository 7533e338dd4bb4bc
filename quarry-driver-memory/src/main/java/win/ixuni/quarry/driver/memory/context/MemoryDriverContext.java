package win.ixuni.quarry.driver.memory.context;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.Value;
import win.ixuni.quarry.core.config.DriverConfig;
import win.ixuni.quarry.core.model.ObjectMetadata;
import win.ixuni.quarry.core.operation.DriverContext;
import win.ixuni.quarry.core.operation.OperationHandlerRegistry;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Memory 驱动上下文
 * <p>
 * Holds the metadata index (key → {@link IndexEntry}) and the object store (location id → bytes).
 * Blobs are never mutated; an overwrite only swaps the index entry.
 */
@Getter
@Builder
public class MemoryDriverContext implements DriverContext {

    private final DriverConfig config;

    /**
     * Bucket 存储：bucketName -> BucketInfo
     */
    @Builder.Default
    private final Map<String, BucketInfo> buckets = new ConcurrentHashMap<>();

    /**
     * Metadata index: bucketName/key -> IndexEntry
     */
    @Builder.Default
    private final Map<String, IndexEntry> index = new ConcurrentHashMap<>();

    /**
     * Object store: locationId -> bytes
     */
    @Builder.Default
    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

    /**
     * Locations no index entry references any more: locationId -> time superseded
     */
    @Builder.Default
    private final Map<String, Instant> superseded = new ConcurrentHashMap<>();

    @Setter
    private OperationHandlerRegistry handlerRegistry;

    public boolean isVersioningEnabled() {
        return config.isVersioningEnabled();
    }

    public int getReadBufferSize() {
        return config.getReadBufferSize();
    }

    public String objectKey(String bucketName, String key) {
        return bucketName + "/" + key;
    }

    /**
     * Make {@code metadata} the key's current version
     * <p>
     * Atomic per key. Without versioning the replaced location is marked superseded rather than dropped,
     * so a reader that already resolved it can finish.
     */
    public ObjectMetadata commit(ObjectMetadata metadata) {
        String objectKey = objectKey(metadata.getBucketName(), metadata.getKey());
        index.compute(objectKey, (k, previous) -> {
            if (previous == null) {
                return IndexEntry.first(metadata);
            }
            if (isVersioningEnabled()) {
                return previous.withVersion(metadata);
            }
            superseded.put(previous.getCurrent().getLocation().getId(), Instant.now());
            return IndexEntry.first(metadata);
        });
        return metadata;
    }

    public boolean hasObjects(String bucketName) {
        String prefix = bucketName + "/";
        return index.keySet().stream().anyMatch(key -> key.startsWith(prefix));
    }

    @Getter
    @Builder
    public static class BucketInfo {
        private final String name;
        private final Instant creationDate;
    }

    /**
     * Immutable snapshot of one key's versions; replaced wholesale on commit
     */
    @Value
    public static class IndexEntry {

        ObjectMetadata current;

        /**
         * versionId -> metadata, oldest first; empty when the driver does not keep versions
         */
        Map<String, ObjectMetadata> versions;

        static IndexEntry first(ObjectMetadata metadata) {
            Map<String, ObjectMetadata> versions = new LinkedHashMap<>();
            if (metadata.getVersionId() != null) {
                versions.put(metadata.getVersionId(), metadata);
            }
            return new IndexEntry(metadata, Collections.unmodifiableMap(versions));
        }

        IndexEntry withVersion(ObjectMetadata metadata) {
            Map<String, ObjectMetadata> next = new LinkedHashMap<>(versions);
            next.put(metadata.getVersionId(), metadata);
            return new IndexEntry(metadata, Collections.unmodifiableMap(next));
        }
    }
}

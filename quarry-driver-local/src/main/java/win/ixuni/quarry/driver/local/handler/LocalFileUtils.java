package win.ixuni.quarry.driver.local.handler;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import win.ixuni.quarry.core.model.ObjectMetadata;
import win.ixuni.quarry.core.model.StorageLocation;
import win.ixuni.quarry.core.util.SidecarMetadata;
import win.ixuni.quarry.driver.local.context.SidecarIndex;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Local 驱动共享工具方法
 */
@Slf4j
public final class LocalFileUtils {

    private LocalFileUtils() {
    }

    /**
     * 共享 ObjectMapper 实例（线程安全）
     */
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    /**
     * 读取 Sidecar 索引，不存在时返回 null
     */
    public static SidecarIndex readIndex(Path metaPath) throws IOException {
        if (!Files.exists(metaPath)) {
            return null;
        }
        return MAPPER.readValue(metaPath.toFile(), SidecarIndex.class);
    }

    /**
     * Replace the sidecar in one rename so concurrent readers see either the old or the new file
     */
    public static void writeIndexAtomically(Path metaPath, SidecarIndex index) throws IOException {
        Files.createDirectories(metaPath.getParent());
        Path temp = metaPath.resolveSibling(metaPath.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            MAPPER.writeValue(temp.toFile(), index);
            moveAtomically(temp, metaPath);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    public static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to plain replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * 递归删除目录及其内容
     */
    public static void deleteDirectoryRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        }
    }

    public static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", path, e.getMessage());
        }
    }

    // ============ Sidecar <-> model ============

    public static SidecarMetadata toSidecar(ObjectMetadata metadata) {
        return SidecarMetadata.builder()
                .locationId(metadata.getLocation().getId())
                .versionId(metadata.getVersionId())
                .etag(metadata.getEtag())
                .contentType(metadata.getContentType())
                .userMetadata(metadata.getUserMetadata())
                .size(metadata.getSize())
                .lastModified(metadata.getLastModified().toEpochMilli())
                .build();
    }

    public static ObjectMetadata toMetadata(String bucketName, String key, SidecarMetadata sidecar) {
        return ObjectMetadata.builder()
                .bucketName(bucketName)
                .key(key)
                .size(sidecar.getSize() != null ? sidecar.getSize() : 0L)
                .etag(sidecar.getEtag())
                .contentType(sidecar.getContentType() != null ? sidecar.getContentType() : "application/octet-stream")
                .lastModified(sidecar.getLastModifiedInstant())
                .versionId(sidecar.getVersionId())
                .location(new StorageLocation(sidecar.getLocationId()))
                .userMetadata(sidecar.getUserMetadata() != null ? sidecar.getUserMetadata() : Map.of())
                .build();
    }
}

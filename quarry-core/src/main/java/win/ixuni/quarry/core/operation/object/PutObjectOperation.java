package win.ixuni.quarry.core.operation.object;

import lombok.Builder;
import lombok.Value;
import reactor.core.publisher.Flux;
import win.ixuni.quarry.core.model.ObjectMetadata;
import win.ixuni.quarry.core.model.StorageLocation;
import win.ixuni.quarry.core.operation.Operation;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Put object operation
 * <p>
 * Streams the content into a fresh storage location, then commits it as the key's current version.
 */
@Value
@Builder
public class PutObjectOperation implements Operation<ObjectMetadata> {

    public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    String bucketName;

    String key;

    /**
     * 对象内容流
     */
    Flux<ByteBuffer> content;

    String contentType;

    /**
     * User metadata ({@code x-amz-meta-*} without the prefix)
     */
    Map<String, String> userMetadata;

    public Flux<ByteBuffer> contentOrEmpty() {
        return content != null ? content : Flux.empty();
    }

    /**
     * Metadata of the stored bytes, stamped now; {@code versioned} drivers get a fresh version id
     */
    public ObjectMetadata describe(StorageLocation location, long size, String etag, boolean versioned) {
        return ObjectMetadata.builder()
                .bucketName(bucketName)
                .key(key)
                .size(size)
                .etag(etag)
                .contentType(contentType != null ? contentType : DEFAULT_CONTENT_TYPE)
                .lastModified(Instant.now())
                .versionId(versioned ? UUID.randomUUID().toString() : null)
                .location(location)
                .userMetadata(userMetadata != null ? Map.copyOf(userMetadata) : Map.of())
                .build();
    }
}

package win.ixuni.quarry.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Metadata index entry for one object version
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ObjectMetadata {

    private String bucketName;

    /**
     * 对象Key
     */
    private String key;

    /**
     * 对象大小(字节)
     */
    private long size;

    /**
     * Hex MD5 of the content, unquoted
     */
    private String etag;

    private String contentType;

    /**
     * Last modified time
     */
    private Instant lastModified;

    /**
     * Version id, null when the owning driver does not keep versions
     */
    private String versionId;

    /**
     * Where the object store keeps the bytes
     */
    private StorageLocation location;

    /**
     * User-defined metadata (x-amz-meta-*)
     */
    private Map<String, String> userMetadata;
}

package win.ixuni.quarry.core.util;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Sidecar metadata record for one object version
 * <p>
 * Filesystem-based drivers have no native metadata store and persist metadata as JSON next to the blobs.
 * <p>
 * Directory structure:
 *
 * <pre>
 *   basePath/
 *     quarry/
 *       blobs/         ← immutable object bytes, one file per storage location
 *         bucket-name/
 *           locationId
 *       meta/          ← metadata index (sidecar files)
 *         bucket-name/
 *           key.quarry.meta
 *       tmp/           ← in-flight writes
 * </pre>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SidecarMetadata {

    // ============ Shared Path Constants ============

    public static final String QUARRY_ROOT = "quarry";

    public static final String BLOB_DIR = "blobs";

    public static final String META_DIR = "meta";

    public static final String TMP_DIR = "tmp";

    public static final String SIDECAR_SUFFIX = ".quarry.meta";

    // ============ Metadata Fields ============

    /**
     * Blob file holding the bytes of this version
     */
    private String locationId;

    /**
     * Only set when the driver keeps versions
     */
    private String versionId;

    /**
     * S3 ETag (MD5 hex, unquoted)
     */
    private String etag;

    private String contentType;

    private Map<String, String> userMetadata;

    private Long size;

    /**
     * Last modified time (epoch milliseconds)
     */
    private Long lastModified;

    public static boolean isSidecarFile(String filename) {
        return filename != null && filename.endsWith(SIDECAR_SUFFIX);
    }

    @JsonIgnore
    public Instant getLastModifiedInstant() {
        return lastModified != null ? Instant.ofEpochMilli(lastModified) : null;
    }
}

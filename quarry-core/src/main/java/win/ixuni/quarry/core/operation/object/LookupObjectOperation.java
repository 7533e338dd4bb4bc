package win.ixuni.quarry.core.operation.object;

import lombok.Value;
import win.ixuni.quarry.core.model.ObjectMetadata;
import win.ixuni.quarry.core.operation.Operation;

/**
 * Metadata index lookup
 * <p>
 * Fails with NoSuchBucket, NoSuchKey or, when {@code versionId} is set, NoSuchVersion.
 */
@Value
public class LookupObjectOperation implements Operation<ObjectMetadata> {

    String bucketName;

    String key;

    /**
     * Specific version to resolve, null for the current one
     */
    String versionId;

    public static LookupObjectOperation current(String bucketName, String key) {
        return new LookupObjectOperation(bucketName, key, null);
    }
}

package win.ixuni.quarry.core.exception;

/**
 * Thrown when a version id is requested that the key never had (or that was reclaimed)
 */
public class VersionNotFoundException extends QuarryException {

    public VersionNotFoundException(String bucketName, String key, String versionId) {
        super("NoSuchVersion", "The specified version does not exist.", 404);
        withDetail("Key", key);
        withDetail("VersionId", versionId);
        withDetail("BucketName", bucketName);
    }
}

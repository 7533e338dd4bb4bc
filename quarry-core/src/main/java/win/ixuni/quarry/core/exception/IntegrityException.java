package win.ixuni.quarry.core.exception;

/**
 * Stored bytes disagree with the metadata recorded for them
 * <p>
 * Fatal for the read that detected it; never retried or masked.
 */
public class IntegrityException extends QuarryException {

    public IntegrityException(String bucketName, String key, String message) {
        super("IntegrityError", "Stored object failed integrity check: " + message, 500);
        withDetail("Key", key);
        withDetail("BucketName", bucketName);
    }
}

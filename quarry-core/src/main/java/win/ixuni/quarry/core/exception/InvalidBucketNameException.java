package win.ixuni.quarry.core.exception;

/**
 * Bucket name violates S3 naming rules
 */
public class InvalidBucketNameException extends QuarryException {

    public InvalidBucketNameException(String bucketName, String reason) {
        super("InvalidBucketName", "The specified bucket is not valid: " + reason, 400);
        withDetail("BucketName", bucketName);
    }
}

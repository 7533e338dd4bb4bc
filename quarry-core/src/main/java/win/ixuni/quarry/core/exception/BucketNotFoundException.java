package win.ixuni.quarry.core.exception;

/**
 * Bucket not found exception
 */
public class BucketNotFoundException extends QuarryException {

    public BucketNotFoundException(String bucketName) {
        super("NoSuchBucket", "The specified bucket does not exist", 404);
        withDetail("BucketName", bucketName);
    }
}

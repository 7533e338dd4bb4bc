package win.ixuni.quarry.core.exception;

/**
 * Bucket not empty exception
 * 
 * Thrown when attempting to delete a non-empty bucket.
 */
public class BucketNotEmptyException extends QuarryException {

    public BucketNotEmptyException(String bucketName) {
        super("BucketNotEmpty", "The bucket you tried to delete is not empty", 409);
        withDetail("BucketName", bucketName);
    }
}

package win.ixuni.quarry.core.exception;

/**
 * Object not found exception
 */
public class ObjectNotFoundException extends QuarryException {

    public ObjectNotFoundException(String bucketName, String key) {
        super("NoSuchKey", "The specified key does not exist.", 404);
        withDetail("Key", key);
        withDetail("BucketName", bucketName);
    }
}

package win.ixuni.quarry.core.exception;

/**
 * Underlying storage failed while serving a request
 * <p>
 * Surfaced as-is; retry is the caller's decision.
 */
public class StorageIOException extends QuarryException {

    public StorageIOException(String message, Throwable cause) {
        super("InternalError", message, 500, cause);
    }
}

package win.ixuni.quarry.core.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Quarry base exception
 * <p>
 * Carries the S3 error code and HTTP status the server answers with. Extra error body elements
 * (Key, BucketName, VersionId, ...) are attached as details in insertion order.
 */
@Getter
public class QuarryException extends RuntimeException {

    private final String errorCode;
    private final int httpStatus;
    private final Map<String, String> details = new LinkedHashMap<>();

    public QuarryException(String errorCode, String message, int httpStatus) {
        super(message);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    public QuarryException(String errorCode, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    /**
     * Attach an element of the S3 error body, ignored when the value is null
     */
    protected QuarryException withDetail(String element, String value) {
        if (value != null) {
            details.put(element, value);
        }
        return this;
    }

    public Map<String, String> getDetails() {
        return Collections.unmodifiableMap(details);
    }
}

package win.ixuni.quarry.core.exception;

import lombok.Getter;

/**
 * Requested range cannot be satisfied for the object's current length
 */
@Getter
public class InvalidRangeException extends QuarryException {

    private final long objectSize;

    public InvalidRangeException(String rangeRequested, long objectSize) {
        super("InvalidRange", "The requested range is not satisfiable", 416);
        this.objectSize = objectSize;
        withDetail("RangeRequested", rangeRequested);
        withDetail("ActualObjectSize", String.valueOf(objectSize));
    }
}

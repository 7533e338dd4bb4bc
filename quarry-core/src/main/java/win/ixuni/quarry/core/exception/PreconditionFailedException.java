package win.ixuni.quarry.core.exception;

/**
 * At least one of the If-Match / If-Unmodified-Since preconditions did not hold
 */
public class PreconditionFailedException extends QuarryException {

    public PreconditionFailedException(String condition) {
        super("PreconditionFailed", "At least one of the pre-conditions you specified did not hold", 412);
        withDetail("Condition", condition);
    }
}

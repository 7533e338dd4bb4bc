package win.ixuni.quarry.core.retrieval;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import win.ixuni.quarry.core.model.ByteRange;

/**
 * Outcome of evaluating conditional and range headers against an object's metadata
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RetrievalDecision {

    public enum Outcome {
        FULL,
        PARTIAL,
        NOT_MODIFIED,
        PRECONDITION_FAILED,
        RANGE_NOT_SATISFIABLE
    }

    Outcome outcome;

    /**
     * Bytes to send; null for a full read of an empty object and for the non-content outcomes
     */
    ByteRange range;

    /**
     * Name of the header that failed, for {@link Outcome#PRECONDITION_FAILED}
     */
    String failedCondition;

    public static RetrievalDecision full(long size) {
        return new RetrievalDecision(Outcome.FULL, size > 0 ? ByteRange.full(size) : null, null);
    }

    public static RetrievalDecision partial(ByteRange range) {
        return new RetrievalDecision(Outcome.PARTIAL, range, null);
    }

    public static RetrievalDecision notModified() {
        return new RetrievalDecision(Outcome.NOT_MODIFIED, null, null);
    }

    public static RetrievalDecision preconditionFailed(String condition) {
        return new RetrievalDecision(Outcome.PRECONDITION_FAILED, null, condition);
    }

    public static RetrievalDecision rangeNotSatisfiable() {
        return new RetrievalDecision(Outcome.RANGE_NOT_SATISFIABLE, null, null);
    }
}

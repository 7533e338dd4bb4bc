package win.ixuni.quarry.core.retrieval;

import lombok.Builder;
import lombok.Value;

/**
 * Raw conditional and range request headers
 * <p>
 * Values are kept as sent; {@link RetrievalDecider} parses them and ignores the ones it cannot parse.
 */
@Value
@Builder
public class RetrievalConditions {

    private static final RetrievalConditions NONE = RetrievalConditions.builder().build();

    String ifMatch;

    String ifNoneMatch;

    String ifModifiedSince;

    String ifUnmodifiedSince;

    String range;

    /**
     * Entity tag or HTTP date guarding {@link #range}
     */
    String ifRange;

    public static RetrievalConditions none() {
        return NONE;
    }
}

package win.ixuni.quarry.core.retrieval;

import lombok.Builder;
import lombok.Value;
import reactor.core.publisher.Flux;
import win.ixuni.quarry.core.model.ByteRange;
import win.ixuni.quarry.core.model.ObjectMetadata;
import win.ixuni.quarry.core.retrieval.RetrievalDecision.Outcome;

import java.nio.ByteBuffer;

/**
 * Response descriptor produced by the retrieval engine
 * <p>
 * Only the FULL, PARTIAL and NOT_MODIFIED outcomes produce a result; the others are errors.
 */
@Value
@Builder
public class RetrievalResult {

    Outcome outcome;

    ObjectMetadata metadata;

    /**
     * Bytes being sent, null for an empty object or a 304
     */
    ByteRange range;

    /**
     * Body stream, empty for HEAD and 304
     */
    @Builder.Default
    Flux<ByteBuffer> content = Flux.empty();

    public boolean isPartial() {
        return outcome == Outcome.PARTIAL;
    }

    public boolean isNotModified() {
        return outcome == Outcome.NOT_MODIFIED;
    }

    /**
     * Exact number of body bytes a GET response carries
     */
    public long getContentLength() {
        return range != null ? range.length() : 0;
    }
}

package win.ixuni.quarry.core.retrieval;

import lombok.Builder;
import lombok.Value;

/**
 * One GetObject / HeadObject request as seen by the retrieval engine
 */
@Value
@Builder
public class RetrievalRequest {

    String bucketName;

    String key;

    /**
     * null resolves the current version
     */
    String versionId;

    @Builder.Default
    RetrievalConditions conditions = RetrievalConditions.none();

    /**
     * HEAD: evaluate everything but never open the object store
     */
    boolean headOnly;
}

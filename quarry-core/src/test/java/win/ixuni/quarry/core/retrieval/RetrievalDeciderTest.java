package win.ixuni.quarry.core.retrieval;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.quarry.core.model.ByteRange;
import win.ixuni.quarry.core.model.ObjectMetadata;
import win.ixuni.quarry.core.retrieval.RetrievalDecision.Outcome;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RetrievalDeciderTest {

    private static final String ETAG = "5eb63bbbe01eeed093cb22bb8f5acdc3";
    private static final String LAST_MODIFIED = "Mon, 01 Jan 2024 12:00:00 GMT";
    private static final String EARLIER = "Sun, 31 Dec 2023 12:00:00 GMT";
    private static final String LATER = "Tue, 02 Jan 2024 12:00:00 GMT";

    private final ObjectMetadata metadata = ObjectMetadata.builder()
            .bucketName("test-bucket")
            .key("test-object.txt")
            .size(11)
            .etag(ETAG)
            .lastModified(Instant.parse("2024-01-01T12:00:00.250Z"))
            .build();

    private RetrievalDecision decide(RetrievalConditions.RetrievalConditionsBuilder conditions) {
        return RetrievalDecider.decide(metadata, conditions.build());
    }

    @Test
    void noHeadersServesWholeObject() {
        RetrievalDecision decision = RetrievalDecider.decide(metadata, RetrievalConditions.none());
        assertEquals(Outcome.FULL, decision.getOutcome());
        assertEquals(new ByteRange(0, 10), decision.getRange());
    }

    @Test
    void emptyObjectHasNoRange() {
        ObjectMetadata empty = metadata.toBuilder().size(0).build();
        RetrievalDecision decision = RetrievalDecider.decide(empty, RetrievalConditions.none());
        assertEquals(Outcome.FULL, decision.getOutcome());
        assertNull(decision.getRange());
    }

    @Test
    @DisplayName("If-Match: 过期 ETag → 412")
    void staleIfMatchFails() {
        RetrievalDecision decision = decide(RetrievalConditions.builder().ifMatch("\"stale\""));
        assertEquals(Outcome.PRECONDITION_FAILED, decision.getOutcome());
        assertEquals("If-Match", decision.getFailedCondition());
    }

    @Test
    void matchingIfMatchOverridesIfUnmodifiedSince() {
        RetrievalDecision decision = decide(RetrievalConditions.builder()
                .ifMatch("\"" + ETAG + "\"")
                .ifUnmodifiedSince(EARLIER));
        assertEquals(Outcome.FULL, decision.getOutcome());
    }

    @Test
    void ifUnmodifiedSinceAloneFails() {
        RetrievalDecision decision = decide(RetrievalConditions.builder().ifUnmodifiedSince(EARLIER));
        assertEquals(Outcome.PRECONDITION_FAILED, decision.getOutcome());
        assertEquals("If-Unmodified-Since", decision.getFailedCondition());
    }

    @Test
    @DisplayName("Dates compare at second precision")
    void ifUnmodifiedSinceSameSecondHolds() {
        assertEquals(Outcome.FULL, decide(RetrievalConditions.builder().ifUnmodifiedSince(LAST_MODIFIED)).getOutcome());
    }

    @Test
    @DisplayName("If-None-Match: 当前 ETag → 304")
    void currentIfNoneMatchIsNotModified() {
        assertEquals(Outcome.NOT_MODIFIED,
                decide(RetrievalConditions.builder().ifNoneMatch("\"" + ETAG + "\"")).getOutcome());
        assertEquals(Outcome.NOT_MODIFIED,
                decide(RetrievalConditions.builder().ifNoneMatch("W/\"" + ETAG + "\"")).getOutcome());
    }

    @Test
    void nonMatchingIfNoneMatchOverridesIfModifiedSince() {
        RetrievalDecision decision = decide(RetrievalConditions.builder()
                .ifNoneMatch("\"other\"")
                .ifModifiedSince(LATER));
        assertEquals(Outcome.FULL, decision.getOutcome());
    }

    @Test
    void ifModifiedSince() {
        assertEquals(Outcome.NOT_MODIFIED,
                decide(RetrievalConditions.builder().ifModifiedSince(LAST_MODIFIED)).getOutcome());
        assertEquals(Outcome.FULL,
                decide(RetrievalConditions.builder().ifModifiedSince(EARLIER)).getOutcome());
    }

    @Test
    void preconditionFailureWinsOverNotModified() {
        RetrievalDecision decision = decide(RetrievalConditions.builder()
                .ifMatch("\"stale\"")
                .ifNoneMatch("\"" + ETAG + "\""));
        assertEquals(Outcome.PRECONDITION_FAILED, decision.getOutcome());
    }

    @Test
    void unparseableDatesAreIgnored() {
        RetrievalDecision decision = decide(RetrievalConditions.builder()
                .ifModifiedSince("not a date")
                .ifUnmodifiedSince("also not a date"));
        assertEquals(Outcome.FULL, decision.getOutcome());
    }

    @Test
    void rangeProducesPartial() {
        RetrievalDecision decision = decide(RetrievalConditions.builder().range("bytes=0-4"));
        assertEquals(Outcome.PARTIAL, decision.getOutcome());
        assertEquals(new ByteRange(0, 4), decision.getRange());
    }

    @Test
    void unsatisfiableRange() {
        assertEquals(Outcome.RANGE_NOT_SATISFIABLE,
                decide(RetrievalConditions.builder().range("bytes=11-")).getOutcome());
    }

    @Test
    void notModifiedWinsOverRange() {
        RetrievalDecision decision = decide(RetrievalConditions.builder()
                .ifNoneMatch("\"" + ETAG + "\"")
                .range("bytes=0-4"));
        assertEquals(Outcome.NOT_MODIFIED, decision.getOutcome());
    }

    @Test
    @DisplayName("If-Range 匹配时按 Range 返回，不匹配时返回完整对象")
    void ifRange() {
        assertEquals(Outcome.PARTIAL, decide(RetrievalConditions.builder()
                .range("bytes=0-4").ifRange("\"" + ETAG + "\"")).getOutcome());
        assertEquals(Outcome.PARTIAL, decide(RetrievalConditions.builder()
                .range("bytes=0-4").ifRange(LAST_MODIFIED)).getOutcome());
        assertEquals(Outcome.FULL, decide(RetrievalConditions.builder()
                .range("bytes=0-4").ifRange("\"stale\"")).getOutcome());
        assertEquals(Outcome.FULL, decide(RetrievalConditions.builder()
                .range("bytes=0-4").ifRange("W/\"" + ETAG + "\"")).getOutcome());
        assertEquals(Outcome.FULL, decide(RetrievalConditions.builder()
                .range("bytes=0-4").ifRange(EARLIER)).getOutcome());
    }
}

package win.ixuni.quarry.core.retrieval;

import win.ixuni.quarry.core.model.ObjectMetadata;
import win.ixuni.quarry.core.util.ETags;
import win.ixuni.quarry.core.util.HttpDates;
import win.ixuni.quarry.core.util.RangeHeaderParser;

import java.time.Instant;

/**
 * Conditional request and range evaluation
 * <p>
 * Pure function of the object's metadata and the request headers. Evaluation order follows RFC 7232 §6:
 * <ol>
 *   <li>If-Match, or If-Unmodified-Since when If-Match is absent: 412 on failure</li>
 *   <li>If-None-Match, or If-Modified-Since when If-None-Match is absent: 304 on failure</li>
 *   <li>Range, unless an If-Range validator no longer matches</li>
 * </ol>
 */
public final class RetrievalDecider {

    public static final String IF_MATCH = "If-Match";
    public static final String IF_UNMODIFIED_SINCE = "If-Unmodified-Since";

    private RetrievalDecider() {
    }

    public static RetrievalDecision decide(ObjectMetadata metadata, RetrievalConditions conditions) {
        String etag = metadata.getEtag();
        Instant lastModified = HttpDates.truncate(metadata.getLastModified());

        if (conditions.getIfMatch() != null) {
            if (!ETags.matchesStrong(conditions.getIfMatch(), etag)) {
                return RetrievalDecision.preconditionFailed(IF_MATCH);
            }
        } else {
            Instant unmodifiedSince = HttpDates.parse(conditions.getIfUnmodifiedSince());
            if (unmodifiedSince != null && lastModified.isAfter(unmodifiedSince)) {
                return RetrievalDecision.preconditionFailed(IF_UNMODIFIED_SINCE);
            }
        }

        if (conditions.getIfNoneMatch() != null) {
            if (ETags.matchesWeak(conditions.getIfNoneMatch(), etag)) {
                return RetrievalDecision.notModified();
            }
        } else {
            Instant modifiedSince = HttpDates.parse(conditions.getIfModifiedSince());
            if (modifiedSince != null && !lastModified.isAfter(modifiedSince)) {
                return RetrievalDecision.notModified();
            }
        }

        long size = metadata.getSize();
        if (conditions.getRange() == null || !ifRangeHolds(conditions.getIfRange(), etag, lastModified)) {
            return RetrievalDecision.full(size);
        }

        RangeHeaderParser.Result range = RangeHeaderParser.parse(conditions.getRange(), size);
        return switch (range.kind()) {
            case SATISFIABLE -> RetrievalDecision.partial(range.range());
            case UNSATISFIABLE -> RetrievalDecision.rangeNotSatisfiable();
            case NONE -> RetrievalDecision.full(size);
        };
    }

    /**
     * If-Range matches only the exact current representation: strong ETag comparison, or a date equal to
     * Last-Modified. An absent header always holds; an unparseable one never does.
     */
    private static boolean ifRangeHolds(String ifRange, String etag, Instant lastModified) {
        if (ifRange == null || ifRange.isBlank()) {
            return true;
        }
        String value = ifRange.trim();
        if (value.startsWith("\"") || ETags.isWeak(value)) {
            return !ETags.isWeak(value) && ETags.unquote(value).equals(etag);
        }
        Instant date = HttpDates.parse(value);
        return date != null && date.equals(lastModified);
    }
}

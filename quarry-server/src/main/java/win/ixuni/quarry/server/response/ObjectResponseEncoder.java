package win.ixuni.quarry.server.response;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import win.ixuni.quarry.core.model.ObjectMetadata;
import win.ixuni.quarry.core.retrieval.RetrievalResult;
import win.ixuni.quarry.core.util.ETags;
import win.ixuni.quarry.core.util.HttpDates;

import java.util.Map;

/**
 * Response encoder
 * <p>
 * Turns a {@link RetrievalResult} into the S3 GetObject / HeadObject wire response. {@code Content-Length} is
 * always the exact number of body bytes of the matching GET, for HEAD too.
 */
@Component
public class ObjectResponseEncoder {

    public static final String VERSION_ID_HEADER = "x-amz-version-id";
    public static final String META_PREFIX = "x-amz-meta-";

    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    public ResponseEntity<Flux<DataBuffer>> encode(RetrievalResult result, boolean headOnly) {
        ObjectMetadata metadata = result.getMetadata();

        if (result.isNotModified()) {
            // 304 只带校验器，无 body
            return ResponseEntity.status(HttpStatus.NOT_MODIFIED)
                    .header(HttpHeaders.ETAG, ETags.quote(metadata.getEtag()))
                    .header(HttpHeaders.LAST_MODIFIED, HttpDates.format(metadata.getLastModified()))
                    .build();
        }

        ResponseEntity.BodyBuilder builder = ResponseEntity
                .status(result.isPartial() ? HttpStatus.PARTIAL_CONTENT : HttpStatus.OK)
                .header(HttpHeaders.CONTENT_LENGTH, String.valueOf(result.getContentLength()))
                .header(HttpHeaders.CONTENT_TYPE, contentType(metadata))
                .header(HttpHeaders.ETAG, ETags.quote(metadata.getEtag()))
                .header(HttpHeaders.LAST_MODIFIED, HttpDates.format(metadata.getLastModified()))
                .header(HttpHeaders.ACCEPT_RANGES, "bytes");

        if (result.isPartial()) {
            builder.header(HttpHeaders.CONTENT_RANGE, result.getRange().toContentRange(metadata.getSize()));
        }
        if (metadata.getVersionId() != null) {
            builder.header(VERSION_ID_HEADER, metadata.getVersionId());
        }
        appendMetadataHeaders(builder, metadata.getUserMetadata());

        if (headOnly) {
            return builder.build();
        }
        return builder.body(result.getContent().map(DefaultDataBufferFactory.sharedInstance::wrap));
    }

    /**
     * PutObject response: ETag and, when versioned, the new version id
     */
    public ResponseEntity<Void> encodePut(ObjectMetadata metadata) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.ok()
                .header(HttpHeaders.ETAG, ETags.quote(metadata.getEtag()));
        if (metadata.getVersionId() != null) {
            builder.header(VERSION_ID_HEADER, metadata.getVersionId());
        }
        return builder.build();
    }

    private String contentType(ObjectMetadata metadata) {
        String contentType = metadata.getContentType();
        return contentType == null || contentType.isEmpty() ? DEFAULT_CONTENT_TYPE : contentType;
    }

    private void appendMetadataHeaders(ResponseEntity.BodyBuilder builder, Map<String, String> userMetadata) {
        if (userMetadata != null) {
            userMetadata.forEach((k, v) -> builder.header(META_PREFIX + k, v));
        }
    }
}

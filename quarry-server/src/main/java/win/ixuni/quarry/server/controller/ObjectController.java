package win.ixuni.quarry.server.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.retrieval.RetrievalConditions;
import win.ixuni.quarry.core.retrieval.RetrievalRequest;
import win.ixuni.quarry.server.codec.AwsChunkedDecoder;
import win.ixuni.quarry.server.response.ObjectResponseEncoder;
import win.ixuni.quarry.server.service.S3Service;

import java.nio.ByteBuffer;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Object 操作控制器
 * <p>
 * GetObject / HeadObject with conditional, range and versionId support, plus PutObject for seeding data.
 * An empty key is a bucket listing, which this server does not implement.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ObjectController {

    private final S3Service s3Service;
    private final ObjectResponseEncoder responseEncoder;

    /**
     * 获取对象
     * GET /{bucket}/{key}
     */
    @GetMapping("/{bucket}/{*key}")
    public Mono<ResponseEntity<Flux<DataBuffer>>> getObject(
            @PathVariable String bucket,
            @PathVariable String key,
            @RequestParam(value = "versionId", required = false) String versionId,
            @RequestHeader HttpHeaders headers) {
        return retrieve(bucket, key, versionId, headers, false);
    }

    /**
     * 获取对象元数据
     * HEAD /{bucket}/{key}
     */
    @RequestMapping(value = "/{bucket}/{*key}", method = RequestMethod.HEAD)
    public Mono<ResponseEntity<Flux<DataBuffer>>> headObject(
            @PathVariable String bucket,
            @PathVariable String key,
            @RequestParam(value = "versionId", required = false) String versionId,
            @RequestHeader HttpHeaders headers) {
        return retrieve(bucket, key, versionId, headers, true);
    }

    /**
     * 上传对象
     * PUT /{bucket}/{key}
     */
    @PutMapping("/{bucket}/{*key}")
    public Mono<ResponseEntity<Void>> putObject(
            @PathVariable String bucket,
            @PathVariable String key,
            @RequestHeader HttpHeaders headers,
            @RequestBody(required = false) Flux<DataBuffer> body) {
        String objectKey = requireKey(key, "PUT");

        Flux<DataBuffer> safeBody = body != null ? body : Flux.empty();
        Flux<ByteBuffer> content = AwsChunkedDecoder.isAwsChunkedEncoding(headers.getFirst("x-amz-content-sha256"))
                ? AwsChunkedDecoder.decode(safeBody)
                : safeBody.map(ObjectController::toByteBuffer);

        return s3Service.putObject(bucket, objectKey, content,
                        headers.getFirst(HttpHeaders.CONTENT_TYPE), userMetadata(headers))
                .map(responseEncoder::encodePut);
    }

    private Mono<ResponseEntity<Flux<DataBuffer>>> retrieve(String bucket, String key, String versionId,
            HttpHeaders headers, boolean headOnly) {
        String objectKey = requireKey(key, headOnly ? "HEAD" : "GET");

        RetrievalRequest request = RetrievalRequest.builder()
                .bucketName(bucket)
                .key(objectKey)
                .versionId(versionId)
                .conditions(RetrievalConditions.builder()
                        .ifMatch(headers.getFirst(HttpHeaders.IF_MATCH))
                        .ifNoneMatch(headers.getFirst(HttpHeaders.IF_NONE_MATCH))
                        .ifModifiedSince(headers.getFirst(HttpHeaders.IF_MODIFIED_SINCE))
                        .ifUnmodifiedSince(headers.getFirst(HttpHeaders.IF_UNMODIFIED_SINCE))
                        .range(headers.getFirst(HttpHeaders.RANGE))
                        .ifRange(headers.getFirst(HttpHeaders.IF_RANGE))
                        .build())
                .headOnly(headOnly)
                .build();

        return s3Service.getObject(request)
                .map(result -> responseEncoder.encode(result, headOnly));
    }

    /**
     * 去掉 {*key} 捕获的开头斜杠；空 key 即列举请求，不支持
     */
    private static String requireKey(String key, String method) {
        String normalized = key != null && key.startsWith("/") ? key.substring(1) : key;
        if (normalized == null || normalized.isEmpty()) {
            throw new UnsupportedOperationException(method + " on a bucket is not implemented");
        }
        return normalized;
    }

    private static Map<String, String> userMetadata(HttpHeaders headers) {
        Map<String, String> metadata = new HashMap<>();
        headers.forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.startsWith(ObjectResponseEncoder.META_PREFIX) && !values.isEmpty()) {
                metadata.put(lower.substring(ObjectResponseEncoder.META_PREFIX.length()), values.get(0));
            }
        });
        return metadata;
    }

    private static ByteBuffer toByteBuffer(DataBuffer dataBuffer) {
        byte[] bytes = new byte[dataBuffer.readableByteCount()];
        dataBuffer.read(bytes);
        DataBufferUtils.release(dataBuffer);
        return ByteBuffer.wrap(bytes);
    }
}

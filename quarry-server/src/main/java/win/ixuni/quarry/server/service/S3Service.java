package win.ixuni.quarry.server.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.driver.StorageDriver;
import win.ixuni.quarry.core.exception.InvalidBucketNameException;
import win.ixuni.quarry.core.model.Bucket;
import win.ixuni.quarry.core.model.ObjectMetadata;
import win.ixuni.quarry.core.operation.bucket.BucketExistsOperation;
import win.ixuni.quarry.core.operation.bucket.CreateBucketOperation;
import win.ixuni.quarry.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.quarry.core.operation.object.PutObjectOperation;
import win.ixuni.quarry.core.retrieval.RetrievalEngine;
import win.ixuni.quarry.core.retrieval.RetrievalRequest;
import win.ixuni.quarry.core.retrieval.RetrievalResult;
import win.ixuni.quarry.core.util.S3ValidationUtils;
import win.ixuni.quarry.server.routing.BucketRouter;

import java.nio.ByteBuffer;
import java.util.Map;

/**
 * S3 service layer
 * <p>
 * Validates names, routes each bucket to its driver and runs operations through
 * {@link StorageDriver#execute}. Object reads go through the {@link RetrievalEngine}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class S3Service {

    private final BucketRouter bucketRouter;
    private final RetrievalEngine retrievalEngine;

    public Mono<Bucket> createBucket(String bucketName) {
        return route(bucketName)
                .flatMap(driver -> driver.execute(new CreateBucketOperation(bucketName)))
                .doOnSuccess(bucket -> log.info("Bucket {} ready", bucketName));
    }

    public Mono<Void> deleteBucket(String bucketName) {
        return route(bucketName)
                .flatMap(driver -> driver.execute(new DeleteBucketOperation(bucketName)))
                .doOnSuccess(v -> log.info("Bucket {} deleted", bucketName));
    }

    public Mono<Boolean> bucketExists(String bucketName) {
        return route(bucketName).flatMap(driver -> driver.execute(new BucketExistsOperation(bucketName)));
    }

    public Mono<ObjectMetadata> putObject(String bucketName, String key, Flux<ByteBuffer> content,
            String contentType, Map<String, String> userMetadata) {
        String error = firstNonNull(S3ValidationUtils.validateKey(key),
                S3ValidationUtils.validateMetadata(userMetadata));
        if (error != null) {
            return Mono.error(new IllegalArgumentException(error));
        }
        return route(bucketName).flatMap(driver -> driver.execute(PutObjectOperation.builder()
                .bucketName(bucketName)
                .key(key)
                .content(content)
                .contentType(contentType)
                .userMetadata(userMetadata)
                .build()))
                .doOnSuccess(stored -> log.debug("Stored {}/{} ({} bytes, etag {})",
                        bucketName, key, stored.getSize(), stored.getEtag()));
    }

    /**
     * GetObject / HeadObject
     * <p>
     * 304 comes back as a result; 412, 416 and lookup failures come back as errors.
     */
    public Mono<RetrievalResult> getObject(RetrievalRequest request) {
        String error = S3ValidationUtils.validateKey(request.getKey());
        if (error != null) {
            return Mono.error(new IllegalArgumentException(error));
        }
        log.debug("{} object: {}/{}", request.isHeadOnly() ? "Head" : "Get",
                request.getBucketName(), request.getKey());
        return route(request.getBucketName()).flatMap(driver -> retrievalEngine.retrieve(driver, request));
    }

    /**
     * 校验桶名后路由；所有桶和对象操作都经过这里
     */
    private Mono<StorageDriver> route(String bucketName) {
        String error = S3ValidationUtils.validateBucketName(bucketName);
        if (error != null) {
            return Mono.error(new InvalidBucketNameException(bucketName, error));
        }
        return Mono.fromCallable(() -> bucketRouter.route(bucketName));
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }
}

package win.ixuni.quarry.core.retrieval;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.driver.DriverCapabilities.Capability;
import win.ixuni.quarry.core.driver.StorageDriver;
import win.ixuni.quarry.core.exception.IntegrityException;
import win.ixuni.quarry.core.exception.InvalidRangeException;
import win.ixuni.quarry.core.exception.PreconditionFailedException;
import win.ixuni.quarry.core.model.ObjectMetadata;
import win.ixuni.quarry.core.operation.object.LookupObjectOperation;
import win.ixuni.quarry.core.operation.object.ReadObjectOperation;

import java.nio.ByteBuffer;

/**
 * Object retrieval engine
 * <p>
 * Resolves metadata through the driver's index, evaluates conditional and range headers, then opens the
 * object store for the resolved range. Stateless; each call is independent. A driver without
 * {@link Capability#RANGE_READ} has its Range header ignored and serves the whole object.
 * <p>
 * For GET the store is opened (and its length checked) before the result is emitted, so a broken object
 * fails the request before any response header is written. Errors after that point end the body stream.
 */
@Slf4j
public class RetrievalEngine {

    public Mono<RetrievalResult> retrieve(StorageDriver driver, RetrievalRequest request) {
        LookupObjectOperation lookup = new LookupObjectOperation(
                request.getBucketName(), request.getKey(), request.getVersionId());

        return driver.execute(lookup)
                .flatMap(metadata -> respond(driver, request, metadata));
    }

    private Mono<RetrievalResult> respond(StorageDriver driver, RetrievalRequest request, ObjectMetadata metadata) {
        RetrievalConditions conditions = request.getConditions();
        RetrievalDecision decision = decide(driver, metadata, conditions);
        log.debug("Retrieval decision for {}/{}: {}", request.getBucketName(), request.getKey(), decision);

        switch (decision.getOutcome()) {
            case PRECONDITION_FAILED:
                return Mono.error(new PreconditionFailedException(decision.getFailedCondition()));
            case RANGE_NOT_SATISFIABLE:
                return Mono.error(new InvalidRangeException(conditions.getRange(), metadata.getSize()));
            case NOT_MODIFIED:
                return Mono.just(RetrievalResult.builder()
                        .outcome(decision.getOutcome())
                        .metadata(metadata)
                        .build());
            default:
                break;
        }

        RetrievalResult.RetrievalResultBuilder result = RetrievalResult.builder()
                .outcome(decision.getOutcome())
                .metadata(metadata)
                .range(decision.getRange());

        if (request.isHeadOnly()) {
            return Mono.just(result.build());
        }

        // 空对象也要打开存储，缺失或长度不符的 blob 同样报 IntegrityError
        return driver.execute(new ReadObjectOperation(metadata, decision.getRange()))
                .map(content -> result.content(decision.getRange() == null ? content
                        : guard(content, metadata, decision)).build())
                .doOnError(IntegrityException.class, e -> logIntegrityFailure(metadata, e));
    }

    private static RetrievalDecision decide(StorageDriver driver, ObjectMetadata metadata,
                                            RetrievalConditions conditions) {
        RetrievalDecision decision = RetrievalDecider.decide(metadata, conditions);
        boolean rangeOutcome = decision.getOutcome() == RetrievalDecision.Outcome.PARTIAL
                || decision.getOutcome() == RetrievalDecision.Outcome.RANGE_NOT_SATISFIABLE;
        if (rangeOutcome && !driver.supports(Capability.RANGE_READ)) {
            // 驱动不支持范围读取时忽略 Range，整对象返回
            return RetrievalDecision.full(metadata.getSize());
        }
        return decision;
    }

    private Flux<ByteBuffer> guard(Flux<ByteBuffer> content, ObjectMetadata metadata, RetrievalDecision decision) {
        return ContentVerifier.verify(content, metadata, decision.getRange())
                .doOnError(IntegrityException.class, e -> logIntegrityFailure(metadata, e));
    }

    private void logIntegrityFailure(ObjectMetadata metadata, IntegrityException e) {
        log.error("Integrity check failed for {}/{} (location {}): {}",
                metadata.getBucketName(), metadata.getKey(), metadata.getLocation(), e.getMessage());
    }
}

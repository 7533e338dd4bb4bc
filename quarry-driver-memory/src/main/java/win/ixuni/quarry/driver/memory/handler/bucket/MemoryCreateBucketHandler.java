package win.ixuni.quarry.driver.memory.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.driver.DriverCapabilities.Capability;
import win.ixuni.quarry.core.model.Bucket;
import win.ixuni.quarry.core.operation.bucket.CreateBucketOperation;
import win.ixuni.quarry.driver.memory.context.MemoryDriverContext;
import win.ixuni.quarry.driver.memory.context.MemoryDriverContext.BucketInfo;
import win.ixuni.quarry.driver.memory.handler.AbstractMemoryHandler;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Memory 创建 Bucket 处理器
 * <p>
 * Idempotent: an existing bucket is returned as it is.
 */
public class MemoryCreateBucketHandler extends AbstractMemoryHandler<CreateBucketOperation, Bucket> {

    @Override
    protected Mono<Bucket> doHandle(CreateBucketOperation operation, MemoryDriverContext context) {
        BucketInfo info = context.getBuckets().computeIfAbsent(operation.getBucketName(),
                name -> BucketInfo.builder().name(name).creationDate(Instant.now()).build());

        return Mono.just(Bucket.builder()
                .name(info.getName())
                .creationDate(info.getCreationDate())
                .driverName(context.getDriverName())
                .build());
    }

    @Override
    public Class<CreateBucketOperation> getOperationType() {
        return CreateBucketOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WRITE);
    }
}

package win.ixuni.quarry.driver.memory.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.driver.DriverCapabilities.Capability;
import win.ixuni.quarry.core.operation.bucket.BucketExistsOperation;
import win.ixuni.quarry.driver.memory.context.MemoryDriverContext;
import win.ixuni.quarry.driver.memory.handler.AbstractMemoryHandler;

import java.util.EnumSet;
import java.util.Set;

public class MemoryBucketExistsHandler extends AbstractMemoryHandler<BucketExistsOperation, Boolean> {

    @Override
    protected Mono<Boolean> doHandle(BucketExistsOperation operation, MemoryDriverContext context) {
        return Mono.just(context.getBuckets().containsKey(operation.getBucketName()));
    }

    @Override
    public Class<BucketExistsOperation> getOperationType() {
        return BucketExistsOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.READ);
    }
}

package win.ixuni.quarry.driver.memory.handler.bucket;

import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.driver.DriverCapabilities.Capability;
import win.ixuni.quarry.core.exception.BucketNotEmptyException;
import win.ixuni.quarry.core.exception.BucketNotFoundException;
import win.ixuni.quarry.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.quarry.driver.memory.context.MemoryDriverContext;
import win.ixuni.quarry.driver.memory.handler.AbstractMemoryHandler;

import java.util.EnumSet;
import java.util.Set;

/**
 * Memory 删除 Bucket 处理器
 */
public class MemoryDeleteBucketHandler extends AbstractMemoryHandler<DeleteBucketOperation, Void> {

    @Override
    protected Mono<Void> doHandle(DeleteBucketOperation operation, MemoryDriverContext context) {
        String bucketName = operation.getBucketName();

        if (!context.getBuckets().containsKey(bucketName)) {
            return Mono.error(new BucketNotFoundException(bucketName));
        }
        if (context.hasObjects(bucketName)) {
            return Mono.error(new BucketNotEmptyException(bucketName));
        }

        context.getBuckets().remove(bucketName);
        return Mono.empty();
    }

    @Override
    public Class<DeleteBucketOperation> getOperationType() {
        return DeleteBucketOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WRITE);
    }
}

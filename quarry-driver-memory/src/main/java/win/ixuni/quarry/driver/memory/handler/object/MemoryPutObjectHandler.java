package win.ixuni.quarry.driver.memory.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.driver.DriverCapabilities.Capability;
import win.ixuni.quarry.core.model.ObjectMetadata;
import win.ixuni.quarry.core.model.StorageLocation;
import win.ixuni.quarry.core.operation.object.PutObjectOperation;
import win.ixuni.quarry.core.util.ETags;
import win.ixuni.quarry.driver.memory.context.MemoryDriverContext;
import win.ixuni.quarry.driver.memory.handler.AbstractMemoryHandler;

import java.io.ByteArrayOutputStream;
import java.util.EnumSet;
import java.util.Set;

/**
 * Memory PutObject 处理器：先写入新位置，再切换索引
 */
public class MemoryPutObjectHandler extends AbstractMemoryHandler<PutObjectOperation, ObjectMetadata> {

    @Override
    protected Mono<ObjectMetadata> doHandle(PutObjectOperation operation, MemoryDriverContext context) {
        Mono<ObjectMetadata> store = operation.contentOrEmpty()
                .collect(ByteArrayOutputStream::new, (out, buffer) -> {
                    byte[] chunk = new byte[buffer.remaining()];
                    buffer.get(chunk);
                    out.writeBytes(chunk);
                })
                .map(out -> {
                    byte[] data = out.toByteArray();
                    StorageLocation location = StorageLocation.generate();
                    context.getBlobs().put(location.getId(), data);
                    return context.commit(operation.describe(location, data.length, ETags.md5Hex(data),
                            context.isVersioningEnabled()));
                });
        return requireBucket(context, operation.getBucketName(), store);
    }

    @Override
    public Class<PutObjectOperation> getOperationType() {
        return PutObjectOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WRITE);
    }
}

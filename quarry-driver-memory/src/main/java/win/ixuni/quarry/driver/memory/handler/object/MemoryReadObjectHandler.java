package win.ixuni.quarry.driver.memory.handler.object;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.driver.DriverCapabilities.Capability;
import win.ixuni.quarry.core.exception.IntegrityException;
import win.ixuni.quarry.core.model.ByteRange;
import win.ixuni.quarry.core.model.ObjectMetadata;
import win.ixuni.quarry.core.operation.object.ReadObjectOperation;
import win.ixuni.quarry.driver.memory.context.MemoryDriverContext;
import win.ixuni.quarry.driver.memory.handler.AbstractMemoryHandler;

import java.nio.ByteBuffer;
import java.util.EnumSet;
import java.util.Set;

/**
 * Memory 对象读取处理器
 * <p>
 * Emits read-only views of the stored array in chunks of the configured read buffer size; nothing is
 * copied.
 */
public class MemoryReadObjectHandler extends AbstractMemoryHandler<ReadObjectOperation, Flux<ByteBuffer>> {

    @Override
    protected Mono<Flux<ByteBuffer>> doHandle(ReadObjectOperation operation, MemoryDriverContext context) {
        ObjectMetadata metadata = operation.getMetadata();
        ByteRange range = operation.getRange();

        byte[] blob = context.getBlobs().get(metadata.getLocation().getId());
        if (blob == null) {
            return Mono.error(new IntegrityException(metadata.getBucketName(), metadata.getKey(),
                    "storage location " + metadata.getLocation() + " is missing"));
        }
        if (blob.length != metadata.getSize()) {
            return Mono.error(new IntegrityException(metadata.getBucketName(), metadata.getKey(),
                    "stored length " + blob.length + " differs from recorded size " + metadata.getSize()));
        }

        if (range == null) {
            return Mono.just(Flux.empty());
        }

        int chunkSize = context.getReadBufferSize();
        long start = range.start();
        long length = range.length();
        int chunks = (int) ((length + chunkSize - 1) / chunkSize);

        return Mono.just(Flux.range(0, chunks).map(i -> {
            long offset = start + (long) i * chunkSize;
            int size = (int) Math.min(chunkSize, start + length - offset);
            return ByteBuffer.wrap(blob, (int) offset, size).slice().asReadOnlyBuffer();
        }));
    }

    @Override
    public Class<ReadObjectOperation> getOperationType() {
        return ReadObjectOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.READ, Capability.RANGE_READ);
    }
}

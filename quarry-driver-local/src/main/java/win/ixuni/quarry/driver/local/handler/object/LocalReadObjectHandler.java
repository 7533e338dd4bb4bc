package win.ixuni.quarry.driver.local.handler.object;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.quarry.core.driver.DriverCapabilities.Capability;
import win.ixuni.quarry.core.exception.IntegrityException;
import win.ixuni.quarry.core.exception.StorageIOException;
import win.ixuni.quarry.core.model.ByteRange;
import win.ixuni.quarry.core.model.ObjectMetadata;
import win.ixuni.quarry.core.operation.object.ReadObjectOperation;
import win.ixuni.quarry.driver.local.context.LocalDriverContext;
import win.ixuni.quarry.driver.local.handler.AbstractLocalHandler;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousFileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.EnumSet;
import java.util.Set;

/**
 * 本地文件系统对象读取处理器
 * <p>
 * Checks the blob's length before handing out the stream, then reads only the requested range from an
 * {@link AsynchronousFileChannel} in read-buffer-size chunks.
 */
public class LocalReadObjectHandler extends AbstractLocalHandler<ReadObjectOperation, Flux<ByteBuffer>> {

    @Override
    protected Mono<Flux<ByteBuffer>> doHandle(ReadObjectOperation operation, LocalDriverContext context) {
        ObjectMetadata metadata = operation.getMetadata();
        ByteRange range = operation.getRange();

        return Mono.fromCallable(() -> {
            Path blobPath = context.getBlobPath(metadata.getBucketName(), metadata.getLocation().getId());
            if (!Files.exists(blobPath)) {
                throw new IntegrityException(metadata.getBucketName(), metadata.getKey(),
                        "storage location " + metadata.getLocation() + " is missing");
            }
            long actualSize = Files.size(blobPath);
            if (actualSize != metadata.getSize()) {
                throw new IntegrityException(metadata.getBucketName(), metadata.getKey(),
                        "stored length " + actualSize + " differs from recorded size " + metadata.getSize());
            }
            return range == null ? Flux.<ByteBuffer>empty() : stream(blobPath, range, context.getReadBufferSize());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private Flux<ByteBuffer> stream(Path blobPath, ByteRange range, int bufferSize) {
        Flux<DataBuffer> buffers = DataBufferUtils.readAsynchronousFileChannel(
                () -> AsynchronousFileChannel.open(blobPath, StandardOpenOption.READ),
                range.start(),
                DefaultDataBufferFactory.sharedInstance,
                bufferSize);

        return DataBufferUtils.takeUntilByteCount(buffers, range.length())
                .map(dataBuffer -> {
                    byte[] bytes = new byte[dataBuffer.readableByteCount()];
                    dataBuffer.read(bytes);
                    DataBufferUtils.release(dataBuffer);
                    return ByteBuffer.wrap(bytes);
                })
                .onErrorMap(IOException.class,
                        e -> new StorageIOException("Failed to read " + blobPath + ": " + e.getMessage(), e));
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

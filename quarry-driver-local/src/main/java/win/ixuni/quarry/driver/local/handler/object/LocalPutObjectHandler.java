package win.ixuni.quarry.driver.local.handler.object;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.quarry.core.driver.DriverCapabilities.Capability;
import win.ixuni.quarry.core.exception.BucketNotFoundException;
import win.ixuni.quarry.core.model.ObjectMetadata;
import win.ixuni.quarry.core.model.StorageLocation;
import win.ixuni.quarry.core.operation.object.PutObjectOperation;
import win.ixuni.quarry.core.util.ETags;
import win.ixuni.quarry.core.util.KeyLockManager;
import win.ixuni.quarry.driver.local.context.LocalDriverContext;
import win.ixuni.quarry.driver.local.handler.AbstractLocalHandler;
import win.ixuni.quarry.driver.local.handler.LocalFileUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 本地文件系统上传对象处理器
 * <p>
 * 流式写入临时文件，避免大文件 OOM. Size and MD5 are computed while writing; the finished file is renamed
 * into the blob directory under a fresh location id, and only then is the sidecar swapped.
 */
@Slf4j
public class LocalPutObjectHandler extends AbstractLocalHandler<PutObjectOperation, ObjectMetadata> {

    @Override
    protected Mono<ObjectMetadata> doHandle(PutObjectOperation operation, LocalDriverContext context) {
        String bucketName = operation.getBucketName();
        String key = operation.getKey();
        StorageLocation location = StorageLocation.generate();
        Path tempPath = context.getTmpRoot().resolve(location.getId() + ".part");

        return Mono.fromCallable(() -> {
                    if (!context.bucketExists(bucketName)) {
                        throw new BucketNotFoundException(bucketName);
                    }
                    // 先解析 sidecar 路径，非法 key 在写 blob 之前被拒绝
                    context.getMetadataPath(bucketName, key);
                    Files.createDirectories(context.getTmpRoot());
                    return ETags.newMd5();
                })
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(md5 -> {
                    AtomicLong totalSize = new AtomicLong();
                    return writeContent(operation.contentOrEmpty(), tempPath, md5, totalSize)
                            .then(Mono.fromCallable(() -> {
                                Path blobPath = context.getBlobPath(bucketName, location.getId());
                                Files.createDirectories(blobPath.getParent());
                                LocalFileUtils.moveAtomically(tempPath, blobPath);

                                return operation.describe(location, totalSize.get(), ETags.toHex(md5),
                                        context.isVersioningEnabled());
                            }));
                })
                .doOnError(e -> LocalFileUtils.deleteQuietly(tempPath))
                .flatMap(metadata -> context.getLockManager().withLock(
                        KeyLockManager.lockKey(bucketName, key),
                        Mono.fromCallable(() -> context.commit(metadata))));
    }

    private Mono<Void> writeContent(Flux<ByteBuffer> content, Path tempPath, MessageDigest md5, AtomicLong totalSize) {
        return Flux.using(
                        () -> Files.newOutputStream(tempPath),
                        os -> content
                                .publishOn(Schedulers.boundedElastic())
                                .doOnNext(buffer -> write(os, buffer, md5, totalSize)),
                        this::closeQuietly)
                .then();
    }

    private void write(OutputStream os, ByteBuffer buffer, MessageDigest md5, AtomicLong totalSize) {
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        try {
            os.write(bytes);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        md5.update(bytes);
        totalSize.addAndGet(bytes.length);
    }

    private void closeQuietly(OutputStream os) {
        try {
            os.close();
        } catch (IOException e) {
            log.warn("Failed to close upload stream: {}", e.getMessage());
        }
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

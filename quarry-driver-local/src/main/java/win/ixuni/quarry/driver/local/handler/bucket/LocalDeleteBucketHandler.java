package win.ixuni.quarry.driver.local.handler.bucket;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.quarry.core.driver.DriverCapabilities.Capability;
import win.ixuni.quarry.core.exception.BucketNotEmptyException;
import win.ixuni.quarry.core.exception.BucketNotFoundException;
import win.ixuni.quarry.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.quarry.core.util.SidecarMetadata;
import win.ixuni.quarry.driver.local.context.LocalDriverContext;
import win.ixuni.quarry.driver.local.handler.AbstractLocalHandler;
import win.ixuni.quarry.driver.local.handler.LocalFileUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 本地文件系统删除 Bucket 处理器
 * <p>
 * A bucket is empty when no sidecar remains under it; leftover superseded blobs go with the bucket.
 */
public class LocalDeleteBucketHandler extends AbstractLocalHandler<DeleteBucketOperation, Void> {

    @Override
    protected Mono<Void> doHandle(DeleteBucketOperation operation, LocalDriverContext context) {
        String bucketName = operation.getBucketName();

        return Mono.<Void>fromCallable(() -> {
            Path metaPath = context.getBucketMetaPath(bucketName);
            if (!Files.isDirectory(metaPath)) {
                throw new BucketNotFoundException(bucketName);
            }

            try (Stream<Path> files = Files.walk(metaPath)) {
                boolean hasObjects = files.anyMatch(p -> SidecarMetadata.isSidecarFile(p.getFileName().toString()));
                if (hasObjects) {
                    throw new BucketNotEmptyException(bucketName);
                }
            }

            LocalFileUtils.deleteDirectoryRecursively(metaPath);
            LocalFileUtils.deleteDirectoryRecursively(context.getBucketBlobPath(bucketName));
            return null;
        }).subscribeOn(Schedulers.boundedElastic());
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

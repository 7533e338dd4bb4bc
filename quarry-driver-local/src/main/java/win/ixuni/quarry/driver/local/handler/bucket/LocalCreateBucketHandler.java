package win.ixuni.quarry.driver.local.handler.bucket;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.quarry.core.driver.DriverCapabilities.Capability;
import win.ixuni.quarry.core.model.Bucket;
import win.ixuni.quarry.core.operation.bucket.CreateBucketOperation;
import win.ixuni.quarry.driver.local.context.LocalDriverContext;
import win.ixuni.quarry.driver.local.handler.AbstractLocalHandler;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.EnumSet;
import java.util.Set;

/**
 * 本地文件系统创建 Bucket 处理器（幂等）
 */
public class LocalCreateBucketHandler extends AbstractLocalHandler<CreateBucketOperation, Bucket> {

    @Override
    protected Mono<Bucket> doHandle(CreateBucketOperation operation, LocalDriverContext context) {
        String bucketName = operation.getBucketName();

        return Mono.fromCallable(() -> {
            Path metaPath = context.getBucketMetaPath(bucketName);
            Files.createDirectories(context.getBucketBlobPath(bucketName));
            Files.createDirectories(metaPath);

            var attrs = Files.readAttributes(metaPath, BasicFileAttributes.class);
            return Bucket.builder()
                    .name(bucketName)
                    .creationDate(attrs.creationTime().toInstant())
                    .driverName(context.getDriverName())
                    .build();
        }).subscribeOn(Schedulers.boundedElastic());
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

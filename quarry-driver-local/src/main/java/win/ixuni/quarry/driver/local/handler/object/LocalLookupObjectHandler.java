package win.ixuni.quarry.driver.local.handler.object;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.quarry.core.driver.DriverCapabilities.Capability;
import win.ixuni.quarry.core.exception.BucketNotFoundException;
import win.ixuni.quarry.core.exception.ObjectNotFoundException;
import win.ixuni.quarry.core.exception.VersionNotFoundException;
import win.ixuni.quarry.core.model.ObjectMetadata;
import win.ixuni.quarry.core.operation.object.LookupObjectOperation;
import win.ixuni.quarry.core.util.SidecarMetadata;
import win.ixuni.quarry.driver.local.context.LocalDriverContext;
import win.ixuni.quarry.driver.local.context.SidecarIndex;
import win.ixuni.quarry.driver.local.handler.AbstractLocalHandler;
import win.ixuni.quarry.driver.local.handler.LocalFileUtils;

import java.util.EnumSet;
import java.util.Set;

/**
 * 本地文件系统元数据查询处理器
 * <p>
 * Lock-free: the sidecar is only ever replaced by rename, so a read sees one complete version.
 */
public class LocalLookupObjectHandler extends AbstractLocalHandler<LookupObjectOperation, ObjectMetadata> {

    @Override
    protected Mono<ObjectMetadata> doHandle(LookupObjectOperation operation, LocalDriverContext context) {
        String bucketName = operation.getBucketName();
        String key = operation.getKey();
        String versionId = operation.getVersionId();

        return Mono.fromCallable(() -> {
            if (!context.bucketExists(bucketName)) {
                throw new BucketNotFoundException(bucketName);
            }

            SidecarIndex index = LocalFileUtils.readIndex(context.getMetadataPath(bucketName, key));
            if (index == null || index.getCurrent() == null) {
                throw new ObjectNotFoundException(bucketName, key);
            }

            SidecarMetadata record = index.getCurrent();
            if (versionId != null && !("null".equals(versionId) && record.getVersionId() == null)) {
                record = index.findVersion(versionId);
                if (record == null) {
                    throw new VersionNotFoundException(bucketName, key, versionId);
                }
            }
            return LocalFileUtils.toMetadata(bucketName, key, record);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Class<LookupObjectOperation> getOperationType() {
        return LookupObjectOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.READ);
    }
}

package win.ixuni.quarry.driver.memory.handler.object;

import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.driver.DriverCapabilities.Capability;
import win.ixuni.quarry.core.exception.ObjectNotFoundException;
import win.ixuni.quarry.core.exception.VersionNotFoundException;
import win.ixuni.quarry.core.model.ObjectMetadata;
import win.ixuni.quarry.core.operation.object.LookupObjectOperation;
import win.ixuni.quarry.driver.memory.context.MemoryDriverContext;
import win.ixuni.quarry.driver.memory.context.MemoryDriverContext.IndexEntry;
import win.ixuni.quarry.driver.memory.handler.AbstractMemoryHandler;

import java.util.EnumSet;
import java.util.Set;

/**
 * Memory 元数据查询处理器
 * <p>
 * Reads the index entry snapshot without locking. The version id {@code null} (the literal string) names the
 * current object when it was written without versioning.
 */
public class MemoryLookupObjectHandler extends AbstractMemoryHandler<LookupObjectOperation, ObjectMetadata> {

    @Override
    protected Mono<ObjectMetadata> doHandle(LookupObjectOperation operation, MemoryDriverContext context) {
        String bucketName = operation.getBucketName();
        String key = operation.getKey();

        return requireBucket(context, bucketName, Mono.defer(() -> {
            IndexEntry entry = context.getIndex().get(context.objectKey(bucketName, key));
            if (entry == null) {
                return Mono.error(new ObjectNotFoundException(bucketName, key));
            }

            String versionId = operation.getVersionId();
            if (versionId == null) {
                return Mono.just(entry.getCurrent());
            }
            if ("null".equals(versionId) && entry.getCurrent().getVersionId() == null) {
                return Mono.just(entry.getCurrent());
            }
            ObjectMetadata version = entry.getVersions().get(versionId);
            return version != null ? Mono.just(version)
                    : Mono.error(new VersionNotFoundException(bucketName, key, versionId));
        }));
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

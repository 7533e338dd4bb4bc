package win.ixuni.quarry.driver.local.handler.bucket;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.quarry.core.driver.DriverCapabilities.Capability;
import win.ixuni.quarry.core.operation.bucket.BucketExistsOperation;
import win.ixuni.quarry.driver.local.context.LocalDriverContext;
import win.ixuni.quarry.driver.local.handler.AbstractLocalHandler;

import java.util.EnumSet;
import java.util.Set;

public class LocalBucketExistsHandler extends AbstractLocalHandler<BucketExistsOperation, Boolean> {

    @Override
    protected Mono<Boolean> doHandle(BucketExistsOperation operation, LocalDriverContext context) {
        return Mono.fromCallable(() -> context.bucketExists(operation.getBucketName()))
                .subscribeOn(Schedulers.boundedElastic());
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

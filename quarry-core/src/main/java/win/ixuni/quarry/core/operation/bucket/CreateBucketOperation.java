package win.ixuni.quarry.core.operation.bucket;

import lombok.Value;
import win.ixuni.quarry.core.model.Bucket;
import win.ixuni.quarry.core.operation.Operation;

/**
 * 创建 Bucket 操作
 * <p>
 * Idempotent: creating an existing bucket returns it unchanged.
 */
@Value
public class CreateBucketOperation implements Operation<Bucket> {

    String bucketName;
}

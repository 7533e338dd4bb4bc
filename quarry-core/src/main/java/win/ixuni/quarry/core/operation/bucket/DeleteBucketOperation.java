package win.ixuni.quarry.core.operation.bucket;

import lombok.Value;
import win.ixuni.quarry.core.operation.Operation;

/**
 * 删除 Bucket 操作，bucket 必须为空
 */
@Value
public class DeleteBucketOperation implements Operation<Void> {

    String bucketName;
}

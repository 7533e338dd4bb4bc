package win.ixuni.quarry.core.operation.bucket;

import lombok.Value;
import win.ixuni.quarry.core.operation.Operation;

@Value
public class BucketExistsOperation implements Operation<Boolean> {

    String bucketName;
}

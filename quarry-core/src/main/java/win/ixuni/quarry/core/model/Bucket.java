package win.ixuni.quarry.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Bucket 模型
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Bucket {

    /**
     * Bucket名称
     */
    private String name;

    /**
     * Creation time
     */
    private Instant creationDate;

    /**
     * Owning driver instance name
     */
    private String driverName;
}
